package io.sagaoutbox.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Default names of the saga outbox tables and the identifier rule every configured name
 * must satisfy before it is spliced into SQL text.
 *
 * <p>Only unquoted identifiers are accepted: a letter or underscore followed by letters,
 * digits or underscores. Schema-qualified and quoted names are rejected.
 */
public final class TableNames {
  /** Immediate pending commands. */
  public static final String DEFAULT_COMMAND_TABLE = "saga_pending_command";
  /** Pending commands with a release time. */
  public static final String DEFAULT_SCHEDULED_COMMAND_TABLE = "saga_pending_scheduled_command";
  /** Versioned process manager state. */
  public static final String DEFAULT_PROCESS_MANAGER_TABLE = "saga_process_manager";

  private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  private TableNames() {}

  /**
   * @return {@code tableName}, unchanged
   * @throws IllegalArgumentException if it is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Table name must be a plain SQL identifier: '" + tableName + "'");
    }
    return tableName;
  }

  /**
   * Validates the two pending command tables. They must differ, ignoring case, since both
   * are probed and deleted from by row id.
   */
  public static void validatePendingTables(String commandTable, String scheduledCommandTable) {
    validate(commandTable);
    validate(scheduledCommandTable);
    if (commandTable.equalsIgnoreCase(scheduledCommandTable)) {
      throw new IllegalArgumentException(
          "Immediate and scheduled commands need separate tables, both were '" + commandTable + "'");
    }
  }
}
