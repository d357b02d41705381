package io.sagaoutbox.jdbc.store;

import java.util.List;

/**
 * PostgreSQL pending command store. Expects {@code BIGSERIAL} ids.
 */
public final class PostgresPendingCommandStore extends AbstractJdbcPendingCommandStore {

  public PostgresPendingCommandStore() {
    super();
  }

  public PostgresPendingCommandStore(String commandTable, String scheduledCommandTable) {
    super(commandTable, scheduledCommandTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresPendingCommandStore withTableNames(String commandTable, String scheduledCommandTable) {
    return new PostgresPendingCommandStore(commandTable, scheduledCommandTable);
  }
}
