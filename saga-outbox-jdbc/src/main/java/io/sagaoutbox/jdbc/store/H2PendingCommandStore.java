package io.sagaoutbox.jdbc.store;

import java.util.List;

/**
 * H2 pending command store. Primarily for testing.
 */
public final class H2PendingCommandStore extends AbstractJdbcPendingCommandStore {

  public H2PendingCommandStore() {
    super();
  }

  public H2PendingCommandStore(String commandTable, String scheduledCommandTable) {
    super(commandTable, scheduledCommandTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2PendingCommandStore withTableNames(String commandTable, String scheduledCommandTable) {
    return new H2PendingCommandStore(commandTable, scheduledCommandTable);
  }
}
