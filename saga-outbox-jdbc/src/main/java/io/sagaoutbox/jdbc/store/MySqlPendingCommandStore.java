package io.sagaoutbox.jdbc.store;

import java.util.List;

/**
 * MySQL pending command store. Also serves TiDB and MariaDB.
 *
 * <p>Requires {@code rewriteBatchedStatements=true} on the connection URL for inserts of
 * many rows to travel as one multi-row statement.
 */
public final class MySqlPendingCommandStore extends AbstractJdbcPendingCommandStore {

  public MySqlPendingCommandStore() {
    super();
  }

  public MySqlPendingCommandStore(String commandTable, String scheduledCommandTable) {
    super(commandTable, scheduledCommandTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public MySqlPendingCommandStore withTableNames(String commandTable, String scheduledCommandTable) {
    return new MySqlPendingCommandStore(commandTable, scheduledCommandTable);
  }
}
