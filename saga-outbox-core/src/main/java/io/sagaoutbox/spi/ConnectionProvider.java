package io.sagaoutbox.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for the save transaction, flushes and sweep probes.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.sagaoutbox.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
