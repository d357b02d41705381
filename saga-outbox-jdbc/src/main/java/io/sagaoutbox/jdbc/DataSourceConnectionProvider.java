package io.sagaoutbox.jdbc;

import io.sagaoutbox.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Borrows one connection from a {@link DataSource} per save, flush or sweep probe.
 *
 * <p>The caller closes each connection, which hands it back to the pool when the data
 * source is pooled (HikariCP in the Spring Boot starter).
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
