package io.sagaoutbox.jdbc;

import io.sagaoutbox.PersistenceException;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class JdbcStoreException extends PersistenceException {
  public JdbcStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether the underlying failure is an integrity constraint violation (SQLState class 23),
   * such as a duplicate primary key.
   */
  public boolean isIntegrityViolation() {
    for (Throwable t = getCause(); t != null; t = t.getCause()) {
      if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
        return true;
      }
    }
    return false;
  }
}
