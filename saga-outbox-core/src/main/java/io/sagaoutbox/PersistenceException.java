package io.sagaoutbox;

/**
 * Unchecked wrapper for failures of the persistence boundary (connections, queries,
 * commits).
 */
public class PersistenceException extends RuntimeException {
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
