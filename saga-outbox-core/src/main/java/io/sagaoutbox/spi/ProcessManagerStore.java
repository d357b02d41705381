package io.sagaoutbox.spi;

import io.sagaoutbox.ProcessManager;

import java.sql.Connection;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists process manager state under an optimistic-concurrency version token.
 *
 * @param <T> the process manager type
 * @see io.sagaoutbox.jdbc.state.JdbcProcessManagerStore
 */
public interface ProcessManagerStore<T extends ProcessManager> {

  /**
   * Loads a process manager.
   *
   * @return the instance with its stored version, or empty if unknown
   */
  Optional<T> find(Connection conn, UUID id);

  /**
   * Inserts the instance when its version is {@code 0}, otherwise updates it if the stored
   * version still equals {@link ProcessManager#version()}. Does not modify the instance.
   *
   * @return the version now stored
   * @throws io.sagaoutbox.ConcurrencyConflictException if the stored version differs or the
   *     id already exists on insert
   */
  long upsert(Connection conn, T processManager);
}
