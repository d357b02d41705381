package io.sagaoutbox.jdbc.state;

import io.sagaoutbox.ConcurrencyConflictException;
import io.sagaoutbox.ProcessManager;
import io.sagaoutbox.jdbc.JdbcStoreException;
import io.sagaoutbox.jdbc.JdbcTemplate;
import io.sagaoutbox.jdbc.TableNames;
import io.sagaoutbox.spi.ProcessManagerStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC {@link ProcessManagerStore} keeping one row per process manager with an integer
 * version column for optimistic concurrency.
 *
 * <p>A process manager at version {@code 0} is inserted at version {@code 1}. Any other is
 * updated only if the stored version still equals its own, and the stored version is
 * incremented. A duplicate insert or a stale update raises
 * {@link ConcurrencyConflictException}.
 *
 * <p>Rows are scoped by {@code process_manager_type}, so several process manager types
 * may share one table.
 *
 * @param <T> the process manager type
 */
public final class JdbcProcessManagerStore<T extends ProcessManager> implements ProcessManagerStore<T> {

  private final String tableName;
  private final String typeName;
  private final ProcessManagerCodec<T> codec;

  public JdbcProcessManagerStore(Class<T> processManagerType, ProcessManagerCodec<T> codec) {
    this(TableNames.DEFAULT_PROCESS_MANAGER_TABLE, processManagerType, codec);
  }

  public JdbcProcessManagerStore(String tableName, Class<T> processManagerType, ProcessManagerCodec<T> codec) {
    this.tableName = TableNames.validate(tableName);
    this.typeName = Objects.requireNonNull(processManagerType, "processManagerType").getName();
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public Optional<T> find(Connection conn, UUID id) {
    Objects.requireNonNull(id, "id");
    String sql = "SELECT state_json, version FROM " + tableName +
        " WHERE id=? AND process_manager_type=?";
    List<T> found = JdbcTemplate.query(conn, sql,
        rs -> codec.decode(id, rs.getLong("version"), rs.getString("state_json")),
        id.toString(), typeName);
    return found.stream().findFirst();
  }

  @Override
  public long upsert(Connection conn, T processManager) {
    UUID id = processManager.id();
    long expected = processManager.version();
    String state = codec.encode(processManager);
    Instant now = Instant.now();

    if (expected == 0L) {
      String sql = "INSERT INTO " + tableName +
          " (id, process_manager_type, state_json, version, updated_at) VALUES (?,?,?,?,?)";
      try {
        JdbcTemplate.update(conn, sql, id.toString(), typeName, state, 1L, now);
      } catch (JdbcStoreException e) {
        if (e.isIntegrityViolation()) {
          throw new ConcurrencyConflictException(id, expected, e);
        }
        throw e;
      }
      return 1L;
    }

    String sql = "UPDATE " + tableName +
        " SET state_json=?, version=version+1, updated_at=?" +
        " WHERE id=? AND process_manager_type=? AND version=?";
    int updated = JdbcTemplate.update(conn, sql, state, now, id.toString(), typeName, expected);
    if (updated == 0) {
      throw new ConcurrencyConflictException(id, expected);
    }
    return expected + 1;
  }
}
