package io.sagaoutbox.spi;

import io.sagaoutbox.model.PendingCommand;
import io.sagaoutbox.model.PendingScheduledCommand;
import io.sagaoutbox.model.RemoveResult;

import java.sql.Connection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence contract for pending commands, keyed by owning process manager.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Inserts join the caller's transaction; deletes are expected
 * to run in auto-commit mode so each one is independently atomic.
 *
 * @see io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore
 */
public interface PendingCommandStore {

  /**
   * Appends immediate commands. The store assigns each row's {@code id} from a strictly
   * increasing sequence, in list order.
   *
   * @param conn     the JDBC connection (typically within a transaction)
   * @param commands rows to insert; their {@code id} is ignored
   */
  void insertCommands(Connection conn, List<PendingCommand> commands);

  /**
   * Appends scheduled commands. Same contract as {@link #insertCommands}.
   *
   * @param conn     the JDBC connection (typically within a transaction)
   * @param commands rows to insert; their {@code id} is ignored
   */
  void insertScheduledCommands(Connection conn, List<PendingScheduledCommand> commands);

  /**
   * Lists the immediate commands of one process manager.
   *
   * @return rows ordered by {@code id} ascending
   */
  List<PendingCommand> listCommands(Connection conn, UUID processManagerId);

  /**
   * Lists the scheduled commands of one process manager.
   *
   * @return rows ordered by {@code id} ascending
   */
  List<PendingScheduledCommand> listScheduledCommands(Connection conn, UUID processManagerId);

  /**
   * Deletes one immediate command.
   *
   * @return {@link RemoveResult#ALREADY_GONE} if no row with this id exists; never fails
   *     because of a concurrent delete
   */
  RemoveResult removeCommand(Connection conn, long id);

  /**
   * Deletes one scheduled command. Same contract as {@link #removeCommand}.
   */
  RemoveResult removeScheduledCommand(Connection conn, long id);

  /**
   * Probes for owners of outstanding immediate commands, oldest rows first.
   *
   * @param limit          maximum number of ids to return (&gt; 0)
   * @param excludedOwners owners to skip, such as those whose flush already failed in the
   *                       current sweep; may be empty
   * @return distinct process manager ids, possibly empty
   */
  List<UUID> findOwnersWithCommands(Connection conn, int limit, Set<UUID> excludedOwners);

  /**
   * Probes for owners of outstanding scheduled commands. Same contract as
   * {@link #findOwnersWithCommands(Connection, int, Set)}.
   */
  List<UUID> findOwnersWithScheduledCommands(Connection conn, int limit, Set<UUID> excludedOwners);

  default List<UUID> findOwnersWithCommands(Connection conn, int limit) {
    return findOwnersWithCommands(conn, limit, Set.of());
  }

  default List<UUID> findOwnersWithScheduledCommands(Connection conn, int limit) {
    return findOwnersWithScheduledCommands(conn, limit, Set.of());
  }
}
