package io.sagaoutbox.jdbc.store;

import io.sagaoutbox.jdbc.JdbcTemplate;
import io.sagaoutbox.jdbc.TableNames;
import io.sagaoutbox.model.PendingCommand;
import io.sagaoutbox.model.PendingScheduledCommand;
import io.sagaoutbox.model.RemoveResult;
import io.sagaoutbox.spi.PendingCommandStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Base JDBC pending command store with standard SQL implementations.
 *
 * <p>Rows are ordered by the table's auto-increment {@code id}, assigned by the database
 * on insert. Deletes are by primary key and report {@link RemoveResult#ALREADY_GONE} when
 * no row matched.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore}.
 * Service-loaded instances use the default table names; call {@link #withTableNames}
 * for others.
 *
 * @see JdbcPendingCommandStores
 */
public abstract class AbstractJdbcPendingCommandStore implements PendingCommandStore {

  protected static final JdbcTemplate.RowMapper<PendingCommand> COMMAND_ROW_MAPPER = rs -> new PendingCommand(
      rs.getLong("id"),
      UUID.fromString(rs.getString("process_manager_id")),
      rs.getString("message_id"),
      rs.getString("correlation_id"),
      rs.getString("command_json"));

  protected static final JdbcTemplate.RowMapper<PendingScheduledCommand> SCHEDULED_ROW_MAPPER =
      rs -> new PendingScheduledCommand(
          rs.getLong("id"),
          UUID.fromString(rs.getString("process_manager_id")),
          rs.getString("message_id"),
          rs.getString("correlation_id"),
          rs.getString("command_json"),
          JdbcTemplate.getInstant(rs, "scheduled_time_utc"));

  private static final JdbcTemplate.RowMapper<UUID> OWNER_ROW_MAPPER =
      rs -> UUID.fromString(rs.getString("process_manager_id"));

  private final String commandTable;
  private final String scheduledCommandTable;

  protected AbstractJdbcPendingCommandStore() {
    this(TableNames.DEFAULT_COMMAND_TABLE, TableNames.DEFAULT_SCHEDULED_COMMAND_TABLE);
  }

  protected AbstractJdbcPendingCommandStore(String commandTable, String scheduledCommandTable) {
    TableNames.validatePendingTables(commandTable, scheduledCommandTable);
    this.commandTable = commandTable;
    this.scheduledCommandTable = scheduledCommandTable;
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect that reads and writes the given tables.
   */
  public abstract AbstractJdbcPendingCommandStore withTableNames(String commandTable, String scheduledCommandTable);

  protected String commandTable() {
    return commandTable;
  }

  protected String scheduledCommandTable() {
    return scheduledCommandTable;
  }

  @Override
  public void insertCommands(Connection conn, List<PendingCommand> commands) {
    String sql = "INSERT INTO " + commandTable() +
        " (process_manager_id, message_id, correlation_id, command_json) VALUES (?,?,?,?)";
    List<Object[]> rows = new ArrayList<>(commands.size());
    for (PendingCommand c : commands) {
      rows.add(new Object[]{c.processManagerId().toString(), c.messageId(), c.correlationId(), c.commandJson()});
    }
    JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public void insertScheduledCommands(Connection conn, List<PendingScheduledCommand> commands) {
    String sql = "INSERT INTO " + scheduledCommandTable() +
        " (process_manager_id, message_id, correlation_id, command_json, scheduled_time_utc)" +
        " VALUES (?,?,?,?,?)";
    List<Object[]> rows = new ArrayList<>(commands.size());
    for (PendingScheduledCommand c : commands) {
      rows.add(new Object[]{c.processManagerId().toString(), c.messageId(), c.correlationId(),
          c.commandJson(), c.scheduledTimeUtc()});
    }
    JdbcTemplate.batchUpdate(conn, sql, rows);
  }

  @Override
  public List<PendingCommand> listCommands(Connection conn, UUID processManagerId) {
    String sql = "SELECT id, process_manager_id, message_id, correlation_id, command_json FROM " +
        commandTable() + " WHERE process_manager_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, COMMAND_ROW_MAPPER, processManagerId.toString());
  }

  @Override
  public List<PendingScheduledCommand> listScheduledCommands(Connection conn, UUID processManagerId) {
    String sql = "SELECT id, process_manager_id, message_id, correlation_id, command_json, scheduled_time_utc" +
        " FROM " + scheduledCommandTable() + " WHERE process_manager_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, SCHEDULED_ROW_MAPPER, processManagerId.toString());
  }

  @Override
  public RemoveResult removeCommand(Connection conn, long id) {
    return RemoveResult.ofRowCount(
        JdbcTemplate.update(conn, "DELETE FROM " + commandTable() + " WHERE id=?", id));
  }

  @Override
  public RemoveResult removeScheduledCommand(Connection conn, long id) {
    return RemoveResult.ofRowCount(
        JdbcTemplate.update(conn, "DELETE FROM " + scheduledCommandTable() + " WHERE id=?", id));
  }

  @Override
  public List<UUID> findOwnersWithCommands(Connection conn, int limit, Set<UUID> excludedOwners) {
    return findOwners(conn, commandTable(), limit, excludedOwners);
  }

  @Override
  public List<UUID> findOwnersWithScheduledCommands(Connection conn, int limit, Set<UUID> excludedOwners) {
    return findOwners(conn, scheduledCommandTable(), limit, excludedOwners);
  }

  /**
   * Owners of the oldest {@code limit} rows not held by an excluded owner, deduplicated,
   * oldest first. May return fewer than {@code limit} ids when one owner holds several of
   * those rows.
   */
  protected List<UUID> findOwners(Connection conn, String table, int limit, Set<UUID> excludedOwners) {
    StringBuilder sql = new StringBuilder("SELECT process_manager_id FROM ").append(table);
    List<Object> params = new ArrayList<>(excludedOwners.size() + 1);
    if (!excludedOwners.isEmpty()) {
      sql.append(" WHERE process_manager_id NOT IN (")
          .append(String.join(",", Collections.nCopies(excludedOwners.size(), "?")))
          .append(')');
      excludedOwners.forEach(owner -> params.add(owner.toString()));
    }
    sql.append(" ORDER BY id LIMIT ?");
    params.add(limit);
    return List.copyOf(new LinkedHashSet<>(
        JdbcTemplate.query(conn, sql.toString(), OWNER_ROW_MAPPER, params.toArray())));
  }
}
