package io.sagaoutbox;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for long-lived process managers (sagas) whose state transitions produce
 * commands for external consumers.
 *
 * <p>Subclasses record the commands a transition decides to send via
 * {@link #addCommand(Object)} and {@link #addScheduledCommand(Object, Instant)}.
 * {@link ProcessManagerDataContext} drains both buffers in the same transaction that
 * persists the new state, so the commands are never sent unless the state change commits.
 *
 * <p>The {@link #version()} token guards concurrent updates: {@code 0} means the instance
 * has never been persisted. Instances are not thread-safe; a single transition owns an
 * instance at a time.
 *
 * @see ProcessManagerDataContext
 */
public abstract class ProcessManager {
  private final UUID id;
  private long version;
  private final List<Object> pendingCommands = new ArrayList<>();
  private final List<ScheduledCommand> pendingScheduledCommands = new ArrayList<>();

  /**
   * Creates a new, never-persisted process manager.
   *
   * @param id unique instance id; must not be the nil UUID
   */
  protected ProcessManager(UUID id) {
    this(id, 0L);
  }

  /**
   * Restores a persisted process manager.
   *
   * @param id      unique instance id; must not be the nil UUID
   * @param version optimistic-concurrency token read from the store
   */
  protected ProcessManager(UUID id, long version) {
    this.id = ProcessManagerIds.requireValid(id, "id");
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0, got: " + version);
    }
    this.version = version;
  }

  public final UUID id() {
    return id;
  }

  public final long version() {
    return version;
  }

  /**
   * Adopts the version token written by the last successful commit.
   * Called by {@link ProcessManagerDataContext}; business code has no reason to call it.
   *
   * @param version the new token, strictly greater than the current one
   */
  public final void markPersisted(long version) {
    if (version <= this.version) {
      throw new IllegalArgumentException(
          "version must advance: current=" + this.version + ", new=" + version);
    }
    this.version = version;
  }

  protected final void addCommand(Object command) {
    pendingCommands.add(Objects.requireNonNull(command, "command"));
  }

  protected final void addScheduledCommand(Object command, Instant scheduledTimeUtc) {
    pendingScheduledCommands.add(new ScheduledCommand(command, scheduledTimeUtc));
  }

  /**
   * Returns every command produced since the last drain, in production order, and clears
   * the buffer.
   */
  public final List<Object> drainPendingCommands() {
    List<Object> drained = List.copyOf(pendingCommands);
    pendingCommands.clear();
    return drained;
  }

  /**
   * Returns every scheduled command produced since the last drain, in production order,
   * and clears the buffer.
   */
  public final List<ScheduledCommand> drainPendingScheduledCommands() {
    List<ScheduledCommand> drained = List.copyOf(pendingScheduledCommands);
    pendingScheduledCommands.clear();
    return drained;
  }

  /**
   * A command that must not be released before {@code scheduledTimeUtc}.
   */
  public record ScheduledCommand(Object command, Instant scheduledTimeUtc) {
    public ScheduledCommand {
      Objects.requireNonNull(command, "command");
      Objects.requireNonNull(scheduledTimeUtc, "scheduledTimeUtc");
    }
  }
}
