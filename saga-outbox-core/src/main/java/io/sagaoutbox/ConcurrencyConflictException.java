package io.sagaoutbox;

import java.util.UUID;

/**
 * Thrown when a process manager's stored state changed since it was read, or an instance
 * with the same id was inserted concurrently. The transition must be recomputed from
 * fresh state.
 */
public class ConcurrencyConflictException extends RuntimeException {
  private final UUID processManagerId;
  private final long expectedVersion;

  public ConcurrencyConflictException(UUID processManagerId, long expectedVersion) {
    this(processManagerId, expectedVersion, null);
  }

  public ConcurrencyConflictException(UUID processManagerId, long expectedVersion, Throwable cause) {
    super("Process manager " + processManagerId + " was modified concurrently (expected version "
        + expectedVersion + ")", cause);
    this.processManagerId = processManagerId;
    this.expectedVersion = expectedVersion;
  }

  public UUID processManagerId() {
    return processManagerId;
  }

  public long expectedVersion() {
    return expectedVersion;
  }
}
