package io.sagaoutbox;

import java.util.Objects;
import java.util.UUID;

/**
 * Describes a flush failure that happened after a process manager's state and commands
 * were committed.
 *
 * @param processManagerType the concrete process manager class
 * @param processManagerId   the instance whose commands could not be flushed
 * @param exception          the failure raised by the flush
 */
public record CommandPublisherExceptionContext(
    Class<? extends ProcessManager> processManagerType,
    UUID processManagerId,
    Exception exception
) {
  public CommandPublisherExceptionContext {
    Objects.requireNonNull(processManagerType, "processManagerType");
    Objects.requireNonNull(processManagerId, "processManagerId");
    Objects.requireNonNull(exception, "exception");
  }
}
