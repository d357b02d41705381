package io.sagaoutbox.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted command awaiting handoff to the scheduled delivery channel, which releases
 * it no earlier than {@code scheduledTimeUtc}.
 *
 * @see PendingCommand
 */
public record PendingScheduledCommand(
    long id,
    UUID processManagerId,
    String messageId,
    String correlationId,
    String commandJson,
    Instant scheduledTimeUtc
) {
  public PendingScheduledCommand {
    Objects.requireNonNull(processManagerId, "processManagerId");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(commandJson, "commandJson");
    Objects.requireNonNull(scheduledTimeUtc, "scheduledTimeUtc");
  }

  public static PendingScheduledCommand unsaved(UUID processManagerId, String messageId,
      String correlationId, String commandJson, Instant scheduledTimeUtc) {
    return new PendingScheduledCommand(
        0L, processManagerId, messageId, correlationId, commandJson, scheduledTimeUtc);
  }
}
