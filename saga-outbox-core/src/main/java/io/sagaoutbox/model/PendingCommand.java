package io.sagaoutbox.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A persisted command awaiting immediate delivery.
 *
 * <p>{@code id} is assigned by the store on insert from a strictly increasing sequence and
 * defines delivery order within one process manager. Rows passed to
 * {@link io.sagaoutbox.spi.PendingCommandStore#insertCommands} carry {@code 0}.
 *
 * @see io.sagaoutbox.spi.PendingCommandStore
 */
public record PendingCommand(
    long id,
    UUID processManagerId,
    String messageId,
    String correlationId,
    String commandJson
) {
  public PendingCommand {
    Objects.requireNonNull(processManagerId, "processManagerId");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(commandJson, "commandJson");
  }

  /**
   * Creates a row that has not been inserted yet.
   */
  public static PendingCommand unsaved(UUID processManagerId, String messageId,
      String correlationId, String commandJson) {
    return new PendingCommand(0L, processManagerId, messageId, correlationId, commandJson);
  }
}
