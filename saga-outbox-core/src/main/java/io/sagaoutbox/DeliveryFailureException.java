package io.sagaoutbox;

import java.util.UUID;

/**
 * Thrown when a delivery channel rejects a send during a flush. The rows that were not
 * delivered stay in the store for the next flush.
 */
public class DeliveryFailureException extends RuntimeException {
  private final UUID processManagerId;

  public DeliveryFailureException(UUID processManagerId, String message, Throwable cause) {
    super(message, cause);
    this.processManagerId = processManagerId;
  }

  public UUID processManagerId() {
    return processManagerId;
  }
}
