package io.sagaoutbox;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Drains pending commands recorded by process managers to the delivery channels.
 *
 * @see io.sagaoutbox.publish.OutboxCommandPublisher
 */
public interface CommandPublisher {

  /**
   * Delivers every pending command of one process manager that exists when the call
   * starts, then removes the delivered rows.
   *
   * @param processManagerId the owning instance; must not be {@code null} or nil
   * @throws IllegalArgumentException  if the id is invalid (no I/O is performed)
   * @throws DeliveryFailureException  if a delivery channel rejects a send
   * @throws PersistenceException      if the store cannot be read or written
   */
  void flushCommands(UUID processManagerId);

  /**
   * Flushes every process manager that has pending commands, repeating until a pass
   * finds none. Runs asynchronously; the returned future completes when a pass comes back
   * empty, or exceptionally with the first flush failure.
   */
  CompletableFuture<Void> enqueueAll();
}
