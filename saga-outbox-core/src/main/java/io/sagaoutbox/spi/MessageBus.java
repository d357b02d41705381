package io.sagaoutbox.spi;

import io.sagaoutbox.Envelope;

import java.util.List;

/**
 * Immediate delivery channel.
 *
 * <p>Receives all pending commands of one process manager as a single ordered batch so
 * transports that support batching or transactions can use them. Delivery is
 * at-least-once: the same envelope may arrive again after a crash, and consumers
 * deduplicate by {@link Envelope#messageId()}.
 */
@FunctionalInterface
public interface MessageBus {

  /**
   * Sends an ordered batch.
   *
   * @param envelopes commands in production order, never empty
   * @throws Exception if the batch was not accepted; the commands stay pending
   */
  void send(List<Envelope> envelopes) throws Exception;
}
