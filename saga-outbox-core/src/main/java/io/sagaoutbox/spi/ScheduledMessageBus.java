package io.sagaoutbox.spi;

import io.sagaoutbox.ScheduledEnvelope;

/**
 * Scheduled delivery channel. Responsible for holding each command until its
 * scheduled time; called once per command.
 */
@FunctionalInterface
public interface ScheduledMessageBus {

  /**
   * @throws Exception if the command was not accepted; it stays pending
   */
  void send(ScheduledEnvelope envelope) throws Exception;
}
