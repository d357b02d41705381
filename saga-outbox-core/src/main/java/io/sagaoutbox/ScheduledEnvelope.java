package io.sagaoutbox;

import java.time.Instant;
import java.util.Objects;

/**
 * An {@link Envelope} that the scheduled delivery channel must hold until
 * {@code scheduledTimeUtc}.
 */
public record ScheduledEnvelope(Envelope envelope, Instant scheduledTimeUtc) {

  public ScheduledEnvelope {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(scheduledTimeUtc, "scheduledTimeUtc");
  }
}
