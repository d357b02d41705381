package io.sagaoutbox.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.sagaoutbox.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code saga.outbox.commands.persisted}: commands committed with a transition</li>
 *   <li>{@code saga.outbox.commands.sent}: immediate commands handed to the message bus</li>
 *   <li>{@code saga.outbox.scheduled.sent}: scheduled commands handed to the scheduler</li>
 *   <li>{@code saga.outbox.remove.already_gone}: deletes that lost a race with another flush</li>
 *   <li>{@code saga.outbox.flush.failure}: flushes that threw</li>
 *   <li>{@code saga.outbox.flush.handled}: flush failures swallowed by the exception handler</li>
 *   <li>{@code saga.outbox.handler.failure}: exception handlers that threw themselves</li>
 *   <li>{@code saga.outbox.sweep.passes}: sweep probe passes</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code saga.outbox.flush.duration}: wall time of each flush</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "saga.outbox";

  private final MeterRegistry registry;
  private final Counter commandsPersisted;
  private final Counter commandsSent;
  private final Counter scheduledSent;
  private final Counter removeAlreadyGone;
  private final Counter flushFailure;
  private final Counter flushHandled;
  private final Counter handlerFailure;
  private final Counter sweepPasses;
  private final Timer flushDuration;
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.saga"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.commandsPersisted = Counter.builder(namePrefix + ".commands.persisted")
        .description("Commands committed together with a process manager transition")
        .register(registry);
    this.commandsSent = Counter.builder(namePrefix + ".commands.sent")
        .description("Immediate commands handed to the message bus")
        .register(registry);
    this.scheduledSent = Counter.builder(namePrefix + ".scheduled.sent")
        .description("Scheduled commands handed to the scheduled message bus")
        .register(registry);
    this.removeAlreadyGone = Counter.builder(namePrefix + ".remove.already_gone")
        .description("Pending rows already deleted by a concurrent flush")
        .register(registry);
    this.flushFailure = Counter.builder(namePrefix + ".flush.failure")
        .description("Flushes that failed")
        .register(registry);
    this.flushHandled = Counter.builder(namePrefix + ".flush.handled")
        .description("Flush failures handled by the exception handler")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".handler.failure")
        .description("Exception handler invocations that threw")
        .register(registry);
    this.sweepPasses = Counter.builder(namePrefix + ".sweep.passes")
        .description("Sweep probe passes")
        .register(registry);
    this.flushDuration = Timer.builder(namePrefix + ".flush.duration")
        .description("Duration of a single flush")
        .register(registry);
  }

  @Override
  public void incrementCommandsPersisted(int count) {
    if (closed) return;
    commandsPersisted.increment(count);
  }

  @Override
  public void incrementCommandsSent(int count) {
    if (closed) return;
    commandsSent.increment(count);
  }

  @Override
  public void incrementScheduledCommandsSent() {
    if (closed) return;
    scheduledSent.increment();
  }

  @Override
  public void incrementRemoveAlreadyGone() {
    if (closed) return;
    removeAlreadyGone.increment();
  }

  @Override
  public void incrementFlushFailure() {
    if (closed) return;
    flushFailure.increment();
  }

  @Override
  public void incrementFlushFailureHandled() {
    if (closed) return;
    flushHandled.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementSweepPass() {
    if (closed) return;
    sweepPasses.increment();
  }

  @Override
  public void recordFlushDurationMs(long durationMs) {
    if (closed) return;
    flushDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(commandsPersisted, commandsSent, scheduledSent, removeAlreadyGone,
        flushFailure, flushHandled, handlerFailure, sweepPasses, flushDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
