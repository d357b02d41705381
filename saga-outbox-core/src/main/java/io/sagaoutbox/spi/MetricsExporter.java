package io.sagaoutbox.spi;

/**
 * Observability hook for exporting outbox counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Counts commands recorded by a committed save (immediate and scheduled).
   */
  void incrementCommandsPersisted(int count);

  /**
   * Counts immediate commands accepted by the message bus.
   */
  void incrementCommandsSent(int count);

  /**
   * Counts scheduled commands accepted by the scheduled message bus.
   */
  void incrementScheduledCommandsSent();

  /**
   * Counts deletes that found the row already removed by a concurrent flush.
   */
  void incrementRemoveAlreadyGone();

  /**
   * Counts flushes that ended with an exception.
   */
  void incrementFlushFailure();

  /**
   * Counts flush failures an exception handler marked as handled.
   */
  default void incrementFlushFailureHandled() {
  }

  /**
   * Counts exception handlers that threw while handling a flush failure.
   */
  default void incrementHandlerFailure() {
  }

  /**
   * Counts sweep passes (one probe round plus its flushes).
   */
  default void incrementSweepPass() {
  }

  /**
   * Records the duration of one flush.
   *
   * @param durationMs flush duration in milliseconds (always non-negative)
   */
  default void recordFlushDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCommandsPersisted(int count) {
    }

    @Override
    public void incrementCommandsSent(int count) {
    }

    @Override
    public void incrementScheduledCommandsSent() {
    }

    @Override
    public void incrementRemoveAlreadyGone() {
    }

    @Override
    public void incrementFlushFailure() {
    }
  }
}
