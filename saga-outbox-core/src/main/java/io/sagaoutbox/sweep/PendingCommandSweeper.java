package io.sagaoutbox.sweep;

import io.sagaoutbox.publish.OutboxCommandPublisher;
import io.sagaoutbox.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link OutboxCommandPublisher#sweep()} on a fixed delay, so commands stranded by
 * a crash between commit and flush are delivered without an explicit trigger.
 *
 * <p>A failed sweep is logged and retried on the next tick. {@link #start()} and
 * {@link #close()} are synchronized.
 */
public final class PendingCommandSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PendingCommandSweeper.class.getName());

  private final OutboxCommandPublisher commandPublisher;
  private final long initialDelayMs;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private PendingCommandSweeper(Builder builder) {
    this.commandPublisher = Objects.requireNonNull(builder.commandPublisher, "commandPublisher");
    if (builder.initialDelayMs < 0L) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.initialDelayMs = builder.initialDelayMs;
    this.intervalMs = builder.intervalMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PendingCommandSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("saga-outbox-sweeper-"));
    sweepTask = scheduler.scheduleWithFixedDelay(
      this::sweepOnce, initialDelayMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one sweep. Called by the scheduler; may also be invoked directly.
   *
   * @return flushes performed, or {@code -1} if the sweep failed or the sweeper is closed
   */
  public int sweepOnce() {
    if (closed) {
      return -1;
    }
    try {
      int flushes = commandPublisher.sweep();
      if (flushes > 0) {
        logger.log(Level.FINE, "Sweep flushed {0} process manager(s)", flushes);
      }
      return flushes;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Sweep failed", t);
      return -1;
    }
  }

  public boolean isRunning() {
    return sweepTask != null && !closed;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  public static final class Builder {
    private OutboxCommandPublisher commandPublisher;
    private long initialDelayMs = 1000L;
    private long intervalMs = 5000L;

    private Builder() {
    }

    public Builder commandPublisher(OutboxCommandPublisher commandPublisher) {
      this.commandPublisher = commandPublisher;
      return this;
    }

    /** Delay before the first sweep. Defaults to 1000 ms. */
    public Builder initialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
      return this;
    }

    /** Delay between the end of one sweep and the start of the next. Defaults to 5000 ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public PendingCommandSweeper build() {
      return new PendingCommandSweeper(this);
    }
  }
}
