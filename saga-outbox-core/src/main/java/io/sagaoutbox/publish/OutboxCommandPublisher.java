package io.sagaoutbox.publish;

import io.sagaoutbox.CommandPublisher;
import io.sagaoutbox.DeliveryFailureException;
import io.sagaoutbox.Envelope;
import io.sagaoutbox.PersistenceException;
import io.sagaoutbox.ProcessManagerIds;
import io.sagaoutbox.ScheduledEnvelope;
import io.sagaoutbox.model.PendingCommand;
import io.sagaoutbox.model.PendingScheduledCommand;
import io.sagaoutbox.model.RemoveResult;
import io.sagaoutbox.spi.ConnectionProvider;
import io.sagaoutbox.spi.MessageBus;
import io.sagaoutbox.spi.MessageSerializer;
import io.sagaoutbox.spi.MetricsExporter;
import io.sagaoutbox.spi.PendingCommandStore;
import io.sagaoutbox.spi.ScheduledMessageBus;
import io.sagaoutbox.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains pending commands from a {@link PendingCommandStore} to the delivery channels.
 *
 * <p>{@link #flushCommands(UUID)} delivers one process manager's immediate commands as a
 * single ordered batch, then its scheduled commands one at a time, deleting each row only
 * after its send returned. Concurrent flushes of the same instance are safe without
 * locking: a delete that finds the row gone counts as done.
 *
 * <p>{@link #sweep()} and {@link #enqueueAll()} recover commands left behind by a crash
 * between commit and flush. Each pass probes for up to {@code probeLimit} owners of each
 * row kind, flushes them concurrently on the worker pool, and repeats until a pass finds
 * nothing. Owners whose flush failed are left out of later passes of the same sweep.
 * Under a producer that keeps inserting faster than flushes drain, the loop does not
 * terminate.
 *
 * <p>Cancellation follows thread interruption: an interrupted flush stops before its
 * next I/O step with a {@link CancellationException}. Rows sent but not yet deleted are
 * delivered again by the next flush.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see io.sagaoutbox.sweep.PendingCommandSweeper
 */
public final class OutboxCommandPublisher implements CommandPublisher, AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxCommandPublisher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final PendingCommandStore store;
  private final MessageSerializer serializer;
  private final MessageBus messageBus;
  private final ScheduledMessageBus scheduledMessageBus;
  private final MetricsExporter metrics;
  private final int probeLimit;
  private final ExecutorService workers;
  private final ExecutorService sweepExecutor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private OutboxCommandPublisher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.pendingCommandStore, "pendingCommandStore");
    this.serializer = Objects.requireNonNull(builder.serializer, "serializer");
    this.messageBus = Objects.requireNonNull(builder.messageBus, "messageBus");
    this.scheduledMessageBus = Objects.requireNonNull(builder.scheduledMessageBus, "scheduledMessageBus");
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0, got: " + builder.workerCount);
    }
    if (builder.probeLimit <= 0) {
      throw new IllegalArgumentException("probeLimit must be > 0, got: " + builder.probeLimit);
    }
    this.metrics = builder.metrics == null ? MetricsExporter.NOOP : builder.metrics;
    this.probeLimit = builder.probeLimit;
    this.workers = Executors.newFixedThreadPool(
        builder.workerCount, new DaemonThreadFactory("saga-outbox-flush-"));
    this.sweepExecutor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("saga-outbox-sweep-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void flushCommands(UUID processManagerId) {
    ProcessManagerIds.requireValid(processManagerId, "processManagerId");
    long start = System.nanoTime();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      flushPendingCommands(conn, processManagerId);
      flushPendingScheduledCommands(conn, processManagerId);
    } catch (SQLException e) {
      metrics.incrementFlushFailure();
      throw new PersistenceException("Failed to flush commands for processManagerId=" + processManagerId, e);
    } catch (RuntimeException e) {
      metrics.incrementFlushFailure();
      throw e;
    } finally {
      metrics.recordFlushDurationMs(Math.max(0L, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)));
    }
  }

  private void flushPendingCommands(Connection conn, UUID processManagerId) {
    checkNotCancelled(processManagerId);
    List<PendingCommand> commands = store.listCommands(conn, processManagerId);
    if (commands.isEmpty()) {
      return;
    }
    List<Envelope> envelopes = new ArrayList<>(commands.size());
    for (PendingCommand command : commands) {
      envelopes.add(restoreEnvelope(command.messageId(), command.correlationId(), command.commandJson()));
    }

    checkNotCancelled(processManagerId);
    deliver(processManagerId, () -> messageBus.send(List.copyOf(envelopes)),
        envelopes.size() + " command(s)");
    metrics.incrementCommandsSent(envelopes.size());

    for (PendingCommand command : commands) {
      checkNotCancelled(processManagerId);
      recordRemoval(store.removeCommand(conn, command.id()), command.messageId());
    }
  }

  private void flushPendingScheduledCommands(Connection conn, UUID processManagerId) {
    checkNotCancelled(processManagerId);
    List<PendingScheduledCommand> scheduledCommands = store.listScheduledCommands(conn, processManagerId);
    for (PendingScheduledCommand scheduledCommand : scheduledCommands) {
      ScheduledEnvelope scheduledEnvelope = new ScheduledEnvelope(
          restoreEnvelope(scheduledCommand.messageId(), scheduledCommand.correlationId(),
              scheduledCommand.commandJson()),
          scheduledCommand.scheduledTimeUtc());

      checkNotCancelled(processManagerId);
      deliver(processManagerId, () -> scheduledMessageBus.send(scheduledEnvelope),
          "scheduled command messageId=" + scheduledCommand.messageId());
      metrics.incrementScheduledCommandsSent();

      recordRemoval(store.removeScheduledCommand(conn, scheduledCommand.id()), scheduledCommand.messageId());
    }
  }

  private Envelope restoreEnvelope(String messageId, String correlationId, String commandJson) {
    return new Envelope(messageId, correlationId, serializer.deserialize(commandJson));
  }

  private void deliver(UUID processManagerId, Delivery delivery, String description) {
    try {
      delivery.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException(
          "Flush cancelled while sending for processManagerId=" + processManagerId);
      cancelled.initCause(e);
      throw cancelled;
    } catch (Exception e) {
      throw new DeliveryFailureException(processManagerId,
          "Delivery channel rejected " + description + " for processManagerId=" + processManagerId, e);
    }
  }

  private void recordRemoval(RemoveResult result, String messageId) {
    if (result == RemoveResult.ALREADY_GONE) {
      metrics.incrementRemoveAlreadyGone();
      logger.log(Level.FINE, "Pending command already removed by a concurrent flush, messageId={0}", messageId);
    }
  }

  private static void checkNotCancelled(UUID processManagerId) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Flush cancelled for processManagerId=" + processManagerId);
    }
  }

  /**
   * Runs the sweep loop on a background thread.
   *
   * <p>Cancelling the returned future stops the loop and interrupts in-flight flushes.
   * Calls are serialized: a second call starts after the running sweep ends.
   */
  @Override
  public CompletableFuture<Void> enqueueAll() {
    if (closed.get()) {
      throw new IllegalStateException("OutboxCommandPublisher has been closed");
    }
    CompletableFuture<Void> completion = new CompletableFuture<>();
    Future<?> task = sweepExecutor.submit(() -> {
      try {
        sweep();
        completion.complete(null);
      } catch (Throwable t) {
        completion.completeExceptionally(t);
      }
    });
    completion.whenComplete((ignored, failure) -> {
      if (completion.isCancelled()) {
        task.cancel(true);
      }
    });
    return completion;
  }

  /**
   * Flushes every process manager with pending rows on the calling thread, repeating until
   * a probe pass comes back empty.
   *
   * <p>An owner whose flush fails is skipped by the remaining passes of this sweep while
   * the other owners are drained. Its rows stay pending for the next sweep.
   *
   * @return the number of flushes performed
   * @throws CancellationException if the calling thread is interrupted
   * @throws RuntimeException      once the store is drained of healthy owners, the first
   *                               flush failure of the sweep with the others suppressed
   */
  public int sweep() {
    int flushes = 0;
    Set<UUID> failedOwners = new HashSet<>();
    RuntimeException failure = null;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Sweep cancelled");
      }
      Set<UUID> candidates = probe(failedOwners);
      metrics.incrementSweepPass();
      if (candidates.isEmpty()) {
        break;
      }
      Map<UUID, RuntimeException> failures = flushConcurrently(candidates);
      flushes += candidates.size();
      for (Map.Entry<UUID, RuntimeException> failed : failures.entrySet()) {
        failedOwners.add(failed.getKey());
        if (failure == null) failure = failed.getValue();
        else if (failed.getValue() != failure) failure.addSuppressed(failed.getValue());
      }
    }
    if (failure != null) {
      logger.log(Level.WARNING, "Sweep left commands pending for " + failedOwners.size()
          + " process manager(s) whose flush failed", failure);
      throw failure;
    }
    return flushes;
  }

  private Set<UUID> probe(Set<UUID> excludedOwners) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Set<UUID> candidates = new LinkedHashSet<>(
          store.findOwnersWithCommands(conn, probeLimit, excludedOwners));
      candidates.addAll(store.findOwnersWithScheduledCommands(conn, probeLimit, excludedOwners));
      return candidates;
    } catch (SQLException e) {
      throw new PersistenceException("Failed to probe for pending commands", e);
    }
  }

  private Map<UUID, RuntimeException> flushConcurrently(Set<UUID> processManagerIds) {
    Map<UUID, Future<?>> flushes = new LinkedHashMap<>();
    for (UUID processManagerId : processManagerIds) {
      flushes.put(processManagerId, workers.submit(() -> flushCommands(processManagerId)));
    }

    Map<UUID, RuntimeException> failures = new LinkedHashMap<>();
    for (Map.Entry<UUID, Future<?>> flush : flushes.entrySet()) {
      try {
        flush.getValue().get();
      } catch (InterruptedException e) {
        flushes.values().forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        CancellationException cancelled = new CancellationException("Sweep cancelled");
        cancelled.initCause(e);
        throw cancelled;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Error error) {
          throw error;
        }
        failures.put(flush.getKey(), cause instanceof RuntimeException re
            ? re : new IllegalStateException("Flush failed", cause));
      }
    }
    return failures;
  }

  /**
   * Stops the sweep thread and the flush workers, waiting up to five seconds each.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    sweepExecutor.shutdownNow();
    workers.shutdown();
    try {
      if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Sweep thread did not stop within 5s");
      }
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Flush workers did not stop within 5s; forcing shutdown");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @FunctionalInterface
  private interface Delivery {
    void run() throws Exception;
  }

  /**
   * Builder for {@link OutboxCommandPublisher}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PendingCommandStore pendingCommandStore;
    private MessageSerializer serializer;
    private MessageBus messageBus;
    private ScheduledMessageBus scheduledMessageBus;
    private MetricsExporter metrics;
    private int workerCount = 4;
    private int probeLimit = 1;

    private Builder() {
    }

    /**
     * Sets the connection provider used by flushes and sweep probes. <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store holding pending rows. <b>Required.</b>
     */
    public Builder pendingCommandStore(PendingCommandStore pendingCommandStore) {
      this.pendingCommandStore = pendingCommandStore;
      return this;
    }

    /**
     * Sets the serializer that restores commands from stored payloads. <b>Required.</b>
     */
    public Builder serializer(MessageSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    /**
     * Sets the immediate delivery channel. <b>Required.</b>
     */
    public Builder messageBus(MessageBus messageBus) {
      this.messageBus = messageBus;
      return this;
    }

    /**
     * Sets the scheduled delivery channel. <b>Required.</b>
     */
    public Builder scheduledMessageBus(ScheduledMessageBus scheduledMessageBus) {
      this.scheduledMessageBus = scheduledMessageBus;
      return this;
    }

    /**
     * Sets the metrics exporter. Optional; defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how many flushes a sweep pass runs in parallel.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how many owner ids each sweep probe may return per row kind.
     *
     * <p>Optional. Defaults to {@code 1}, which keeps each pass small and lets other
     * writers interleave. Larger values converge faster when many instances have
     * pending rows. Must be &gt; 0.
     */
    public Builder probeLimit(int probeLimit) {
      this.probeLimit = probeLimit;
      return this;
    }

    public OutboxCommandPublisher build() {
      return new OutboxCommandPublisher(this);
    }
  }
}
