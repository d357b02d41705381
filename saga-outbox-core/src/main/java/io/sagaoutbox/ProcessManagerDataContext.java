package io.sagaoutbox;

import io.sagaoutbox.model.PendingCommand;
import io.sagaoutbox.model.PendingScheduledCommand;
import io.sagaoutbox.spi.ConnectionProvider;
import io.sagaoutbox.spi.MessageSerializer;
import io.sagaoutbox.spi.MetricsExporter;
import io.sagaoutbox.spi.PendingCommandStore;
import io.sagaoutbox.spi.ProcessManagerStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads process managers and saves them together with the commands they produced.
 *
 * <p>{@link #saveAndPublishCommands(ProcessManager, String)} writes the process manager
 * state and its pending rows in one local transaction, commits, and then asks the
 * {@link CommandPublisher} to flush that instance. A flush failure never undoes the
 * commit: the rows stay pending and the configured
 * {@link CommandPublisherExceptionHandler} decides whether the caller sees the failure.
 *
 * <p>Create instances via {@link #builder(Class)}. This class is thread-safe as long as
 * each process manager instance is used by one thread at a time.
 *
 * @param <T> the process manager type
 */
public final class ProcessManagerDataContext<T extends ProcessManager> {
  private static final Logger logger = Logger.getLogger(ProcessManagerDataContext.class.getName());

  private final Class<T> processManagerType;
  private final ConnectionProvider connectionProvider;
  private final ProcessManagerStore<T> processManagerStore;
  private final PendingCommandStore pendingCommandStore;
  private final MessageSerializer serializer;
  private final CommandPublisher commandPublisher;
  private final CommandPublisherExceptionHandler exceptionHandler;
  private final MetricsExporter metrics;

  private ProcessManagerDataContext(Builder<T> builder) {
    this.processManagerType = Objects.requireNonNull(builder.processManagerType, "processManagerType");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.processManagerStore = Objects.requireNonNull(builder.processManagerStore, "processManagerStore");
    this.pendingCommandStore = Objects.requireNonNull(builder.pendingCommandStore, "pendingCommandStore");
    this.serializer = Objects.requireNonNull(builder.serializer, "serializer");
    this.commandPublisher = Objects.requireNonNull(builder.commandPublisher, "commandPublisher");
    this.exceptionHandler = builder.exceptionHandler != null
        ? builder.exceptionHandler : CommandPublisherExceptionHandler.PROPAGATE;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static <T extends ProcessManager> Builder<T> builder(Class<T> processManagerType) {
    return new Builder<>(processManagerType);
  }

  public Class<T> processManagerType() {
    return processManagerType;
  }

  /**
   * Loads the process manager with the given id.
   *
   * @throws IllegalArgumentException if {@code id} is null or the nil UUID
   * @throws PersistenceException     if the store cannot be reached
   */
  public Optional<T> find(UUID id) {
    ProcessManagerIds.requireValid(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return processManagerStore.find(conn, id);
    } catch (SQLException e) {
      throw new PersistenceException("Failed to load process manager id=" + id, e);
    }
  }

  /**
   * Persists the process manager and its pending commands atomically, then flushes them.
   *
   * @param processManager the process manager to save
   * @param correlationId  correlation token stamped on every recorded command, may be {@code null}
   * @throws ConcurrencyConflictException if another writer saved the same instance first;
   *                                      nothing was written and nothing is sent
   * @throws PersistenceException         if the transaction failed and was rolled back
   * @throws RuntimeException             the flush failure, unless the handler returned
   *                                      {@link ExceptionHandling#HANDLED}
   */
  public void saveAndPublishCommands(T processManager, String correlationId) {
    Objects.requireNonNull(processManager, "processManager");
    long version = saveWithPendingCommands(processManager, correlationId);
    processManager.markPersisted(version);
    flushCommands(processManager);
  }

  private long saveWithPendingCommands(T processManager, String correlationId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        long version = processManagerStore.upsert(conn, processManager);
        int recorded = recordPendingCommands(conn, processManager, correlationId);
        conn.commit();
        metrics.incrementCommandsPersisted(recorded);
        return version;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw new PersistenceException("Failed to save process manager id=" + processManager.id(), e);
    }
  }

  private int recordPendingCommands(Connection conn, T processManager, String correlationId) {
    UUID id = processManager.id();

    List<PendingCommand> commands = new ArrayList<>();
    for (Object command : processManager.drainPendingCommands()) {
      Envelope envelope = Envelope.create(command, correlationId);
      commands.add(PendingCommand.unsaved(
          id, envelope.messageId(), correlationId, serializer.serialize(command)));
    }

    List<PendingScheduledCommand> scheduledCommands = new ArrayList<>();
    for (ProcessManager.ScheduledCommand scheduled : processManager.drainPendingScheduledCommands()) {
      Envelope envelope = Envelope.create(scheduled.command(), correlationId);
      scheduledCommands.add(PendingScheduledCommand.unsaved(
          id, envelope.messageId(), correlationId, serializer.serialize(scheduled.command()),
          scheduled.scheduledTimeUtc()));
    }

    if (!commands.isEmpty()) {
      pendingCommandStore.insertCommands(conn, commands);
    }
    if (!scheduledCommands.isEmpty()) {
      pendingCommandStore.insertScheduledCommands(conn, scheduledCommands);
    }
    return commands.size() + scheduledCommands.size();
  }

  private static void rollback(Connection conn, Exception failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private void flushCommands(T processManager) {
    UUID id = processManager.id();
    try {
      commandPublisher.flushCommands(id);
    } catch (RuntimeException e) {
      CommandPublisherExceptionContext context =
          new CommandPublisherExceptionContext(processManager.getClass(), id, e);
      if (decide(context) == ExceptionHandling.HANDLED) {
        metrics.incrementFlushFailureHandled();
        logger.log(Level.WARNING,
            "Flush failed after commit; commands stay pending for processManagerId=" + id, e);
        return;
      }
      throw e;
    }
  }

  private ExceptionHandling decide(CommandPublisherExceptionContext context) {
    try {
      ExceptionHandling verdict = exceptionHandler.handle(context);
      return verdict != null ? verdict : ExceptionHandling.PROPAGATE;
    } catch (Exception handlerFailure) {
      if (handlerFailure instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      metrics.incrementHandlerFailure();
      logger.log(Level.SEVERE, "Command publisher exception handler failed for processManagerId="
          + context.processManagerId(), handlerFailure);
      return ExceptionHandling.PROPAGATE;
    }
  }

  /**
   * Builder for {@link ProcessManagerDataContext}.
   *
   * @param <T> the process manager type
   */
  public static final class Builder<T extends ProcessManager> {
    private final Class<T> processManagerType;
    private ConnectionProvider connectionProvider;
    private ProcessManagerStore<T> processManagerStore;
    private PendingCommandStore pendingCommandStore;
    private MessageSerializer serializer;
    private CommandPublisher commandPublisher;
    private CommandPublisherExceptionHandler exceptionHandler;
    private MetricsExporter metrics;

    private Builder(Class<T> processManagerType) {
      this.processManagerType = processManagerType;
    }

    /** <b>Required.</b> */
    public Builder<T> connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder<T> processManagerStore(ProcessManagerStore<T> processManagerStore) {
      this.processManagerStore = processManagerStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder<T> pendingCommandStore(PendingCommandStore pendingCommandStore) {
      this.pendingCommandStore = pendingCommandStore;
      return this;
    }

    /** <b>Required.</b> Used to encode commands into their stored payload. */
    public Builder<T> serializer(MessageSerializer serializer) {
      this.serializer = serializer;
      return this;
    }

    /** <b>Required.</b> */
    public Builder<T> commandPublisher(CommandPublisher commandPublisher) {
      this.commandPublisher = commandPublisher;
      return this;
    }

    /**
     * Sets the handler consulted when the post-commit flush fails.
     * Optional; defaults to {@link CommandPublisherExceptionHandler#PROPAGATE}.
     */
    public Builder<T> exceptionHandler(CommandPublisherExceptionHandler exceptionHandler) {
      this.exceptionHandler = exceptionHandler;
      return this;
    }

    /** Optional; defaults to {@link MetricsExporter#NOOP}. */
    public Builder<T> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ProcessManagerDataContext<T> build() {
      return new ProcessManagerDataContext<>(this);
    }
  }
}
