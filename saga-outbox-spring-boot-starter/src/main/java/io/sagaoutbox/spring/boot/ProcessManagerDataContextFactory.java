package io.sagaoutbox.spring.boot;

import io.sagaoutbox.CommandPublisher;
import io.sagaoutbox.CommandPublisherExceptionHandler;
import io.sagaoutbox.ProcessManager;
import io.sagaoutbox.ProcessManagerDataContext;
import io.sagaoutbox.jdbc.state.JdbcProcessManagerStore;
import io.sagaoutbox.jdbc.state.ProcessManagerCodec;
import io.sagaoutbox.spi.ConnectionProvider;
import io.sagaoutbox.spi.MessageSerializer;
import io.sagaoutbox.spi.MetricsExporter;
import io.sagaoutbox.spi.PendingCommandStore;
import io.sagaoutbox.spi.ProcessManagerStore;

import java.util.Objects;

/**
 * Creates {@link ProcessManagerDataContext} instances for individual process manager types
 * from the shared outbox beans.
 *
 * <pre>{@code
 * @Bean
 * ProcessManagerDataContext<OrderSaga> orderSagas(ProcessManagerDataContextFactory factory) {
 *   return factory.create(OrderSaga.class, new OrderSagaCodec());
 * }
 * }</pre>
 */
public class ProcessManagerDataContextFactory {
  private final ConnectionProvider connectionProvider;
  private final PendingCommandStore pendingCommandStore;
  private final MessageSerializer serializer;
  private final CommandPublisher commandPublisher;
  private final CommandPublisherExceptionHandler exceptionHandler;
  private final MetricsExporter metrics;
  private final String processManagerTable;

  public ProcessManagerDataContextFactory(ConnectionProvider connectionProvider,
      PendingCommandStore pendingCommandStore, MessageSerializer serializer,
      CommandPublisher commandPublisher, CommandPublisherExceptionHandler exceptionHandler,
      MetricsExporter metrics, String processManagerTable) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.pendingCommandStore = Objects.requireNonNull(pendingCommandStore, "pendingCommandStore");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.commandPublisher = Objects.requireNonNull(commandPublisher, "commandPublisher");
    this.exceptionHandler = exceptionHandler;
    this.metrics = metrics;
    this.processManagerTable = Objects.requireNonNull(processManagerTable, "processManagerTable");
  }

  /**
   * Context backed by a {@link JdbcProcessManagerStore} on the configured state table.
   */
  public <T extends ProcessManager> ProcessManagerDataContext<T> create(
      Class<T> processManagerType, ProcessManagerCodec<T> codec) {
    return create(processManagerType,
        new JdbcProcessManagerStore<>(processManagerTable, processManagerType, codec));
  }

  public <T extends ProcessManager> ProcessManagerDataContext<T> create(
      Class<T> processManagerType, ProcessManagerStore<T> processManagerStore) {
    return ProcessManagerDataContext.builder(processManagerType)
        .connectionProvider(connectionProvider)
        .processManagerStore(processManagerStore)
        .pendingCommandStore(pendingCommandStore)
        .serializer(serializer)
        .commandPublisher(commandPublisher)
        .exceptionHandler(exceptionHandler)
        .metrics(metrics)
        .build();
  }
}
