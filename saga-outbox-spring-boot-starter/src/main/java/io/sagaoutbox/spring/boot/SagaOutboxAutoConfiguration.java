package io.sagaoutbox.spring.boot;

import io.sagaoutbox.CommandPublisherExceptionHandler;
import io.sagaoutbox.ProcessManagerDataContext;
import io.sagaoutbox.jdbc.DataSourceConnectionProvider;
import io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore;
import io.sagaoutbox.jdbc.store.JdbcPendingCommandStores;
import io.sagaoutbox.publish.OutboxCommandPublisher;
import io.sagaoutbox.spi.ConnectionProvider;
import io.sagaoutbox.spi.MessageBus;
import io.sagaoutbox.spi.MessageSerializer;
import io.sagaoutbox.spi.MetricsExporter;
import io.sagaoutbox.spi.ScheduledMessageBus;
import io.sagaoutbox.sweep.PendingCommandSweeper;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the saga outbox.
 *
 * <p>Always provides the JDBC pending command store (detected from the {@link DataSource})
 * and a {@link ConnectionProvider}. Once the application defines a {@link MessageSerializer},
 * a {@link MessageBus} and a {@link ScheduledMessageBus}, it also provides the
 * {@link OutboxCommandPublisher}, a {@link ProcessManagerDataContextFactory} and, unless
 * {@code saga-outbox.sweeper.enabled=false}, a started {@link PendingCommandSweeper}.
 *
 * @see SagaOutboxProperties
 * @see SagaOutboxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(ProcessManagerDataContext.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SagaOutboxProperties.class)
public class SagaOutboxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcPendingCommandStore pendingCommandStore(DataSource dataSource, SagaOutboxProperties props) {
    AbstractJdbcPendingCommandStore detected = JdbcPendingCommandStores.detect(dataSource);
    SagaOutboxProperties.Tables tables = props.getTables();
    return detected.withTableNames(tables.getCommand(), tables.getScheduledCommand());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public CommandPublisherExceptionHandler commandPublisherExceptionHandler() {
    return CommandPublisherExceptionHandler.PROPAGATE;
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean({MessageSerializer.class, MessageBus.class, ScheduledMessageBus.class})
  static class PublisherConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public OutboxCommandPublisher outboxCommandPublisher(SagaOutboxProperties props,
        ConnectionProvider connectionProvider,
        AbstractJdbcPendingCommandStore pendingCommandStore,
        MessageSerializer serializer,
        MessageBus messageBus,
        ScheduledMessageBus scheduledMessageBus,
        ObjectProvider<MetricsExporter> metricsProvider) {
      return OutboxCommandPublisher.builder()
          .connectionProvider(connectionProvider)
          .pendingCommandStore(pendingCommandStore)
          .serializer(serializer)
          .messageBus(messageBus)
          .scheduledMessageBus(scheduledMessageBus)
          .metrics(metricsProvider.getIfAvailable())
          .workerCount(props.getPublisher().getWorkerCount())
          .probeLimit(props.getPublisher().getProbeLimit())
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessManagerDataContextFactory processManagerDataContextFactory(SagaOutboxProperties props,
        ConnectionProvider connectionProvider,
        AbstractJdbcPendingCommandStore pendingCommandStore,
        MessageSerializer serializer,
        OutboxCommandPublisher commandPublisher,
        CommandPublisherExceptionHandler exceptionHandler,
        ObjectProvider<MetricsExporter> metricsProvider) {
      return new ProcessManagerDataContextFactory(connectionProvider, pendingCommandStore, serializer,
          commandPublisher, exceptionHandler, metricsProvider.getIfAvailable(),
          props.getTables().getProcessManager());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "saga-outbox.sweeper", name = "enabled", matchIfMissing = true)
    public PendingCommandSweeper pendingCommandSweeper(SagaOutboxProperties props,
        OutboxCommandPublisher commandPublisher) {
      return PendingCommandSweeper.builder()
          .commandPublisher(commandPublisher)
          .initialDelayMs(props.getSweeper().getInitialDelayMs())
          .intervalMs(props.getSweeper().getIntervalMs())
          .build();
    }
  }
}
