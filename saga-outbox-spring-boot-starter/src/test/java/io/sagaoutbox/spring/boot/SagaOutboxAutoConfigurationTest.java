package io.sagaoutbox.spring.boot;

import io.sagaoutbox.CommandPublisherExceptionHandler;
import io.sagaoutbox.Envelope;
import io.sagaoutbox.ExceptionHandling;
import io.sagaoutbox.ProcessManager;
import io.sagaoutbox.ProcessManagerDataContext;
import io.sagaoutbox.ScheduledEnvelope;
import io.sagaoutbox.jdbc.DataSourceConnectionProvider;
import io.sagaoutbox.jdbc.JdbcStoreException;
import io.sagaoutbox.jdbc.state.ProcessManagerCodec;
import io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore;
import io.sagaoutbox.jdbc.store.H2PendingCommandStore;
import io.sagaoutbox.publish.OutboxCommandPublisher;
import io.sagaoutbox.spi.ConnectionProvider;
import io.sagaoutbox.spi.MessageBus;
import io.sagaoutbox.spi.MessageSerializer;
import io.sagaoutbox.spi.ScheduledMessageBus;
import io.sagaoutbox.sweep.PendingCommandSweeper;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SagaOutboxAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          SagaOutboxAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:saga_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "saga-outbox.sweeper.initial-delay-ms=60000");

  @Test
  void storeAndConnectionProviderWithoutBuses() {
    runner.run(ctx -> {
      assertInstanceOf(H2PendingCommandStore.class, ctx.getBean(AbstractJdbcPendingCommandStore.class));
      DataSourceConnectionProvider provider =
          assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertSame(ctx.getBean(DataSource.class), provider.dataSource());
      assertSame(CommandPublisherExceptionHandler.PROPAGATE, ctx.getBean(CommandPublisherExceptionHandler.class));
      assertFalse(ctx.containsBean("outboxCommandPublisher"));
      assertFalse(ctx.containsBean("pendingCommandSweeper"));
    });
  }

  @Test
  void createsPublisherSweeperAndFactoryOnceBusesExist() {
    runner.withUserConfiguration(BusConfig.class).run(ctx -> {
      assertNotNull(ctx.getBean(OutboxCommandPublisher.class));
      assertTrue(ctx.getBean(PendingCommandSweeper.class).isRunning());
      assertNotNull(ctx.getBean(ProcessManagerDataContextFactory.class));
    });
  }

  @Test
  void sweeperCanBeDisabled() {
    runner.withUserConfiguration(BusConfig.class)
        .withPropertyValues("saga-outbox.sweeper.enabled=false")
        .run(ctx -> {
          assertTrue(ctx.containsBean("outboxCommandPublisher"));
          assertFalse(ctx.containsBean("pendingCommandSweeper"));
        });
  }

  @Test
  void customTableNamesReachTheStore() {
    runner.withPropertyValues("saga-outbox.tables.command=missing_commands").run(ctx -> {
      var store = ctx.getBean(AbstractJdbcPendingCommandStore.class);
      try (Connection conn = ctx.getBean(ConnectionProvider.class).getConnection()) {
        assertThrows(JdbcStoreException.class, () -> store.listCommands(conn, UUID.randomUUID()));
        assertTrue(store.listScheduledCommands(conn, UUID.randomUUID()).isEmpty());
      }
    });
  }

  @Test
  void invalidProbeLimitFailsStartup() {
    runner.withUserConfiguration(BusConfig.class)
        .withPropertyValues("saga-outbox.publisher.probe-limit=0")
        .run(ctx -> assertNotNull(ctx.getStartupFailure()));
  }

  @Test
  void userExceptionHandlerWins() {
    runner.withUserConfiguration(BusConfig.class, HandlerConfig.class).run(ctx -> {
      assertSame(HandlerConfig.HANDLER, ctx.getBean(CommandPublisherExceptionHandler.class));
    });
  }

  @Test
  void factoryContextSavesAndDelivers() {
    runner.withUserConfiguration(BusConfig.class).run(ctx -> {
      ProcessManagerDataContext<ShipmentSaga> context = ctx.getBean(ProcessManagerDataContextFactory.class)
          .create(ShipmentSaga.class, ShipmentSaga.CODEC);
      BusConfig buses = ctx.getBean(BusConfig.class);

      ShipmentSaga saga = new ShipmentSaga(UUID.randomUUID(), 0L);
      saga.dispatch("s-1");
      context.saveAndPublishCommands(saga, "corr");

      assertEquals(1, buses.sent.size());
      assertEquals("Pick:s-1", buses.sent.get(0).message());
      assertEquals(1, buses.scheduled.size());
      assertEquals(1L, context.find(saga.id()).orElseThrow().version());
    });
  }

  @Configuration
  static class BusConfig {
    final List<Envelope> sent = new CopyOnWriteArrayList<>();
    final List<ScheduledEnvelope> scheduled = new CopyOnWriteArrayList<>();

    @Bean
    MessageSerializer messageSerializer() {
      return new MessageSerializer() {
        @Override
        public String serialize(Object message) {
          return message.toString();
        }

        @Override
        public Object deserialize(String payload) {
          return payload;
        }
      };
    }

    @Bean
    MessageBus messageBus() {
      return sent::addAll;
    }

    @Bean
    ScheduledMessageBus scheduledMessageBus() {
      return scheduled::add;
    }
  }

  @Configuration
  static class HandlerConfig {
    static final CommandPublisherExceptionHandler HANDLER = context -> ExceptionHandling.HANDLED;

    @Bean
    CommandPublisherExceptionHandler customHandler() {
      return HANDLER;
    }
  }

  static final class ShipmentSaga extends ProcessManager {
    static final ProcessManagerCodec<ShipmentSaga> CODEC = new ProcessManagerCodec<>() {
      @Override
      public String encode(ShipmentSaga saga) {
        return "{}";
      }

      @Override
      public ShipmentSaga decode(UUID id, long version, String state) {
        return new ShipmentSaga(id, version);
      }
    };

    ShipmentSaga(UUID id, long version) {
      super(id, version);
    }

    void dispatch(String shipmentId) {
      addCommand("Pick:" + shipmentId);
      addScheduledCommand("Escalate:" + shipmentId, Instant.parse("2030-01-01T00:00:00Z"));
    }
  }
}
