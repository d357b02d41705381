package io.sagaoutbox.publish;

import io.sagaoutbox.DeliveryFailureException;
import io.sagaoutbox.Envelope;
import io.sagaoutbox.PersistenceException;
import io.sagaoutbox.ProcessManagerIds;
import io.sagaoutbox.ScheduledEnvelope;
import io.sagaoutbox.model.PendingScheduledCommand;
import io.sagaoutbox.stub.CountingMetrics;
import io.sagaoutbox.stub.InMemoryPendingCommandStore;
import io.sagaoutbox.stub.RecordingMessageBus;
import io.sagaoutbox.stub.RecordingScheduledMessageBus;
import io.sagaoutbox.stub.StringMessageSerializer;
import io.sagaoutbox.stub.StubConnections;
import io.sagaoutbox.spi.ConnectionProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboxCommandPublisherTest {
  private final InMemoryPendingCommandStore store = new InMemoryPendingCommandStore();
  private final StubConnections connections = new StubConnections();
  private final RecordingMessageBus bus = new RecordingMessageBus();
  private final RecordingScheduledMessageBus scheduledBus = new RecordingScheduledMessageBus();
  private final CountingMetrics metrics = new CountingMetrics();
  private OutboxCommandPublisher publisher;

  @AfterEach
  void tearDown() {
    if (publisher != null) {
      publisher.close();
    }
  }

  private OutboxCommandPublisher publisher() {
    return publisher(connections, 1);
  }

  private OutboxCommandPublisher publisher(ConnectionProvider provider, int probeLimit) {
    publisher = OutboxCommandPublisher.builder()
        .connectionProvider(provider)
        .pendingCommandStore(store)
        .serializer(new StringMessageSerializer())
        .messageBus(bus)
        .scheduledMessageBus(scheduledBus)
        .metrics(metrics)
        .probeLimit(probeLimit)
        .build();
    return publisher;
  }

  private void seedScheduled(UUID processManagerId, String text, Instant at) {
    store.insertScheduledCommands(null, List.of(
        PendingScheduledCommand.unsaved(processManagerId, "msg-" + text, "corr", text, at)));
  }

  @Test
  void flushSendsAllCommandsInOneBatchInRecordedOrder() {
    UUID saga = UUID.randomUUID();
    UUID other = UUID.randomUUID();
    store.seed(saga, "a");
    store.seed(other, "x");
    store.seed(saga, "b", "c");

    publisher().flushCommands(saga);

    assertEquals(1, bus.batches.size());
    List<Envelope> batch = bus.batches.get(0);
    assertEquals(List.of("a", "b", "c"), batch.stream().map(Envelope::message).toList());
    assertEquals(List.of("msg-a", "msg-b", "msg-c"), batch.stream().map(Envelope::messageId).toList());
    assertEquals("corr", batch.get(0).correlationId());
    assertEquals(1, store.commandCount());
    assertEquals(3, metrics.sent.get());
  }

  @Test
  void flushWithNothingPendingSendsNothing() {
    publisher().flushCommands(UUID.randomUUID());

    assertTrue(bus.batches.isEmpty());
    assertTrue(scheduledBus.sent.isEmpty());
    assertEquals(0, metrics.flushFailures.get());
  }

  @Test
  void flushRejectsNilAndNullIdsWithoutTouchingStore() {
    OutboxCommandPublisher p = publisher();

    assertThrows(IllegalArgumentException.class, () -> p.flushCommands(ProcessManagerIds.EMPTY));
    assertThrows(IllegalArgumentException.class, () -> p.flushCommands(null));

    assertEquals(0, store.accessCount.get());
    assertEquals(0, connections.opened.get());
  }

  @Test
  void deliveryFailureKeepsEveryRow() {
    UUID saga = UUID.randomUUID();
    store.seed(saga, "a", "b");
    bus.failWith(new IllegalStateException("broker down"));

    DeliveryFailureException ex = assertThrows(DeliveryFailureException.class,
        () -> publisher().flushCommands(saga));

    assertEquals(saga, ex.processManagerId());
    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertEquals(2, store.commandCount());
    assertEquals(1, metrics.flushFailures.get());
  }

  @Test
  void scheduledCommandsAreSentOneAtATimeWithTheirDueTime() {
    UUID saga = UUID.randomUUID();
    Instant first = Instant.parse("2030-01-01T00:00:00Z");
    Instant second = Instant.parse("2030-02-01T00:00:00Z");
    seedScheduled(saga, "timeout-1", first);
    seedScheduled(saga, "timeout-2", second);

    publisher().flushCommands(saga);

    assertEquals(2, scheduledBus.sent.size());
    ScheduledEnvelope sent = scheduledBus.sent.get(0);
    assertEquals("timeout-1", sent.envelope().message());
    assertEquals(first, sent.scheduledTimeUtc());
    assertEquals(second, scheduledBus.sent.get(1).scheduledTimeUtc());
    assertEquals(0, store.scheduledCommandCount());
    assertEquals(2, metrics.scheduledSent.get());
  }

  @Test
  void scheduledFailureLeavesOnlyUnsentRows() {
    UUID saga = UUID.randomUUID();
    seedScheduled(saga, "t1", Instant.parse("2030-01-01T00:00:00Z"));
    seedScheduled(saga, "t2", Instant.parse("2030-01-02T00:00:00Z"));
    scheduledBus.failAfter(1);

    assertThrows(DeliveryFailureException.class, () -> publisher().flushCommands(saga));

    assertEquals(1, store.scheduledCommandCount());
    assertEquals("t2", store.listScheduledCommands(null, saga).get(0).commandJson());
  }

  @Test
  void rowDeletedByAnotherFlushCountsAsDone() {
    UUID saga = UUID.randomUUID();
    store.seed(saga, "a", "b", "c");
    RecordingMessageBus racingBus = new RecordingMessageBus() {
      @Override
      protected void beforeRecord(List<Envelope> envelopes) {
        store.clearAll();
      }
    };
    publisher = OutboxCommandPublisher.builder()
        .connectionProvider(connections)
        .pendingCommandStore(store)
        .serializer(new StringMessageSerializer())
        .messageBus(racingBus)
        .scheduledMessageBus(scheduledBus)
        .metrics(metrics)
        .build();

    publisher.flushCommands(saga);

    assertEquals(3, metrics.alreadyGone.get());
    assertEquals(0, metrics.flushFailures.get());
    assertEquals(0, store.totalCount());
  }

  @Test
  void concurrentFlushesOfSameInstanceConverge() throws Exception {
    UUID saga = UUID.randomUUID();
    for (int i = 0; i < 20; i++) {
      store.seed(saga, "cmd-" + i);
    }
    OutboxCommandPublisher p = publisher();

    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          p.flushCommands(saga);
          return null;
        }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(0, store.totalCount());
    Set<Object> delivered = new HashSet<>();
    bus.allEnvelopes().forEach(e -> delivered.add(e.message()));
    assertEquals(20, delivered.size());
  }

  @Test
  void sweepDrainsEveryInstance() {
    int instances = 25;
    for (int i = 0; i < instances; i++) {
      UUID saga = UUID.randomUUID();
      store.seed(saga, "c" + i);
      if (i % 3 == 0) {
        seedScheduled(saga, "s" + i, Instant.parse("2030-01-01T00:00:00Z"));
      }
    }

    int flushes = publisher().sweep();

    assertTrue(flushes >= instances);
    assertEquals(0, store.totalCount());
    assertEquals(instances, bus.allEnvelopes().size());
    assertEquals(9, scheduledBus.sent.size());
    assertTrue(metrics.sweepPasses.get() > 1);
  }

  @Test
  void sweepOnEmptyStoreMakesOnePass() {
    assertEquals(0, publisher().sweep());
    assertEquals(1, metrics.sweepPasses.get());
  }

  @Test
  void sweepFailsWithFirstFailureAndSuppressesTheRest() {
    store.seed(UUID.randomUUID(), "a");
    store.seed(UUID.randomUUID(), "b");
    bus.failWith(new IllegalStateException("broker down"));

    DeliveryFailureException ex = assertThrows(DeliveryFailureException.class,
        () -> publisher(connections, 10).sweep());

    assertEquals(1, ex.getSuppressed().length);
    assertEquals(2, store.commandCount());
  }

  @Test
  void failingInstanceIsSkippedWhileOthersDrain() {
    UUID poisoned = UUID.randomUUID();
    UUID healthy = UUID.randomUUID();
    store.seed(poisoned, "poison");
    store.seed(healthy, "ok-1", "ok-2");
    seedScheduled(healthy, "reminder", Instant.parse("2030-01-01T00:00:00Z"));
    RecordingMessageBus rejectingBus = new RecordingMessageBus() {
      @Override
      protected void beforeRecord(List<Envelope> envelopes) {
        if (envelopes.stream().anyMatch(e -> "poison".equals(e.message()))) {
          throw new IllegalStateException("rejected");
        }
      }
    };
    publisher = OutboxCommandPublisher.builder()
        .connectionProvider(connections)
        .pendingCommandStore(store)
        .serializer(new StringMessageSerializer())
        .messageBus(rejectingBus)
        .scheduledMessageBus(scheduledBus)
        .metrics(metrics)
        .build();

    DeliveryFailureException ex = assertThrows(DeliveryFailureException.class, publisher::sweep);

    assertEquals(poisoned, ex.processManagerId());
    assertEquals(0, ex.getSuppressed().length);
    assertEquals(List.of("ok-1", "ok-2"),
        rejectingBus.allEnvelopes().stream().map(Envelope::message).toList());
    assertEquals(1, scheduledBus.sent.size());
    assertEquals(1, store.commandCount());
    assertEquals(0, store.scheduledCommandCount());
  }

  @Test
  void enqueueAllCompletesOnceStoreIsEmpty() throws Exception {
    for (int i = 0; i < 10; i++) {
      store.seed(UUID.randomUUID(), "c" + i);
    }

    publisher(connections, 3).enqueueAll().get(10, TimeUnit.SECONDS);

    assertEquals(0, store.totalCount());
    assertEquals(10, bus.allEnvelopes().size());
  }

  @Test
  void interruptedFlushIsCancelledBeforeSending() {
    UUID saga = UUID.randomUUID();
    store.seed(saga, "a");
    OutboxCommandPublisher p = publisher();

    Thread.currentThread().interrupt();
    try {
      assertThrows(CancellationException.class, () -> p.flushCommands(saga));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
    assertTrue(bus.batches.isEmpty());
    assertEquals(1, store.commandCount());
  }

  @Test
  void connectionFailureSurfacesAsPersistenceException() {
    PersistenceException ex = assertThrows(PersistenceException.class,
        () -> publisher(StubConnections.failing(), 1).flushCommands(UUID.randomUUID()));

    assertEquals("connection refused", ex.getCause().getMessage());
    assertEquals(1, metrics.flushFailures.get());
  }

  @Test
  void enqueueAllAfterCloseIsRejected() {
    OutboxCommandPublisher p = publisher();
    p.close();

    assertThrows(IllegalStateException.class, p::enqueueAll);
  }

  @Test
  void builderRequiresCollaboratorsAndPositiveLimits() {
    assertThrows(NullPointerException.class, () -> OutboxCommandPublisher.builder()
        .connectionProvider(connections)
        .serializer(new StringMessageSerializer())
        .messageBus(bus)
        .scheduledMessageBus(scheduledBus)
        .build());
    assertThrows(IllegalArgumentException.class, () -> OutboxCommandPublisher.builder()
        .connectionProvider(connections)
        .pendingCommandStore(store)
        .serializer(new StringMessageSerializer())
        .messageBus(bus)
        .scheduledMessageBus(scheduledBus)
        .workerCount(0)
        .build());
    assertThrows(IllegalArgumentException.class, () -> OutboxCommandPublisher.builder()
        .connectionProvider(connections)
        .pendingCommandStore(store)
        .serializer(new StringMessageSerializer())
        .messageBus(bus)
        .scheduledMessageBus(scheduledBus)
        .probeLimit(0)
        .build());
  }
}
