package io.sagaoutbox.stub;

import io.sagaoutbox.ConcurrencyConflictException;
import io.sagaoutbox.spi.ProcessManagerStore;

import java.sql.Connection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryOrderSagaStore implements ProcessManagerStore<OrderSaga> {
  private record Row(long version, String status) {}

  private final Map<UUID, Row> rows = new ConcurrentHashMap<>();

  @Override
  public Optional<OrderSaga> find(Connection conn, UUID id) {
    Row row = rows.get(id);
    return row == null ? Optional.empty() : Optional.of(new OrderSaga(id, row.version(), row.status()));
  }

  @Override
  public long upsert(Connection conn, OrderSaga saga) {
    long expected = saga.version();
    Row next = new Row(expected + 1, saga.status());
    if (expected == 0L) {
      if (rows.putIfAbsent(saga.id(), next) != null) {
        throw new ConcurrencyConflictException(saga.id(), expected);
      }
      return next.version();
    }
    boolean[] updated = {false};
    rows.computeIfPresent(saga.id(), (id, current) -> {
      if (current.version() != expected) {
        return current;
      }
      updated[0] = true;
      return next;
    });
    if (!updated[0]) {
      throw new ConcurrencyConflictException(saga.id(), expected);
    }
    return next.version();
  }
}
