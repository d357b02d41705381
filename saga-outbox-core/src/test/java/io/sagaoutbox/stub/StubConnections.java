package io.sagaoutbox.stub;

import io.sagaoutbox.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection provider handing out do-nothing proxy connections and counting lifecycle calls.
 */
public final class StubConnections implements ConnectionProvider {
  public final AtomicInteger opened = new AtomicInteger();
  public final AtomicInteger commits = new AtomicInteger();
  public final AtomicInteger rollbacks = new AtomicInteger();

  @Override
  public Connection getConnection() {
    opened.incrementAndGet();
    return (Connection) Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          if ("commit".equals(method.getName())) commits.incrementAndGet();
          if ("rollback".equals(method.getName())) rollbacks.incrementAndGet();
          return null;
        });
  }

  public static ConnectionProvider failing() {
    return () -> { throw new SQLException("connection refused"); };
  }
}
