package io.sagaoutbox.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC pending command stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcPendingCommandStore store = JdbcPendingCommandStores.detect(dataSource);
 * AbstractJdbcPendingCommandStore pg = JdbcPendingCommandStores.get("postgresql");
 * }</pre>
 */
public final class JdbcPendingCommandStores {

  private static final List<AbstractJdbcPendingCommandStore> STORES;
  private static final Map<String, AbstractJdbcPendingCommandStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcPendingCommandStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcPendingCommandStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcPendingCommandStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcPendingCommandStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name (case-insensitive).
   *
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcPendingCommandStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcPendingCommandStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown pending command store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from the URL of a DataSource connection.
   *
   * @throws IllegalStateException if the DataSource cannot be reached
   * @throws IllegalArgumentException if no store matches the URL
   */
  public static AbstractJdbcPendingCommandStore detect(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    String url;
    try (Connection conn = dataSource.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect pending command store from DataSource", e);
    }
    return detect(url);
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no store matches it
   */
  public static AbstractJdbcPendingCommandStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase();
    for (AbstractJdbcPendingCommandStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No pending command store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
