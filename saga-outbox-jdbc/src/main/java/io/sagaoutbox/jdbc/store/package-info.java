/**
 * JDBC-based {@link io.sagaoutbox.spi.PendingCommandStore} implementations.
 *
 * <p>{@link io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore} holds the SQL and row
 * mapping; the H2, MySQL and PostgreSQL subclasses name themselves and the JDBC URLs they
 * serve so {@link io.sagaoutbox.jdbc.store.JdbcPendingCommandStores} can pick one.
 */
package io.sagaoutbox.jdbc.store;
