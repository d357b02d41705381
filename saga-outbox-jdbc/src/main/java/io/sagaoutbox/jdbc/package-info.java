/**
 * JDBC support shared by the pending command and process manager stores.
 *
 * <p>DDL for H2, MySQL and PostgreSQL ships on the classpath under {@code /schema/}.
 *
 * @see io.sagaoutbox.jdbc.store.JdbcPendingCommandStores
 * @see io.sagaoutbox.jdbc.state.JdbcProcessManagerStore
 */
package io.sagaoutbox.jdbc;
