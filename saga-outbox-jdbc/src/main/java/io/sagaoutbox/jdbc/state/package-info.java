/**
 * JDBC persistence of process manager state.
 */
package io.sagaoutbox.jdbc.state;
