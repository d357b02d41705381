package io.sagaoutbox.jdbc;

import io.sagaoutbox.jdbc.store.AbstractJdbcPendingCommandStore;
import io.sagaoutbox.jdbc.store.H2PendingCommandStore;
import io.sagaoutbox.jdbc.store.JdbcPendingCommandStores;
import io.sagaoutbox.jdbc.store.MySqlPendingCommandStore;
import io.sagaoutbox.jdbc.store.PostgresPendingCommandStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcPendingCommandStoresTest {

  @Test
  void allStoresAreRegistered() {
    assertEquals(3, JdbcPendingCommandStores.all().size());
  }

  @Test
  void getByNameIgnoresCase() {
    assertInstanceOf(PostgresPendingCommandStore.class, JdbcPendingCommandStores.get("PostgreSQL"));
    assertInstanceOf(H2PendingCommandStore.class, JdbcPendingCommandStores.get("h2"));
    assertThrows(IllegalArgumentException.class, () -> JdbcPendingCommandStores.get("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertInstanceOf(MySqlPendingCommandStore.class, JdbcPendingCommandStores.detect("jdbc:mysql://db:3306/app"));
    assertInstanceOf(MySqlPendingCommandStore.class, JdbcPendingCommandStores.detect("jdbc:tidb://db:4000/app"));
    assertInstanceOf(PostgresPendingCommandStore.class,
      JdbcPendingCommandStores.detect("JDBC:POSTGRESQL://db/app"));
    assertInstanceOf(H2PendingCommandStore.class, JdbcPendingCommandStores.detect("jdbc:h2:mem:x"));
  }

  @Test
  void detectRejectsUnknownOrEmptyUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcPendingCommandStores.detect("jdbc:oracle:thin:@db"));
    assertThrows(IllegalArgumentException.class, () -> JdbcPendingCommandStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcPendingCommandStores.detect((String) null));
  }

  @Test
  void detectFromDataSource() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + UUID.randomUUID());

    AbstractJdbcPendingCommandStore store = JdbcPendingCommandStores.detect(ds);

    assertEquals("h2", store.name());
  }
}
