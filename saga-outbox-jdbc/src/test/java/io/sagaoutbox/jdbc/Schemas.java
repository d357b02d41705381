package io.sagaoutbox.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Applies the bundled DDL scripts to test databases.
 */
final class Schemas {

  static void apply(DataSource dataSource, String resource) throws SQLException, IOException {
    String schema = load(resource);
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  static int count(DataSource dataSource, String table) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement();
         var rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream is = Schemas.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private Schemas() {}
}
