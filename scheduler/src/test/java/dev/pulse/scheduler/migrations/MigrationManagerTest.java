package dev.pulse.scheduler.migrations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pulse.scheduler.config.PulseConfig;
import dev.pulse.scheduler.utils.DbSetupTestBase;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;

import org.junit.jupiter.api.Test;

@org.junit.jupiter.api.Timeout(value = 2, unit = java.util.concurrent.TimeUnit.MINUTES)
class MigrationManagerTest extends DbSetupTestBase {

  @Test
  void runMigrationsCreatesJobsTable() throws Exception {
    MigrationManager.runMigrations(dataSource, "mm_create");

    try (Connection conn = dataSource.getConnection()) {
      assertTableExists(conn.getMetaData(), "jobs", "mm_create");
      assertTableExists(conn.getMetaData(), "pulse_migrations", "mm_create");
      assertEquals(
          MigrationManager.getMigrations("mm_create").size(),
          MigrationManager.getCurrentVersion(conn, "\"mm_create\""));
    }
  }

  @Test
  void runMigrationsIsIdempotent() throws Exception {
    MigrationManager.runMigrations(dataSource, "mm_twice");
    MigrationManager.runMigrations(dataSource, "mm_twice");

    try (Connection conn = dataSource.getConnection();
        var stmt = conn.createStatement();
        var rs = stmt.executeQuery("SELECT COUNT(*) FROM \"mm_twice\".pulse_migrations")) {
      assertTrue(rs.next());
      assertEquals(1, rs.getInt(1));
    }
  }

  @Test
  void runMigrationsCreatesDatabase() throws Exception {
    var url = postgres.getJdbcUrl().replace("/" + postgres.getDatabaseName(), "/pulse_created");
    var config =
        PulseConfig.defaults()
            .withDatabaseUrl(url)
            .withDbUser(postgres.getUsername())
            .withDbPassword(postgres.getPassword());

    MigrationManager.runMigrations(config);

    try (Connection conn = dataSource.getConnection();
        var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
      stmt.setString(1, "pulse_created");
      try (var rs = stmt.executeQuery()) {
        assertTrue(rs.next());
      }
    }
  }

  @Test
  void extractDbAndPostgresUrl() {
    var pair =
        MigrationManager.extractDbAndPostgresUrl(
            "jdbc:postgresql://db.example.com:5432/pulse_jobs?sslmode=require");
    assertEquals("jdbc:postgresql://db.example.com:5432/postgres?sslmode=require", pair.url());
    assertEquals("pulse_jobs", pair.database());

    assertThrows(
        IllegalArgumentException.class,
        () -> MigrationManager.extractDbAndPostgresUrl("jdbc:postgresql://"));
  }

  static void assertTableExists(DatabaseMetaData metaData, String tableName, String schema)
      throws Exception {
    try (ResultSet rs = metaData.getTables(null, schema, tableName, null)) {
      assertTrue(rs.next(), "Table %s should exist in schema %s".formatted(tableName, schema));
    }
  }
}
