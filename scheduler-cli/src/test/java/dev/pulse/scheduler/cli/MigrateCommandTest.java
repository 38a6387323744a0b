package dev.pulse.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pulse.scheduler.migrations.MigrationManager;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Timeout(value = 2, unit = TimeUnit.MINUTES)
@Testcontainers(disabledWithoutDocker = true)
public class MigrateCommandTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

  String dbUrl;

  @BeforeEach
  public void setup() throws Exception {
    dbUrl = postgres.getJdbcUrl().replace("/" + postgres.getDatabaseName(), "/migrate_cmd_test");
    DBUtils.dropDatabase(dbUrl, postgres.getUsername(), postgres.getPassword());
  }

  int runMigrate(String... extra) {
    var cmd = PulseCommand.commandLine();
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));
    var args = new ArrayList<String>();
    args.add("migrate");
    args.add("-D=" + dbUrl);
    args.add("-U=" + postgres.getUsername());
    args.add("-P=" + postgres.getPassword());
    args.addAll(List.of(extra));
    return cmd.execute(args.toArray(String[]::new));
  }

  @Test
  public void migrate() throws Exception {
    assertFalse(checkConnection());

    assertEquals(0, runMigrate());

    assertTrue(checkConnection());
    assertTrue(checkTable("pulse", "jobs"));
  }

  @Test
  public void migrateTwice() throws Exception {
    assertEquals(0, runMigrate());
    assertEquals(0, runMigrate());
    assertTrue(checkTable("pulse", "jobs"));
  }

  @Test
  public void migrateCustomSchema() throws Exception {
    var schema = "S\"ched+0'";
    assertEquals(0, runMigrate("--schema=" + schema));
    assertTrue(checkTable(schema, "jobs"));
  }

  @Test
  public void migrateWithAppRole() throws Exception {
    try (var conn =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        var stmt = conn.createStatement()) {
      stmt.execute("DROP ROLE IF EXISTS pulse_app");
      stmt.execute("CREATE ROLE pulse_app");
    }

    assertEquals(0, runMigrate("-r", "pulse_app"));

    var sql = "SELECT has_table_privilege('pulse_app', 'pulse.jobs', 'INSERT')";
    try (var conn = DriverManager.getConnection(dbUrl, postgres.getUsername(), postgres.getPassword());
        var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      assertTrue(rs.next());
      assertTrue(rs.getBoolean(1));
    }
  }

  @Test
  public void urlParsing() {
    var pair = MigrationManager.extractDbAndPostgresUrl(dbUrl);
    assertEquals("migrate_cmd_test", pair.database());
  }

  boolean checkConnection() {
    return DBUtils.checkConnection(dbUrl, postgres.getUsername(), postgres.getPassword());
  }

  boolean checkTable(String schema, String table) throws SQLException {
    var sql =
        "SELECT EXISTS(SELECT 1 FROM information_schema.tables WHERE table_schema = ? AND table_name = ?)";
    try (var conn = DriverManager.getConnection(dbUrl, postgres.getUsername(), postgres.getPassword());
        var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schema);
      stmt.setString(2, table);
      try (var rs = stmt.executeQuery()) {
        return rs.next() && rs.getBoolean("exists");
      }
    }
  }
}
