package dev.pulse.scheduler.migrations;

import dev.pulse.scheduler.Constants;
import dev.pulse.scheduler.config.PulseConfig;
import dev.pulse.scheduler.database.PostgresJobTable;
import dev.pulse.scheduler.exceptions.PulseDatabaseException;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the job database, schema and tables, applying each numbered migration once. */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          // Relation / object already exists
          "42P07", // duplicate_table
          "42710", // duplicate_object (e.g., index)
          "42701", // duplicate_column
          "42P06" // duplicate_schema
          );

  public static void runMigrations(PulseConfig config) {
    Objects.requireNonNull(config, "Pulse config must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config);
      try (var ds = PostgresJobTable.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(String url, String user, String password, String schema) {
    Objects.requireNonNull(url, "database url must not be null");

    createDatabaseIfNotExists(url, user, password);
    try (var ds = PostgresJobTable.createDataSource(url, user, password)) {
      runMigrations(ds, schema);
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    schema = PostgresJobTable.sanitizeSchema(schema);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schema);
      ensureMigrationTable(conn, schema);
      runPulseMigrations(conn, schema, getMigrations(schema));
    } catch (SQLException e) {
      throw new PulseDatabaseException(e);
    }
  }

  public static void createDatabaseIfNotExists(PulseConfig config) {
    Objects.requireNonNull(config, "Pulse config must not be null");
    if (config.dataSource() != null) {
      logger.debug("PulseConfig specifies data source, skipping createDatabaseIfNotExists");
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = PostgresJobTable.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database().replace("\"", "\"\"") + "\"");
      }
    } catch (SQLException e) {
      // the target database may still be usable even if the admin database is not reachable
      logger.warn("Could not ensure database {} exists: {}", pair.database(), e.getMessage());
    } catch (RuntimeException e) {
      logger.warn("Failed to connect to database {}: {}", pair.url(), e.getMessage());
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }
    var newUrl = base.substring(0, slash + 1) + Constants.POSTGRES_DEFAULT_DB + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(schema));
    }
  }

  static void ensureMigrationTable(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.pulse_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(schema));
    }
  }

  public static int getCurrentVersion(Connection conn, String schema) {
    Objects.requireNonNull(schema, "schema must not be null");
    var sql =
        "SELECT version FROM %s.pulse_migrations ORDER BY version DESC limit 1".formatted(schema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      if (rs.next()) {
        return rs.getInt("version");
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown querying pulse_migrations table", e);
    }

    return 0;
  }

  static void runPulseMigrations(Connection conn, String schema, List<String> migrations) {
    var lastApplied = getCurrentVersion(conn, schema);

    for (var i = 0; i < migrations.size(); i++) {
      var migrationIndex = i + 1;
      if (migrationIndex <= lastApplied) {
        continue;
      }

      logger.info("Applying job table schema migration {}", migrationIndex);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error; Migration was likely already applied. Occurred while executing {}",
              migrationIndex,
              migrations.get(i));
        } else {
          throw new PulseDatabaseException(e);
        }
      }

      try {
        int rowCount;
        var updateSQL = "UPDATE %s.pulse_migrations SET version = ?".formatted(schema);
        try (var stmt = conn.prepareStatement(updateSQL)) {
          stmt.setLong(1, migrationIndex);
          rowCount = stmt.executeUpdate();
        }

        if (rowCount == 0) {
          var insertSql = "INSERT INTO %s.pulse_migrations (version) VALUES (?)".formatted(schema);
          try (var stmt = conn.prepareStatement(insertSql)) {
            stmt.setLong(1, migrationIndex);
            stmt.executeUpdate();
          }
        }
      } catch (SQLException e) {
        throw new PulseDatabaseException(e);
      }

      lastApplied = migrationIndex;
    }
  }

  public static List<String> getMigrations(String schema) {
    Objects.requireNonNull(schema);
    return List.of(migration1).stream().map(m -> m.formatted(schema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.jobs (
          routing_key TEXT NOT NULL,
          body TEXT NOT NULL,
          interval_seconds INTEGER NOT NULL CHECK (interval_seconds > 0),
          next_run TIMESTAMP WITH TIME ZONE NOT NULL,
          one_off BOOLEAN NOT NULL DEFAULT FALSE,
          PRIMARY KEY (routing_key, body)
      );

      CREATE INDEX jobs_next_run_index ON %1$s.jobs (next_run);
      """;
}
