package dev.pulse.scheduler.cli;

import dev.pulse.scheduler.database.PostgresJobTable;
import dev.pulse.scheduler.migrations.MigrationManager;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Deletes every job by dropping the scheduler schema and migrating it again. Other schemas in the
 * same database are left alone.
 */
@Command(name = "reset", description = "Delete all jobs and recreate the scheduler schema")
public class ResetCommand implements Callable<Integer> {

  @Option(
      names = {"-y", "--yes"},
      description = "Skip confirmation prompt")
  boolean skipConfirmation;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var url = dbOptions.requireUrl();
    var schema = dbOptions.schema();

    if (!skipConfirmation) {
      var prompt =
          "This command deletes every scheduled job in schema %s. Are you sure you want to proceed? "
              .formatted(schema);
      if (!PulseCommand.confirm(prompt)) {
        out.println("Reset cancelled");
        return 0;
      }
    }

    MigrationManager.createDatabaseIfNotExists(url, dbOptions.user(), dbOptions.password());
    long removed;
    try (var conn = DriverManager.getConnection(url, dbOptions.user(), dbOptions.password());
        var stmt = conn.createStatement()) {
      removed = countJobs(conn, schema);
      stmt.execute(
          "DROP SCHEMA IF EXISTS %s CASCADE".formatted(PostgresJobTable.sanitizeSchema(schema)));
    }
    MigrationManager.runMigrations(url, dbOptions.user(), dbOptions.password(), schema);

    out.format("Removed %d jobs, schema %s recreated%n", removed, schema);
    return 0;
  }

  static long countJobs(Connection conn, String schema) throws SQLException {
    try (var tables = conn.getMetaData().getTables(null, schema, "jobs", new String[] {"TABLE"})) {
      if (!tables.next()) {
        return 0;
      }
    }
    try (var stmt = conn.createStatement();
        var rs =
            stmt.executeQuery(
                "SELECT COUNT(*) FROM %s.jobs".formatted(PostgresJobTable.sanitizeSchema(schema)))) {
      return rs.next() ? rs.getLong(1) : 0;
    }
  }
}
