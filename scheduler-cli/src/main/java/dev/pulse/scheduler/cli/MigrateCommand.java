package dev.pulse.scheduler.cli;

import dev.pulse.scheduler.database.PostgresJobTable;
import dev.pulse.scheduler.migrations.MigrationManager;

import java.io.PrintWriter;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create or upgrade the job table",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-r", "--app-role"},
      description = "A role that should be granted access to the job table")
  String appRole;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var url = dbOptions.requireUrl();
    out.println("Starting Pulse migrations");
    out.format("  Database: %s%n", url);
    out.format("  Database User: %s%n", dbOptions.user());
    out.format("  Schema: %s%n", dbOptions.schema());

    MigrationManager.runMigrations(
        url, dbOptions.user(), dbOptions.password(), dbOptions.schema());
    grantSchemaPermissions(out, url);
    out.println("Migrations complete");
    return 0;
  }

  void grantSchemaPermissions(PrintWriter out, String url) throws SQLException {
    if (appRole == null || appRole.isEmpty()) {
      return;
    }

    var schema = PostgresJobTable.sanitizeSchema(dbOptions.schema());
    var role = "\"" + appRole.replace("\"", "\"\"") + "\"";
    out.format("Granting permissions for the %s schema to %s%n", schema, role);

    String[] queries = {
      "GRANT USAGE ON SCHEMA %s TO %s",
      "GRANT ALL PRIVILEGES ON ALL TABLES IN SCHEMA %s TO %s",
      "ALTER DEFAULT PRIVILEGES IN SCHEMA %s GRANT ALL ON TABLES TO %s"
    };
    try (var conn = DriverManager.getConnection(url, dbOptions.user(), dbOptions.password());
        var stmt = conn.createStatement()) {
      for (var query : queries) {
        stmt.execute(query.formatted(schema, role));
      }
    }
  }
}
