package dev.pulse.scheduler.cli;

import dev.pulse.scheduler.Constants;
import dev.pulse.scheduler.config.PulseConfig;

import java.util.Objects;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description = "JDBC URL of the job database (defaults to PULSE_JDBC_URL env var)")
  String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "user name for the job database (defaults to PGUSER env var)")
  String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "password for the job database (defaults to PGPASSWORD env var)",
      arity = "0..1",
      interactive = true)
  String password;

  @Option(
      names = {"--schema"},
      description = "schema holding the job table (default: " + Constants.DB_SCHEMA + ")")
  String schema;

  public String url() {
    return Objects.requireNonNullElseGet(
        this.url, () -> System.getenv(Constants.JDBC_URL_ENV_VAR));
  }

  public String user() {
    return Objects.requireNonNullElseGet(
        this.user, () -> System.getenv(Constants.POSTGRES_USER_ENV_VAR));
  }

  public String password() {
    return Objects.requireNonNullElseGet(
        this.password, () -> System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR));
  }

  public String schema() {
    return Objects.requireNonNullElse(schema, Constants.DB_SCHEMA);
  }

  /** The database URL, failing with a usage hint if neither the option nor the env var is set. */
  public String requireUrl() {
    var url = url();
    if (url == null || url.isEmpty()) {
      throw new IllegalArgumentException(
          "No database URL: pass --db-url or set " + Constants.JDBC_URL_ENV_VAR);
    }
    return url;
  }

  /** Override the settings of {@code config} with the options given on the command line. */
  public PulseConfig applyTo(PulseConfig config) {
    if (url != null) config = config.withDatabaseUrl(url);
    if (user != null) config = config.withDbUser(user);
    if (password != null) config = config.withDbPassword(password);
    if (schema != null) config = config.withDatabaseSchema(schema);
    return config;
  }
}
