package dev.pulse.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

@ExtendWith(SystemStubsExtension.class)
public class StartCommandTest {

  @SystemStub private EnvironmentVariables envVars = new EnvironmentVariables();

  private static StartCommand parse(String... args) {
    var start = new StartCommand();
    new CommandLine(start).parseArgs(args);
    return start;
  }

  @Test
  public void environmentSuppliesDefaults() {
    envVars.set("PULSE_JDBC_URL", "jdbc:postgresql://db:5432/pulse");
    envVars.set("PULSE_AMQP_URI", "amqp://rabbit:5672");

    var config = parse().resolveConfig();
    assertEquals("jdbc:postgresql://db:5432/pulse", config.databaseUrl());
    assertEquals("amqp://rabbit:5672", config.brokerUri());
    assertEquals("pulse", config.databaseSchema());
    assertTrue(config.httpServer());
    assertTrue(config.migrate());
  }

  @Test
  public void optionsOverrideConfigFile(@TempDir Path dir) throws Exception {
    envVars.set("PULSE_JDBC_URL", "jdbc:postgresql://env:5432/pulse");
    var file = dir.resolve("pulse.conf");
    Files.writeString(
        file,
        """
        pulse.database.url = "jdbc:postgresql://file:5432/pulse"
        pulse.database.schema = "from_file"
        pulse.broker.exchange = "file-exchange"
        pulse.http.port = 18000
        """);

    var config =
        parse(
                "-c", file.toString(),
                "--exchange", "cli-exchange",
                "--no-http",
                "--no-migrate",
                "--max-concurrent-publishes", "3")
            .resolveConfig();

    assertEquals("jdbc:postgresql://file:5432/pulse", config.databaseUrl());
    assertEquals("from_file", config.databaseSchema());
    assertEquals("cli-exchange", config.exchange());
    assertEquals(18000, config.httpPort());
    assertFalse(config.httpServer());
    assertFalse(config.migrate());
    assertEquals(3, config.maxConcurrentPublishes());
  }

  @Test
  public void databaseOptionsOverrideEverything() {
    envVars.set("PULSE_JDBC_URL", "jdbc:postgresql://env:5432/pulse");
    envVars.set("PGUSER", "env-user");

    var config =
        parse(
                "-D", "jdbc:postgresql://cli:5432/jobs",
                "-U", "cli-user",
                "--schema", "cli_schema",
                "--http-host", "127.0.0.1",
                "--http-port", "9999")
            .resolveConfig();

    assertEquals("jdbc:postgresql://cli:5432/jobs", config.databaseUrl());
    assertEquals("cli-user", config.dbUser());
    assertEquals("cli_schema", config.databaseSchema());
    assertEquals("127.0.0.1", config.httpHost());
    assertEquals(9999, config.httpPort());
  }

  @Test
  public void missingDatabaseUrlFails() {
    envVars.remove("PULSE_JDBC_URL");

    var cmd = PulseCommand.commandLine();
    var err = new StringWriter();
    cmd.setErr(new PrintWriter(err));

    assertEquals(2, cmd.execute("start"));
    assertTrue(err.toString().contains("No database URL"));
  }

  @Test
  public void debugRaisesLogLevel() {
    StartCommand.enableDebugLogging();
    assertTrue(LoggerFactory.getLogger("dev.pulse.scheduler.execution").isDebugEnabled());
  }
}
