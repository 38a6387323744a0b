package dev.pulse.scheduler.cli;

import dev.pulse.scheduler.Pulse;
import dev.pulse.scheduler.config.PulseConfig;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "start",
    description = "Run the scheduler until interrupted",
    mixinStandardHelpOptions = true)
public class StartCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(StartCommand.class);

  @Option(
      names = {"-c", "--config"},
      description = "HOCON configuration file")
  Path configFile;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"--amqp-uri"},
      description = "AMQP URI of the broker (defaults to PULSE_AMQP_URI env var)")
  String amqpUri;

  @Option(
      names = {"--exchange"},
      description = "exchange jobs are published to (default: the broker's default exchange)")
  String exchange;

  @Option(
      names = {"--http-host"},
      description = "address the HTTP front end binds to")
  String httpHost;

  @Option(
      names = {"--http-port"},
      description = "port the HTTP front end listens on")
  Integer httpPort;

  @Option(
      names = {"--no-http"},
      description = "do not start the HTTP front end")
  boolean noHttp;

  @Option(
      names = {"--no-migrate"},
      description = "do not create or upgrade the job table on startup")
  boolean noMigrate;

  @Option(
      names = {"--max-concurrent-publishes"},
      description = "maximum number of broker sends in flight")
  Integer maxConcurrentPublishes;

  @Option(
      names = {"-d", "--debug"},
      description = "log scheduler activity at debug level")
  boolean debug;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    if (debug) {
      enableDebugLogging();
    }

    var config = resolveConfig();
    if (config.databaseUrl() == null) {
      spec.commandLine()
          .getErr()
          .println("No database URL: pass --db-url, set PULSE_JDBC_URL or use a config file");
      return 2;
    }

    var stopped = new CountDownLatch(1);
    var pulse = Pulse.launch(config);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.info("Shutdown requested");
                  pulse.close();
                  stopped.countDown();
                },
                "PulseShutdownHook"));

    spec.commandLine().getOut().println("Pulse scheduler running, press Ctrl+C to stop");
    spec.commandLine().getOut().flush();
    stopped.await();
    return 0;
  }

  /** Settings from the config file (or environment and defaults) overridden by the options. */
  PulseConfig resolveConfig() {
    var config = configFile != null ? PulseConfig.fromFile(configFile) : PulseConfig.defaultsFromEnv();
    config = dbOptions.applyTo(config);
    if (amqpUri != null) config = config.withBrokerUri(amqpUri);
    if (exchange != null) config = config.withExchange(exchange);
    if (httpHost != null) config = config.withHttpHost(httpHost);
    if (httpPort != null) config = config.withHttpPort(httpPort);
    if (noHttp) config = config.withHttpServer(false);
    if (noMigrate) config = config.withMigrate(false);
    if (maxConcurrentPublishes != null) {
      config = config.withMaxConcurrentPublishes(maxConcurrentPublishes);
    }
    return config;
  }

  static void enableDebugLogging() {
    var factoryLogger = LoggerFactory.getLogger("dev.pulse");
    if (factoryLogger instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) factoryLogger).setLevel(Level.DEBUG);
    } else {
      logger.warn("Cannot change log level of {}", factoryLogger.getClass().getName());
    }
  }
}
