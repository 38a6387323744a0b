package dev.pulse.scheduler;

import dev.pulse.scheduler.broker.AmqpMessageBroker;
import dev.pulse.scheduler.broker.MessageBroker;
import dev.pulse.scheduler.config.PulseConfig;
import dev.pulse.scheduler.database.JobTable;
import dev.pulse.scheduler.database.PostgresJobTable;
import dev.pulse.scheduler.execution.JobManager;
import dev.pulse.scheduler.execution.Publisher;
import dev.pulse.scheduler.execution.SchedulerService;
import dev.pulse.scheduler.http.JobServer;
import dev.pulse.scheduler.migrations.MigrationManager;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A running scheduler: job table, broker connection, scheduling loop, job manager and (optionally)
 * the HTTP front end, wired together and owned as one unit.
 *
 * <p>{@link #launch(PulseConfig)} connects to the database and the broker and fails if either is
 * unreachable. {@link #close()} stops the loop, waits for in-flight publishes, and releases the
 * connections it opened.
 */
public class Pulse implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(Pulse.class);
  private static final String version = loadVersionFromResources();

  private static @Nullable String loadVersionFromResources() {
    final String PROPERTIES_FILE = "/dev/pulse/scheduler/app.properties";
    final String VERSION_KEY = "app.version";
    Properties props = new Properties();
    try (InputStream input = Pulse.class.getResourceAsStream(PROPERTIES_FILE)) {

      if (input == null) {
        logger.warn("Could not find {} resource file", PROPERTIES_FILE);
        return "<unknown (resource missing)>";
      }

      props.load(input);
      return props.getProperty(VERSION_KEY, "<unknown>");

    } catch (IOException ex) {
      logger.error("Error loading version properties", ex);
      return "<unknown (IO Error)>";
    }
  }

  public static @Nullable String version() {
    return version;
  }

  private final JobTable jobTable;
  private final SchedulerService scheduler;
  private final JobManager jobManager;
  private final @Nullable JobServer jobServer;
  private final List<AutoCloseable> resources;
  private boolean closed = false;

  Pulse(
      @NonNull JobTable jobTable,
      @NonNull SchedulerService scheduler,
      @NonNull JobManager jobManager,
      @Nullable JobServer jobServer,
      @NonNull List<AutoCloseable> resources) {
    this.jobTable = Objects.requireNonNull(jobTable);
    this.scheduler = Objects.requireNonNull(scheduler);
    this.jobManager = Objects.requireNonNull(jobManager);
    this.jobServer = jobServer;
    this.resources = new ArrayList<>(resources);
  }

  /**
   * Connect to the database and the broker described by {@code config}, run migrations if
   * enabled, and start the scheduling loop and HTTP front end.
   */
  public static Pulse launch(@NonNull PulseConfig config) throws IOException, TimeoutException {
    Objects.requireNonNull(config, "Pulse config must not be null");
    if (config.dataSource() == null && config.databaseUrl() == null) {
      throw new IllegalArgumentException("PulseConfig must specify a databaseUrl or dataSource");
    }
    logger.info("Launching Pulse {} with {}", version, config);

    if (config.migrate()) {
      MigrationManager.runMigrations(config);
    }

    List<AutoCloseable> opened = new ArrayList<>();
    try {
      var jobTable = new PostgresJobTable(config);
      opened.add(jobTable);
      jobTable.ping();

      var broker = AmqpMessageBroker.connect(config.brokerUri(), config.exchange());
      opened.add(broker);

      return launch(config, jobTable, broker, Clock.systemUTC(), opened);
    } catch (IOException | TimeoutException | RuntimeException e) {
      closeAll(opened);
      throw e;
    }
  }

  /** Start the loop and front end on top of an already connected table and broker. */
  public static Pulse launch(
      @NonNull PulseConfig config,
      @NonNull JobTable jobTable,
      @NonNull MessageBroker broker,
      @NonNull Clock clock,
      @NonNull List<AutoCloseable> resources)
      throws IOException {
    var publisher = new Publisher(jobTable, broker, clock);
    var scheduler =
        new SchedulerService(jobTable, publisher, clock, config.maxConcurrentPublishes());
    var jobManager = new JobManager(jobTable, scheduler, clock);

    JobServer jobServer = null;
    if (config.httpServer()) {
      jobServer = new JobServer(config.httpHost(), config.httpPort(), jobManager);
    }

    scheduler.start();
    if (jobServer != null) {
      jobServer.start();
    }
    logger.info("Pulse launched");
    return new Pulse(jobTable, scheduler, jobManager, jobServer, resources);
  }

  public JobManager jobManager() {
    return jobManager;
  }

  public SchedulerService scheduler() {
    return scheduler;
  }

  public JobTable jobTable() {
    return jobTable;
  }

  public @Nullable JobServer jobServer() {
    return jobServer;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    logger.info("Shutting down Pulse");

    if (jobServer != null) {
      jobServer.stop();
    }
    scheduler.stop();

    var reversed = new ArrayList<>(resources);
    Collections.reverse(reversed);
    closeAll(reversed);
    logger.info("Pulse shut down");
  }

  private static void closeAll(List<AutoCloseable> resources) {
    for (var resource : resources) {
      try {
        resource.close();
      } catch (Exception e) {
        logger.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
      }
    }
  }
}
