package dev.pulse.scheduler.execution;

import dev.pulse.scheduler.database.JobTable;
import dev.pulse.scheduler.exceptions.PulseJobNotFoundException;
import dev.pulse.scheduler.job.Job;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers that register, trigger, cancel and inspect jobs. Every mutation is
 * written to the job table first and then wakes the scheduler so it re-reads the table
 * immediately.
 */
public class JobManager {

  private static final Logger logger = LoggerFactory.getLogger(JobManager.class);

  private final JobTable jobTable;
  private final SchedulerService scheduler;
  private final Clock clock;

  public JobManager(JobTable jobTable, SchedulerService scheduler, Clock clock) {
    this.jobTable = Objects.requireNonNull(jobTable, "jobTable must not be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Insert a job, or change the interval of an existing one. A new job first runs one interval
   * from now. For an existing job the next run moves by the difference between the new and the
   * old interval.
   *
   * @param intervalSeconds seconds between runs, at least 1
   * @return the job as stored
   * @throws IllegalArgumentException if the routing key is empty or the interval is not positive
   */
  public Job schedule(String routingKey, String body, long intervalSeconds, boolean oneOff) {
    validateKey(routingKey, body);
    if (intervalSeconds < 1) {
      throw new IllegalArgumentException("interval must be >= 1");
    }
    if (intervalSeconds > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("interval must be <= " + Integer.MAX_VALUE);
    }

    var job =
        Job.create(routingKey, body, Duration.ofSeconds(intervalSeconds), oneOff, clock.instant());
    var stored = jobTable.insert(job);
    scheduler.wakeUp("new job");
    logger.debug("Job is scheduled: {}", stored);
    return stored;
  }

  /**
   * Make an existing job due now. Its interval is unchanged; after it runs, the following run is
   * one interval later.
   *
   * @throws PulseJobNotFoundException if the job does not exist
   */
  public Job trigger(String routingKey, String body) {
    validateKey(routingKey, body);
    var job = get(routingKey, body);
    var now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    if (!jobTable.updateNextRun(routingKey, body, now)) {
      throw new PulseJobNotFoundException(routingKey, body);
    }
    scheduler.wakeUp("job is triggered");
    logger.debug("Job is triggered: {}", job.key());
    return job.withNextRun(now);
  }

  /**
   * Delete a job. A publish already handed to the broker is not recalled.
   *
   * @throws PulseJobNotFoundException if the job does not exist
   */
  public void cancel(String routingKey, String body) {
    validateKey(routingKey, body);
    if (!jobTable.delete(routingKey, body)) {
      throw new PulseJobNotFoundException(routingKey, body);
    }
    scheduler.wakeUp("job cancelled");
    logger.debug("Job is cancelled: {}/{}", routingKey, body);
  }

  /** @throws PulseJobNotFoundException if the job does not exist */
  public Job get(String routingKey, String body) {
    validateKey(routingKey, body);
    return jobTable
        .get(routingKey, body)
        .orElseThrow(() -> new PulseJobNotFoundException(routingKey, body));
  }

  /** Count of all jobs in the job table. */
  public long total() {
    return jobTable.count();
  }

  /** Number of publishes currently in flight. */
  public int running() {
    return scheduler.running();
  }

  private static void validateKey(String routingKey, String body) {
    if (routingKey == null || routingKey.isEmpty()) {
      throw new IllegalArgumentException("routing_key must not be empty");
    }
    if (body == null) {
      throw new IllegalArgumentException("body must not be null");
    }
  }
}
