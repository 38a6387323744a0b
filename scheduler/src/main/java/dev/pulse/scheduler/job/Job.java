package dev.pulse.scheduler.job;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A schedulable unit: the payload {@code body} published to {@code routingKey} every {@code
 * interval}.
 *
 * <p>The pair ({@code routingKey}, {@code body}) is the identity of a job. Two different bodies on
 * the same routing key are independent jobs.
 *
 * @param routingKey routing key the payload is published to
 * @param body opaque payload, also part of the job identity
 * @param interval spacing between runs, in whole seconds
 * @param nextRun instant of the next scheduled publish
 * @param oneOff if true the job is deleted after its first publish instead of rescheduled
 */
public record Job(
    String routingKey, String body, Duration interval, Instant nextRun, boolean oneOff) {

  public Job {
    Objects.requireNonNull(routingKey, "routingKey must not be null");
    Objects.requireNonNull(body, "body must not be null");
    Objects.requireNonNull(interval, "interval must not be null");
    Objects.requireNonNull(nextRun, "nextRun must not be null");
  }

  /** Create a job whose first run is one {@code interval} after {@code now}. */
  public static Job create(
      String routingKey, String body, Duration interval, boolean oneOff, Instant now) {
    return new Job(
        routingKey, body, interval, now.plus(interval).truncatedTo(ChronoUnit.MICROS), oneOff);
  }

  public JobKey key() {
    return new JobKey(routingKey, body);
  }

  public long intervalSeconds() {
    return interval.toSeconds();
  }

  /** Time left until {@link #nextRun()}, negative if the job is overdue. */
  public Duration remaining(Instant now) {
    return Duration.between(now, nextRun);
  }

  public boolean isDue(Instant now) {
    return !nextRun.isAfter(now);
  }

  public Job withNextRun(Instant nextRun) {
    return new Job(routingKey, body, interval, nextRun, oneOff);
  }
}
