package dev.pulse.scheduler.execution;

import dev.pulse.scheduler.Constants;
import dev.pulse.scheduler.broker.MessageBroker;
import dev.pulse.scheduler.broker.OutboundMessage;
import dev.pulse.scheduler.database.JobTable;
import dev.pulse.scheduler.job.Job;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers a due job: first moves its next run forward in the job table (or removes a one-off
 * job), then sends its payload to the broker.
 *
 * <p>The two steps are not atomic. A failure between them skips one delivery rather than
 * delivering twice.
 */
public class Publisher {

  private static final Logger logger = LoggerFactory.getLogger(Publisher.class);

  private final JobTable jobTable;
  private final MessageBroker broker;
  private final Clock clock;

  public Publisher(JobTable jobTable, MessageBroker broker, Clock clock) {
    this.jobTable = Objects.requireNonNull(jobTable, "jobTable must not be null");
    this.broker = Objects.requireNonNull(broker, "broker must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /**
   * Advance and emit {@code job} on the calling thread.
   *
   * @return false if the job no longer exists as read and nothing was sent
   */
  public boolean publish(Job job) {
    if (!advance(job, clock.instant())) {
      return false;
    }
    emit(job);
    return true;
  }

  /**
   * Record that {@code job} ran at {@code now}: a recurring job gets {@code now + interval} as its
   * next run, a one-off job is deleted.
   *
   * <p>Both writes only apply to the row exactly as {@code job} describes it.
   *
   * @return false if the job was removed, rescheduled or triggered since it was read
   */
  public boolean advance(Job job, Instant now) {
    if (job.oneOff()) {
      logger.debug("Deleting one-off job {}", job.key());
      return jobTable.deleteIfUnchanged(job);
    }
    var nextRun = now.plus(job.interval()).truncatedTo(ChronoUnit.MICROS);
    logger.debug("Advancing job {} to {}", job.key(), nextRun);
    return jobTable.advance(job, nextRun);
  }

  /** Send the payload of {@code job} to the broker. */
  public void emit(Job job) {
    broker.publish(message(job, clock.instant()));
    logger.debug("Published job {}", job.key());
  }

  static OutboundMessage message(Job job, Instant publishedAt) {
    return new OutboundMessage(
        job.routingKey(),
        job.body(),
        Map.of(
            Constants.INTERVAL_HEADER, job.intervalSeconds(),
            Constants.PUBLISHED_AT_HEADER, publishedAt.toString()),
        true,
        job.interval(),
        publishedAt);
  }
}
