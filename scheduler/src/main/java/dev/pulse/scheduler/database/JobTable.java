package dev.pulse.scheduler.database;

import dev.pulse.scheduler.job.Job;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage of {@link Job} definitions keyed by routing key and body. The table is the only
 * source of truth for which jobs exist and when each one runs next.
 *
 * <p>Implementations report store failures as {@link
 * dev.pulse.scheduler.exceptions.PulseDatabaseException} and never retry on their own.
 */
public interface JobTable {

  /** The job stored under ({@code routingKey}, {@code body}), if any. */
  Optional<Job> get(String routingKey, String body);

  /**
   * Insert a job or, if its key already exists, replace the stored interval and shift the stored
   * next run by the interval change ({@code new nextRun = old nextRun + (new interval - old
   * interval)}). The {@code nextRun} of the argument is only used for a new key.
   *
   * @return the job as stored after the upsert
   */
  Job insert(Job job);

  /**
   * Set the next run of an existing job, ignoring the phase rule of {@link #insert(Job)}.
   *
   * @return false if no job exists under the key
   */
  boolean updateNextRun(String routingKey, String body, Instant nextRun);

  /**
   * Set the next run of {@code current} to {@code nextRun}, provided the stored row still equals
   * {@code current}.
   *
   * @return false if the job was deleted, rescheduled or triggered since {@code current} was read
   */
  boolean advance(Job current, Instant nextRun);

  /** @return false if no job exists under the key */
  boolean delete(String routingKey, String body);

  /**
   * Delete {@code current}, provided the stored row still equals it.
   *
   * @return false if the job was deleted or changed since {@code current} was read
   */
  boolean deleteIfUnchanged(Job current);

  /** The job with the smallest next run; ties are broken by routing key, then body. */
  Optional<Job> earliest();

  long count();
}
