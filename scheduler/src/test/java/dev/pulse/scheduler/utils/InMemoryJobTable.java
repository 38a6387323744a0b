package dev.pulse.scheduler.utils;

import dev.pulse.scheduler.database.JobTable;
import dev.pulse.scheduler.exceptions.PulseDatabaseException;
import dev.pulse.scheduler.job.Job;
import dev.pulse.scheduler.job.JobKey;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link JobTable} kept in memory, with the same upsert rule as the PostgreSQL table. */
public class InMemoryJobTable implements JobTable {

  private final TreeMap<JobKey, Job> jobs = new TreeMap<>();
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private final AtomicInteger earliestCalls = new AtomicInteger();

  /** Make the next {@code count} operations fail as if the database were down. */
  public void failNext(int count) {
    failuresLeft.set(count);
  }

  public int earliestCalls() {
    return earliestCalls.get();
  }

  /** Store {@code job} as is, bypassing the upsert rule. */
  public synchronized void put(Job job) {
    jobs.put(job.key(), job);
  }

  @Override
  public synchronized Optional<Job> get(String routingKey, String body) {
    maybeFail();
    return Optional.ofNullable(jobs.get(new JobKey(routingKey, body)));
  }

  @Override
  public synchronized Job insert(Job job) {
    maybeFail();
    var stored =
        jobs.merge(
            job.key(),
            job,
            (old, update) ->
                new Job(
                    old.routingKey(),
                    old.body(),
                    update.interval(),
                    old.nextRun().plus(update.interval().minus(old.interval())),
                    update.oneOff()));
    return stored;
  }

  @Override
  public synchronized boolean updateNextRun(String routingKey, String body, Instant nextRun) {
    maybeFail();
    var key = new JobKey(routingKey, body);
    var job = jobs.get(key);
    if (job == null) {
      return false;
    }
    jobs.put(key, job.withNextRun(nextRun));
    return true;
  }

  @Override
  public synchronized boolean advance(Job current, Instant nextRun) {
    maybeFail();
    if (!current.equals(jobs.get(current.key()))) {
      return false;
    }
    jobs.put(current.key(), current.withNextRun(nextRun));
    return true;
  }

  @Override
  public synchronized boolean delete(String routingKey, String body) {
    maybeFail();
    return jobs.remove(new JobKey(routingKey, body)) != null;
  }

  @Override
  public synchronized boolean deleteIfUnchanged(Job current) {
    maybeFail();
    return jobs.remove(current.key(), current);
  }

  @Override
  public synchronized Optional<Job> earliest() {
    earliestCalls.incrementAndGet();
    maybeFail();
    return jobs.values().stream()
        .min(Comparator.comparing(Job::nextRun).thenComparing(Job::key));
  }

  @Override
  public synchronized long count() {
    maybeFail();
    return jobs.size();
  }

  private void maybeFail() {
    if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new PulseDatabaseException("simulated database outage");
    }
  }
}
