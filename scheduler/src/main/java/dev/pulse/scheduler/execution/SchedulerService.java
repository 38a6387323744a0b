package dev.pulse.scheduler.execution;

import dev.pulse.scheduler.database.JobTable;
import dev.pulse.scheduler.exceptions.PulseDatabaseException;
import dev.pulse.scheduler.job.Job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scheduling loop. A single thread repeatedly asks the job table for the earliest job and
 * either publishes it (due), waits for it (waiting), or waits for a wakeup (idle).
 *
 * <p>Every wakeup, whether from the timer or from {@link #wakeUp(String)}, goes back to the job
 * table. The loop never acts on a job read before it last slept or blocked on a full publish pool,
 * so a job that was cancelled, triggered, or overtaken by an earlier one meanwhile is handled by
 * the same re-read.
 *
 * <p>Next-run times are advanced on the loop thread; only the broker send runs on the publish
 * pool, bounded by {@code maxConcurrentPublishes}.
 */
public class SchedulerService {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerService.class);

  static final Duration MIN_RETRY_DELAY = Duration.ofSeconds(1);
  static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

  private final JobTable jobTable;
  private final Publisher publisher;
  private final Clock clock;
  private final int maxConcurrentPublishes;

  private final WakeupSignal wakeup = new WakeupSignal();
  private final AtomicInteger running = new AtomicInteger();

  private volatile boolean active = false;
  private volatile SchedulerState state = SchedulerState.STOPPED;
  private Thread workerThread;
  private CountDownLatch shutdownLatch;
  private ExecutorService publishExecutor;
  private Semaphore publishPermits;
  private Duration minRetryDelay = MIN_RETRY_DELAY;

  public SchedulerService(
      JobTable jobTable, Publisher publisher, Clock clock, int maxConcurrentPublishes) {
    this.jobTable = Objects.requireNonNull(jobTable, "jobTable must not be null");
    this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (maxConcurrentPublishes < 1) {
      throw new IllegalArgumentException("maxConcurrentPublishes must be at least 1");
    }
    this.maxConcurrentPublishes = maxConcurrentPublishes;
  }

  void setRetryDelayForTest(Duration delay) {
    minRetryDelay = delay;
  }

  /**
   * Ask the loop to re-read the job table now instead of at the end of its current wait. Safe to
   * call from any thread, at any time; redundant calls coalesce.
   */
  public void wakeUp(String reason) {
    logger.debug("Wakeup: {}", reason);
    wakeup.signal();
  }

  /** Number of broker sends dispatched and not yet finished. */
  public int running() {
    return running.get();
  }

  public SchedulerState state() {
    return state;
  }

  public synchronized void start() {
    if (active) {
      logger.warn("PulseSchedulerThread is already running.");
      return;
    }

    active = true;
    shutdownLatch = new CountDownLatch(1);
    publishPermits = new Semaphore(maxConcurrentPublishes);
    publishExecutor = Executors.newFixedThreadPool(maxConcurrentPublishes, publishThreadFactory());
    workerThread = new Thread(this::runLoop, "PulseSchedulerThread");
    workerThread.setDaemon(true);
    workerThread.start();
    logger.info("Scheduler started with {} publish threads", maxConcurrentPublishes);
  }

  public synchronized void stop() {
    logger.debug("stop() called");

    if (!active) {
      logger.warn("PulseSchedulerThread is not running.");
      return;
    }
    active = false;
    wakeup.signal();

    if (workerThread != null) {
      try {
        workerThread.join(STOP_TIMEOUT.toMillis());
        if (workerThread.isAlive()) {
          logger.warn("PulseSchedulerThread did not stop gracefully. Interrupting...");
          workerThread.interrupt();
        }
        shutdownLatch.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warn("Interrupted while stopping PulseSchedulerThread", e);
      } finally {
        workerThread = null;
      }
    }

    publishExecutor.shutdown();
    try {
      if (!publishExecutor.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("{} publishes still running at shutdown", running.get());
        publishExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      publishExecutor.shutdownNow();
    }
    logger.info("Scheduler stopped.");
  }

  public synchronized boolean isStopped() {
    if (workerThread == null) {
      return true;
    }
    return shutdownLatch != null && shutdownLatch.getCount() == 0 && !workerThread.isAlive();
  }

  private void runLoop() {
    logger.debug("PulseSchedulerThread started");
    var retryDelay = minRetryDelay;

    try {
      while (active) {
        try {
          tick();
          retryDelay = minRetryDelay;
        } catch (PulseDatabaseException e) {
          logger.error("Job table unavailable, retrying in {}", retryDelay, e);
          wakeup.await(retryDelay);
          retryDelay = min(retryDelay.multipliedBy(2), MAX_RETRY_DELAY);
        } catch (RuntimeException e) {
          logger.error("Scheduler iteration failed, retrying in {}", retryDelay, e);
          wakeup.await(retryDelay);
          retryDelay = min(retryDelay.multipliedBy(2), MAX_RETRY_DELAY);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (active) {
        logger.error("PulseSchedulerThread interrupted");
        active = false;
      }
    } finally {
      state = SchedulerState.STOPPED;
      shutdownLatch.countDown();
      logger.debug("PulseSchedulerThread has ended. Exiting");
    }
  }

  private void tick() throws InterruptedException {
    // the permit is taken before the read, so the job and now below are never stale
    publishPermits.acquire();
    var handedOff = false;
    Optional<Job> next;
    Instant now;
    try {
      next = jobTable.earliest();
      now = clock.instant();
      if (next.isPresent() && next.get().isDue(now)) {
        state = SchedulerState.DUE;
        handedOff = dispatch(next.get(), now);
        return;
      }
    } finally {
      if (!handedOff) {
        publishPermits.release();
      }
    }

    if (next.isEmpty()) {
      state = SchedulerState.IDLE;
      logger.debug("No jobs scheduled, waiting for wakeup");
      wakeup.await(null);
      return;
    }

    var job = next.get();
    state = SchedulerState.WAITING;
    var remaining = job.remaining(now);
    logger.debug("Next job {} in {}", job.key(), remaining);
    if (wakeup.await(remaining)) {
      logger.debug("Woken up before {} was due", job.key());
    }
  }

  /**
   * Advance {@code job} and hand its send to the publish pool, which then owns the permit.
   *
   * @return false if nothing was handed off
   */
  private boolean dispatch(Job job, Instant now) {
    if (!publisher.advance(job, now)) {
      logger.debug("Job {} changed before it could be published", job.key());
      return false;
    }

    running.incrementAndGet();
    try {
      publishExecutor.execute(() -> emit(job));
      return true;
    } catch (RejectedExecutionException e) {
      running.decrementAndGet();
      logger.warn("Publish of {} rejected, scheduler is shutting down", job.key());
      return false;
    }
  }

  private void emit(Job job) {
    try {
      publisher.emit(job);
    } catch (RuntimeException e) {
      logger.error("Failed to publish job {}", job.key(), e);
    } finally {
      running.decrementAndGet();
      publishPermits.release();
    }
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  private static ThreadFactory publishThreadFactory() {
    var counter = new AtomicInteger();
    return r -> {
      var thread = new Thread(r, "PulsePublisher-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
