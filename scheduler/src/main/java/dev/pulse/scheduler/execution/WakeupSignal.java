package dev.pulse.scheduler.execution;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Payload-free wakeup for the scheduler loop. Signals raised while nobody is waiting are kept, and
 * any number of them coalesce into a single wakeup.
 */
public class WakeupSignal {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition signalled = lock.newCondition();
  private boolean pending = false;

  public void signal() {
    lock.lock();
    try {
      pending = true;
      signalled.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Block until a signal arrives or {@code timeout} elapses, consuming the pending signal.
   *
   * @param timeout maximum time to wait, or null to wait for a signal indefinitely
   * @return true if woken by a signal, false if the timeout elapsed
   */
  public boolean await(Duration timeout) throws InterruptedException {
    lock.lock();
    try {
      long nanos = timeout == null ? Long.MAX_VALUE : toNanos(timeout);
      while (!pending) {
        if (timeout == null) {
          signalled.await();
        } else {
          if (nanos <= 0) {
            return false;
          }
          nanos = signalled.awaitNanos(nanos);
        }
      }
      pending = false;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isPending() {
    lock.lock();
    try {
      return pending;
    } finally {
      lock.unlock();
    }
  }

  private static long toNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return timeout.isNegative() ? 0 : Long.MAX_VALUE;
    }
  }
}
