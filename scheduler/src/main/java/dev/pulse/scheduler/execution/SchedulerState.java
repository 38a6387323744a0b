package dev.pulse.scheduler.execution;

/** Where the scheduler loop currently is. */
public enum SchedulerState {
  /** The loop is not running. */
  STOPPED,
  /** No job exists; waiting for a wakeup. */
  IDLE,
  /** The earliest job is not due yet; waiting for it or for a wakeup. */
  WAITING,
  /** The earliest job is due and is being handed to the publisher. */
  DUE
}
