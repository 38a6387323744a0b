package dev.pulse.scheduler.exceptions;

import java.sql.SQLException;

/**
 * Thrown when the job table cannot be read or written. The job table does not retry; callers
 * decide whether to retry, log, or fail.
 */
public class PulseDatabaseException extends RuntimeException {

  public PulseDatabaseException(Throwable e) {
    super(
        String.format(
            "Job table access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
  }

  public PulseDatabaseException(String message) {
    super(message);
  }

  /** SQL state of the underlying error, or null if it did not come from the driver */
  public String sqlState() {
    return getCause() instanceof SQLException ? ((SQLException) getCause()).getSQLState() : null;
  }
}
