package dev.pulse.scheduler.exceptions;

/**
 * {@code PulseJobNotFoundException} is thrown by job operations such as trigger or cancel that
 * require the job to exist.
 */
public class PulseJobNotFoundException extends RuntimeException {
  private final String routingKey;
  private final String body;

  public PulseJobNotFoundException(String routingKey, String body) {
    super(String.format("Job does not exist %s/%s", routingKey, body));
    this.routingKey = routingKey;
    this.body = body;
  }

  /** Routing key of the job that was targeted, but did not exist */
  public String routingKey() {
    return routingKey;
  }

  /** Body of the job that was targeted, but did not exist */
  public String body() {
    return body;
  }
}
