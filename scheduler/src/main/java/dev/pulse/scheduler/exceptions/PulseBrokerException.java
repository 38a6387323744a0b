package dev.pulse.scheduler.exceptions;

/** Thrown when a message cannot be handed to the message broker. */
public class PulseBrokerException extends RuntimeException {
  private final String routingKey;

  public PulseBrokerException(String routingKey, Throwable e) {
    super(String.format("Failed to publish to %s: %s", routingKey, e.getMessage()), e);
    this.routingKey = routingKey;
  }

  public String routingKey() {
    return routingKey;
  }
}
