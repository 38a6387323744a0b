package dev.pulse.scheduler.broker;

/** Destination of job payloads. Implementations must allow concurrent calls to publish. */
public interface MessageBroker {

  /**
   * Hand one message to the broker.
   *
   * @throws dev.pulse.scheduler.exceptions.PulseBrokerException if the broker rejects the message
   *     or cannot be reached
   */
  void publish(OutboundMessage message);
}
