package dev.pulse.scheduler.broker;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One message handed to a {@link MessageBroker}.
 *
 * @param routingKey address of the message within the configured exchange
 * @param body payload, sent as UTF-8 text
 * @param headers application headers
 * @param persistent request durable delivery
 * @param expiration time after which the broker may drop the undelivered message, or null
 * @param publishedAt time the message was produced
 */
public record OutboundMessage(
    String routingKey,
    String body,
    Map<String, Object> headers,
    boolean persistent,
    Duration expiration,
    Instant publishedAt) {

  public OutboundMessage {
    Objects.requireNonNull(routingKey, "routingKey must not be null");
    Objects.requireNonNull(body, "body must not be null");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    Objects.requireNonNull(publishedAt, "publishedAt must not be null");
  }
}
