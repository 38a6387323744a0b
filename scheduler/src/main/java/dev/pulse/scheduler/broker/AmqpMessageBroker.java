package dev.pulse.scheduler.broker;

import dev.pulse.scheduler.exceptions.PulseBrokerException;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Date;
import java.util.HashMap;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MessageBroker} publishing to one exchange of a RabbitMQ broker.
 *
 * <p>Channels are not safe for concurrent publishing, so each publish borrows an idle channel and
 * returns it afterwards. At most one channel per concurrent publisher is ever opened.
 */
public class AmqpMessageBroker implements MessageBroker, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(AmqpMessageBroker.class);

  static final int DELIVERY_MODE_TRANSIENT = 1;
  static final int DELIVERY_MODE_PERSISTENT = 2;

  private final Connection connection;
  private final String exchange;
  private final Queue<Channel> idleChannels = new ConcurrentLinkedQueue<>();

  AmqpMessageBroker(Connection connection, String exchange) {
    this.connection = Objects.requireNonNull(connection, "connection must not be null");
    this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
  }

  /**
   * Open a connection to the broker at {@code uri}.
   *
   * @throws IllegalArgumentException if {@code uri} is not a valid AMQP URI
   */
  public static AmqpMessageBroker connect(String uri, String exchange)
      throws IOException, TimeoutException {
    var factory = new ConnectionFactory();
    try {
      factory.setUri(Objects.requireNonNull(uri, "broker uri must not be null"));
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new IllegalArgumentException("Invalid AMQP URI: " + e.getMessage(), e);
    }
    factory.setAutomaticRecoveryEnabled(true);
    var connection = factory.newConnection("pulse-scheduler");
    logger.info(
        "Connected to AMQP broker {}:{}{}",
        factory.getHost(),
        factory.getPort(),
        factory.getVirtualHost());
    return new AmqpMessageBroker(connection, exchange);
  }

  @Override
  public void publish(OutboundMessage message) {
    Channel channel = null;
    try {
      channel = borrowChannel();
      channel.basicPublish(
          exchange,
          message.routingKey(),
          false,
          false,
          properties(message),
          message.body().getBytes(StandardCharsets.UTF_8));
      logger.debug("Published {} bytes to {}", message.body().length(), message.routingKey());
    } catch (IOException | RuntimeException e) {
      throw new PulseBrokerException(message.routingKey(), e);
    } finally {
      if (channel != null) {
        returnChannel(channel);
      }
    }
  }

  static AMQP.BasicProperties properties(OutboundMessage message) {
    var builder =
        new AMQP.BasicProperties.Builder()
            .headers(new HashMap<>(message.headers()))
            .contentType("text/plain")
            .contentEncoding("UTF-8")
            .deliveryMode(message.persistent() ? DELIVERY_MODE_PERSISTENT : DELIVERY_MODE_TRANSIENT)
            .priority(0)
            .timestamp(Date.from(message.publishedAt()));
    if (message.expiration() != null) {
      builder.expiration(Long.toString(message.expiration().toMillis()));
    }
    return builder.build();
  }

  private Channel borrowChannel() throws IOException {
    Channel channel;
    while ((channel = idleChannels.poll()) != null) {
      if (channel.isOpen()) {
        return channel;
      }
    }
    channel = connection.createChannel();
    if (channel == null) {
      throw new IOException("No channel available on broker connection");
    }
    return channel;
  }

  private void returnChannel(Channel channel) {
    if (channel.isOpen()) {
      idleChannels.offer(channel);
    }
  }

  @Override
  public void close() {
    Channel channel;
    while ((channel = idleChannels.poll()) != null) {
      try {
        if (channel.isOpen()) {
          channel.close();
        }
      } catch (IOException | TimeoutException e) {
        logger.warn("Failed to close broker channel", e);
      }
    }
    try {
      if (connection.isOpen()) {
        connection.close();
      }
    } catch (IOException e) {
      logger.warn("Failed to close broker connection", e);
    }
  }
}
