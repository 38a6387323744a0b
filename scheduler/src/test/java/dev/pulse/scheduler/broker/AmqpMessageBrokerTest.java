package dev.pulse.scheduler.broker;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pulse.scheduler.exceptions.PulseBrokerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class AmqpMessageBrokerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private Connection connection;
  private Channel channel;
  private AmqpMessageBroker broker;

  @BeforeEach
  void setup() throws IOException {
    connection = mock(Connection.class);
    channel = mock(Channel.class);
    when(connection.createChannel()).thenReturn(channel);
    when(connection.isOpen()).thenReturn(true);
    when(channel.isOpen()).thenReturn(true);
    broker = new AmqpMessageBroker(connection, "jobs");
  }

  private static OutboundMessage message(String routingKey) {
    return new OutboundMessage(
        routingKey,
        "{\"id\":1}",
        Map.of("interval", 5L, "published_at", NOW.toString()),
        true,
        Duration.ofSeconds(5),
        NOW);
  }

  @Test
  void publishesToExchangeWithProperties() throws Exception {
    broker.publish(message("orders.created"));

    var props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    var body = ArgumentCaptor.forClass(byte[].class);
    verify(channel)
        .basicPublish(
            eq("jobs"), eq("orders.created"), eq(false), eq(false), props.capture(), body.capture());

    assertArrayEquals("{\"id\":1}".getBytes(StandardCharsets.UTF_8), body.getValue());
    var p = props.getValue();
    assertEquals(2, p.getDeliveryMode());
    assertEquals("5000", p.getExpiration());
    assertEquals("text/plain", p.getContentType());
    assertEquals("UTF-8", p.getContentEncoding());
    assertEquals(0, p.getPriority());
    assertEquals(Date.from(NOW), p.getTimestamp());
    assertEquals(5L, p.getHeaders().get("interval"));
    assertEquals(NOW.toString(), p.getHeaders().get("published_at"));
  }

  @Test
  void transientMessageWithoutExpiration() {
    var props =
        AmqpMessageBroker.properties(
            new OutboundMessage("rk", "", Map.of(), false, null, NOW));
    assertEquals(1, props.getDeliveryMode());
    assertNull(props.getExpiration());
  }

  @Test
  void channelsAreReused() throws Exception {
    broker.publish(message("a"));
    broker.publish(message("b"));

    verify(connection, times(1)).createChannel();
    verify(channel, times(2))
        .basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());
  }

  @Test
  void closedChannelIsReplaced() throws Exception {
    broker.publish(message("a"));
    when(channel.isOpen()).thenReturn(false);
    broker.publish(message("b"));

    verify(connection, times(2)).createChannel();
  }

  @Test
  void publishFailureIsWrapped() throws Exception {
    doThrow(new IOException("connection reset"))
        .when(channel)
        .basicPublish(anyString(), anyString(), anyBoolean(), anyBoolean(), any(), any());

    var e = assertThrows(PulseBrokerException.class, () -> broker.publish(message("a")));
    assertEquals("a", e.routingKey());
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void closeReleasesChannelsAndConnection() throws Exception {
    broker.publish(message("a"));
    broker.close();

    verify(channel).close();
    verify(connection).close();
  }

  @Test
  void invalidUriRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> AmqpMessageBroker.connect("http://nope", "jobs"));
  }
}
