package dev.pulse.scheduler.utils;

import dev.pulse.scheduler.broker.MessageBroker;
import dev.pulse.scheduler.broker.OutboundMessage;
import dev.pulse.scheduler.exceptions.PulseBrokerException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/** {@link MessageBroker} that keeps every published message in memory. */
public class RecordingBroker implements MessageBroker {

  private final List<OutboundMessage> messages = new CopyOnWriteArrayList<>();
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private final AtomicReference<CountDownLatch> gate = new AtomicReference<>();

  @Override
  public void publish(OutboundMessage message) {
    var latch = gate.get();
    if (latch != null) {
      try {
        latch.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PulseBrokerException(message.routingKey(), e);
      }
    }
    if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new PulseBrokerException(message.routingKey(), new IOException("simulated outage"));
    }
    messages.add(message);
  }

  /** Make the next {@code count} publishes fail. */
  public void failNext(int count) {
    failuresLeft.set(count);
  }

  /** Block publishes until {@link #resume()} is called. */
  public void pause() {
    gate.set(new CountDownLatch(1));
  }

  public void resume() {
    var latch = gate.getAndSet(null);
    if (latch != null) {
      latch.countDown();
    }
  }

  public List<OutboundMessage> messages() {
    return List.copyOf(messages);
  }

  public List<String> routingKeys() {
    return messages.stream().map(OutboundMessage::routingKey).collect(Collectors.toList());
  }

  public long count(String routingKey) {
    return messages.stream().filter(m -> m.routingKey().equals(routingKey)).count();
  }
}
