package dev.pulse.scheduler.job;

import java.util.Comparator;
import java.util.Objects;

/** Identity of a {@link Job}. */
public record JobKey(String routingKey, String body) implements Comparable<JobKey> {

  private static final Comparator<JobKey> ORDER =
      Comparator.comparing(JobKey::routingKey).thenComparing(JobKey::body);

  public JobKey {
    Objects.requireNonNull(routingKey, "routingKey must not be null");
    Objects.requireNonNull(body, "body must not be null");
  }

  @Override
  public int compareTo(JobKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "%s/%s".formatted(routingKey, body);
  }
}
