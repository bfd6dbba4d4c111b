package io.nudge.queue.postgres;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A job to enqueue. {@code runAt == null} means "now" by the database clock.
 */
public record NewJob(String jobClass, String queue, int priority, Instant runAt, Map<String, Object> data) {

  public static final String DEFAULT_QUEUE = "";
  public static final int DEFAULT_PRIORITY = 100;

  public NewJob {
    if (jobClass == null || jobClass.isBlank()) {
      throw new IllegalArgumentException("jobClass must not be blank");
    }
    queue = queue == null ? DEFAULT_QUEUE : queue;
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static Builder builder(String jobClass) {
    return new Builder(jobClass);
  }

  public static final class Builder {

    private final String jobClass;
    private String queue = DEFAULT_QUEUE;
    private int priority = DEFAULT_PRIORITY;
    private Instant runAt;
    private Map<String, Object> data = Map.of();

    private Builder(String jobClass) {
      this.jobClass = jobClass;
    }

    public Builder queue(String queue) {
      this.queue = Objects.requireNonNull(queue, "queue");
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder runAt(Instant runAt) {
      this.runAt = runAt;
      return this;
    }

    public Builder data(Map<String, Object> data) {
      this.data = Objects.requireNonNull(data, "data");
      return this;
    }

    public NewJob build() {
      return new NewJob(jobClass, queue, priority, runAt, data);
    }
  }
}
