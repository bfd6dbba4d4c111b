package io.nudge.queue.message;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view of a validated {@code new_job} listener message.
 */
public record NewJobMessage(String queue, long id, Instant runAt, int priority) {

  public static final String TYPE = "new_job";

  public static final String QUEUE = "queue";
  public static final String ID = "id";
  public static final String RUN_AT = "run_at";
  public static final String PRIORITY = "priority";

  public static final MessageFormat FORMAT = MessageFormat.builder()
      .field(QUEUE, ValueType.TEXT)
      .field(ID, ValueType.INTEGER)
      .field(RUN_AT, ValueType.TIMESTAMP)
      .field(PRIORITY, ValueType.INTEGER)
      .build();

  /**
   * Parses the wire {@code run_at} string into an {@link Instant}. A missing or non-string value
   * throws, which discards the message.
   */
  public static final MessageNormalizer NORMALIZER = message -> {
    Object raw = message.get(RUN_AT);
    if (!(raw instanceof String text)) {
      throw new IllegalArgumentException("run_at must be an ISO-8601 string, got: " + raw);
    }
    message.put(RUN_AT, OffsetDateTime.parse(text).toInstant());
  };

  public NewJobMessage {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(runAt, "runAt");
  }

  /**
   * Reads a message that already passed {@link #FORMAT}.
   */
  public static NewJobMessage from(Map<String, Object> message) {
    Objects.requireNonNull(message, "message");
    return new NewJobMessage(
        (String) message.get(QUEUE),
        ((Number) message.get(ID)).longValue(),
        (Instant) message.get(RUN_AT),
        ((Number) message.get(PRIORITY)).intValue());
  }

  /**
   * Wire representation including {@code message_type}, as sent over a listener channel.
   */
  public Map<String, Object> toWire() {
    Map<String, Object> wire = new LinkedHashMap<>();
    wire.put("message_type", TYPE);
    wire.put(QUEUE, queue);
    wire.put(ID, id);
    wire.put(RUN_AT, runAt.toString());
    wire.put(PRIORITY, priority);
    return wire;
  }
}
