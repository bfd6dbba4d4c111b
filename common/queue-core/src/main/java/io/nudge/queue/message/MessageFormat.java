package io.nudge.queue.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact shape of a message type: the full key set and the type of each value.
 */
public final class MessageFormat {

  private final Map<String, ValueType> fields;

  private MessageFormat(Map<String, ValueType> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns why the message does not match, or empty when it matches. Extra and missing keys are
   * both mismatches.
   */
  public Optional<String> mismatch(Map<String, Object> message) {
    Objects.requireNonNull(message, "message");
    if (message.size() != fields.size()) {
      return Optional.of("expected " + fields.size() + " keys but found " + message.size());
    }
    for (Map.Entry<String, ValueType> field : fields.entrySet()) {
      if (!message.containsKey(field.getKey())) {
        return Optional.of("missing key '" + field.getKey() + "'");
      }
      Object value = message.get(field.getKey());
      if (!field.getValue().accepts(value)) {
        return Optional.of("key '" + field.getKey() + "' is not " + field.getValue());
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return fields.toString();
  }

  public static final class Builder {

    private final Map<String, ValueType> fields = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder field(String name, ValueType type) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      if (fields.putIfAbsent(name, type) != null) {
        throw new IllegalArgumentException("duplicate field: " + name);
      }
      return this;
    }

    public MessageFormat build() {
      if (fields.isEmpty()) {
        throw new IllegalStateException("a message format needs at least one field");
      }
      return new MessageFormat(fields);
    }
  }
}
