package io.nudge.queue.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-message-type table of normalizers and formats used by the listener.
 * Built once at startup; types without an entry pass through unchecked.
 */
public final class MessageRegistry {

  private static final MessageRegistry DEFAULTS = builder()
      .normalizer(NewJobMessage.TYPE, NewJobMessage.NORMALIZER)
      .format(NewJobMessage.TYPE, NewJobMessage.FORMAT)
      .build();

  private final Map<String, MessageNormalizer> normalizers;
  private final Map<String, MessageFormat> formats;

  private MessageRegistry(Map<String, MessageNormalizer> normalizers, Map<String, MessageFormat> formats) {
    this.normalizers = Collections.unmodifiableMap(new LinkedHashMap<>(normalizers));
    this.formats = Collections.unmodifiableMap(new LinkedHashMap<>(formats));
  }

  /**
   * Registry with the {@code new_job} message type.
   */
  public static MessageRegistry defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<MessageNormalizer> normalizerFor(String type) {
    return Optional.ofNullable(normalizers.get(type));
  }

  public Optional<MessageFormat> formatFor(String type) {
    return Optional.ofNullable(formats.get(type));
  }

  public Set<String> types() {
    Set<String> types = new LinkedHashSet<>(normalizers.keySet());
    types.addAll(formats.keySet());
    return Collections.unmodifiableSet(types);
  }

  public static final class Builder {

    private final Map<String, MessageNormalizer> normalizers = new LinkedHashMap<>();
    private final Map<String, MessageFormat> formats = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder normalizer(String type, MessageNormalizer normalizer) {
      normalizers.put(requireType(type), Objects.requireNonNull(normalizer, "normalizer"));
      return this;
    }

    public Builder format(String type, MessageFormat format) {
      formats.put(requireType(type), Objects.requireNonNull(format, "format"));
      return this;
    }

    public MessageRegistry build() {
      return new MessageRegistry(normalizers, formats);
    }

    private static String requireType(String type) {
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("message type must not be blank");
      }
      return type;
    }
  }
}
