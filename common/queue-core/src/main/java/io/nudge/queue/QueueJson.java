package io.nudge.queue;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Objects;

/**
 * Canonical JSON mapper for notification payloads and job data.
 */
public final class QueueJson {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .findAndAddModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .build()
      .setSerializationInclusion(JsonInclude.Include.ALWAYS);

  private QueueJson() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String write(Object value, String label) {
    return writeWith(MAPPER, value, label);
  }

  public static String writeWith(ObjectMapper mapper, Object value, String label) {
    Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(label, "label");
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + label, e);
    }
  }
}
