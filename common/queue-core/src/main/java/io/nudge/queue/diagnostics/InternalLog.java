package io.nudge.queue.diagnostics;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured protocol events written to the {@value #LOGGER_NAME} logger at DEBUG.
 * <p>
 * Logging is strictly observational: failures while building or serializing an event are
 * swallowed into a WARN line and never reach the caller.
 */
public final class InternalLog {

  public static final String LOGGER_NAME = "io.nudge.queue.internal";

  private final Logger log;
  private final ObjectMapper mapper;

  public InternalLog(ObjectMapper mapper) {
    this(LoggerFactory.getLogger(LOGGER_NAME), mapper);
  }

  public InternalLog(Logger log, ObjectMapper mapper) {
    this.log = Objects.requireNonNull(log, "log");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Logs {@code event} with the fields from {@code fields}; the supplier is only invoked when
   * DEBUG is enabled.
   */
  public void event(String event, Supplier<Map<String, Object>> fields) {
    if (!log.isDebugEnabled()) {
      return;
    }
    try {
      Map<String, Object> line = new LinkedHashMap<>();
      line.put("internal_event", event);
      line.put("t", Instant.now().toString());
      line.putAll(fields.get());
      log.debug(mapper.writeValueAsString(line));
    } catch (Exception e) {
      log.warn("Could not write internal event {}: {}", event, e.toString());
    }
  }
}
