package io.nudge.queue.listen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.nudge.queue.diagnostics.ErrorNotifier;
import io.nudge.queue.diagnostics.InternalLog;
import io.nudge.queue.message.MessageFormat;
import io.nudge.queue.message.MessageNormalizer;
import io.nudge.queue.message.MessageOutcome;
import io.nudge.queue.message.MessageRegistry;
import io.nudge.queue.message.MessageRejectedException;
import io.nudge.queue.metrics.QueueMetrics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw notification payloads into validated messages grouped by {@code message_type}.
 * <p>
 * Payloads cross a trust boundary: any session with database access can notify a channel. Every
 * problem degrades to dropping the offending payload or message; nothing is thrown to the caller.
 * Undecodable payloads and rejected messages are reported through the {@link ErrorNotifier};
 * elements without a string {@code message_type} are dropped silently.
 */
public final class NotificationDecoder {

  public static final String MESSAGE_TYPE = "message_type";
  public static final String MESSAGES_RECEIVED = "messages_received";

  private static final TypeReference<LinkedHashMap<String, Object>> MESSAGE = new TypeReference<>() {
  };

  private final ObjectMapper mapper;
  private final ObjectReader reader;
  private final MessageRegistry registry;
  private final ErrorNotifier errorNotifier;
  private final InternalLog internalLog;
  private final QueueMetrics metrics;

  public NotificationDecoder(ObjectMapper mapper,
                             MessageRegistry registry,
                             ErrorNotifier errorNotifier,
                             QueueMetrics metrics) {
    this(mapper, registry, errorNotifier, new InternalLog(mapper), metrics);
  }

  NotificationDecoder(ObjectMapper mapper,
                      MessageRegistry registry,
                      ErrorNotifier errorNotifier,
                      InternalLog internalLog,
                      QueueMetrics metrics) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    this.registry = Objects.requireNonNull(registry, "registry");
    this.errorNotifier = Objects.requireNonNull(errorNotifier, "errorNotifier");
    this.internalLog = Objects.requireNonNull(internalLog, "internalLog");
    this.metrics = metrics != null ? metrics : QueueMetrics.noop();
  }

  /**
   * Decodes a batch of payloads. The returned map, its lists and its messages are immutable, and
   * only message types with at least one surviving message are present.
   */
  public Map<String, List<Map<String, Object>>> decode(List<String> payloads) {
    Objects.requireNonNull(payloads, "payloads");
    Map<String, List<Map<String, Object>>> grouped = new LinkedHashMap<>();
    for (String payload : payloads) {
      Optional<JsonNode> root = parse(payload);
      if (root.isEmpty()) {
        continue;
      }
      Iterable<JsonNode> elements = root.get().isArray() ? root.get() : List.of(root.get());
      for (JsonNode element : elements) {
        if (element == null || !element.isObject()) {
          continue;
        }
        JsonNode type = element.get(MESSAGE_TYPE);
        if (type == null || !type.isTextual()) {
          continue;
        }
        LinkedHashMap<String, Object> message = mapper.convertValue(element, MESSAGE);
        message.remove(MESSAGE_TYPE);
        grouped.computeIfAbsent(type.textValue(), key -> new ArrayList<>()).add(message);
      }
    }

    Map<String, List<Map<String, Object>>> output = new LinkedHashMap<>();
    grouped.forEach((type, messages) -> {
      List<Map<String, Object>> accepted = new ArrayList<>(messages.size());
      for (Map<String, Object> message : messages) {
        MessageOutcome outcome = process(type, message);
        if (outcome instanceof MessageOutcome.Accepted ok) {
          accepted.add(Frozen.map(ok.message()));
          metrics.messageAccepted(metricType(type));
        } else if (outcome instanceof MessageOutcome.Discarded dropped) {
          errorNotifier.notifyAsync(dropped.reason());
          metrics.messageDiscarded(metricType(type));
        }
      }
      if (!accepted.isEmpty()) {
        output.put(type, Collections.unmodifiableList(accepted));
      }
    });

    Map<String, List<Map<String, Object>>> result = Collections.unmodifiableMap(output);
    if (!result.isEmpty()) {
      internalLog.event(MESSAGES_RECEIVED, () -> Map.of("messages", result));
    }
    return result;
  }

  private Optional<JsonNode> parse(String payload) {
    if (payload == null || payload.isBlank()) {
      errorNotifier.notifyAsync(new MessageRejectedException(null, "Empty notification payload"));
      return Optional.empty();
    }
    try {
      return Optional.of(reader.readTree(payload));
    } catch (JsonProcessingException e) {
      errorNotifier.notifyAsync(
          new MessageRejectedException(null, "Notification payload is not valid JSON: " + abbreviate(payload), e));
      return Optional.empty();
    }
  }

  private MessageOutcome process(String type, Map<String, Object> message) {
    Optional<MessageNormalizer> normalizer = registry.normalizerFor(type);
    if (normalizer.isPresent()) {
      try {
        normalizer.get().normalize(message);
      } catch (RuntimeException e) {
        return MessageOutcome.discarded(new MessageRejectedException(type,
            "Message of type '" + type + "' could not be normalized: " + e.getMessage(), e));
      }
    }
    Optional<MessageFormat> format = registry.formatFor(type);
    if (format.isPresent()) {
      Optional<String> mismatch = format.get().mismatch(message);
      if (mismatch.isPresent()) {
        return MessageOutcome.discarded(new MessageRejectedException(type, String.join("\n",
            "Message of type '" + type + "' doesn't match format! (" + mismatch.get() + ")",
            "Message: " + message,
            "Format: " + format.get())));
      }
    }
    return MessageOutcome.accepted(message);
  }

  // Arbitrary type strings come off the wire; keep the tag set bounded.
  private String metricType(String type) {
    return registry.types().contains(type) ? type : "other";
  }

  private static String abbreviate(String payload) {
    return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
  }
}
