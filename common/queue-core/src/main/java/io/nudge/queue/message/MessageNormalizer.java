package io.nudge.queue.message;

import java.util.Map;

/**
 * Rewrites a decoded message in place before its format is checked, e.g. turning a timestamp
 * string into an {@link java.time.Instant}. Throwing discards the message.
 */
@FunctionalInterface
public interface MessageNormalizer {

  void normalize(Map<String, Object> message);
}
