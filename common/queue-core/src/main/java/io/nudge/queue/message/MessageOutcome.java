package io.nudge.queue.message;

import java.util.Map;
import java.util.Objects;

/**
 * Result of running one message through a pipeline step.
 */
public sealed interface MessageOutcome permits MessageOutcome.Accepted, MessageOutcome.Discarded {

  static MessageOutcome accepted(Map<String, Object> message) {
    return new Accepted(message);
  }

  static MessageOutcome discarded(MessageRejectedException reason) {
    return new Discarded(reason);
  }

  record Accepted(Map<String, Object> message) implements MessageOutcome {
    public Accepted {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * @param reason diagnostic handed to the error notifier
   */
  record Discarded(MessageRejectedException reason) implements MessageOutcome {
    public Discarded {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
