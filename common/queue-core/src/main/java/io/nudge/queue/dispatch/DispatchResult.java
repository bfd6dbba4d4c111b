package io.nudge.queue.dispatch;

import java.util.Objects;
import java.util.Optional;

/**
 * Dispatch decision for one job: the outcome and, when notified, the target locker.
 */
public record DispatchResult(DispatchOutcome outcome, Integer processId, String channel) {

  public DispatchResult {
    Objects.requireNonNull(outcome, "outcome");
    if (outcome == DispatchOutcome.NOTIFIED && (processId == null || channel == null)) {
      throw new IllegalArgumentException("a notified dispatch needs a target");
    }
  }

  public static DispatchResult notified(int processId, String channel) {
    return new DispatchResult(DispatchOutcome.NOTIFIED, processId, channel);
  }

  public static DispatchResult of(DispatchOutcome outcome) {
    return new DispatchResult(outcome, null, null);
  }

  public Optional<Integer> target() {
    return Optional.ofNullable(processId);
  }
}
