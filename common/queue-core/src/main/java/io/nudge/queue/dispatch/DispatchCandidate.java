package io.nudge.queue.dispatch;

/**
 * A locker eligible for a dispatch together with its weight (its worker count).
 */
public record DispatchCandidate(int processId, int weight) {

  public DispatchCandidate {
    if (weight < 1) {
      throw new IllegalArgumentException("weight must be at least 1, got: " + weight + " for " + processId);
    }
  }
}
