package io.nudge.queue.metrics;

import io.nudge.queue.dispatch.DispatchOutcome;

/**
 * Counters for dispatch decisions and listener message outcomes.
 */
public interface QueueMetrics {

  void dispatch(DispatchOutcome outcome);

  void messageAccepted(String type);

  void messageDiscarded(String type);

  static QueueMetrics noop() {
    return NoopQueueMetrics.INSTANCE;
  }

  final class NoopQueueMetrics implements QueueMetrics {

    private static final NoopQueueMetrics INSTANCE = new NoopQueueMetrics();

    private NoopQueueMetrics() {
    }

    @Override
    public void dispatch(DispatchOutcome outcome) {
    }

    @Override
    public void messageAccepted(String type) {
    }

    @Override
    public void messageDiscarded(String type) {
    }
  }
}
