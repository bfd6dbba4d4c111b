package io.nudge.queue.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.nudge.queue.dispatch.DispatchOutcome;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link QueueMetrics} backed by Micrometer counters.
 */
public final class MicrometerQueueMetrics implements QueueMetrics {

  static final String DISPATCH = "nudge.queue.dispatch";
  static final String LISTENER_MESSAGES = "nudge.queue.listener.messages";

  private final MeterRegistry meterRegistry;

  public MicrometerQueueMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  @Override
  public void dispatch(DispatchOutcome outcome) {
    Counter.builder(DISPATCH)
        .description("Job insertions by dispatch outcome")
        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void messageAccepted(String type) {
    message(type, "accepted");
  }

  @Override
  public void messageDiscarded(String type) {
    message(type, "discarded");
  }

  private void message(String type, String outcome) {
    Counter.builder(LISTENER_MESSAGES)
        .description("Listener messages by type and outcome")
        .tag("type", type == null ? "unknown" : type)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}
