package io.nudge.queue.dispatch;

import java.util.Objects;
import java.util.Random;

/**
 * Supplies the ticket that {@link WeightedSelector} reduces to a slot.
 */
@FunctionalInterface
public interface DispatchTicketSource {

  long ticketFor(long jobId);

  /**
   * Uses the job id itself. Consecutive jobs visit every slot once per cycle, so the split between
   * lockers matches their weights exactly over each full cycle.
   */
  static DispatchTicketSource jobId() {
    return jobId -> jobId;
  }

  /**
   * Draws tickets from the given generator; selection is then proportional to weight in
   * expectation. Pass a seeded {@link Random} for reproducible sampling.
   */
  static DispatchTicketSource random(Random random) {
    Objects.requireNonNull(random, "random");
    return jobId -> random.nextLong();
  }
}
