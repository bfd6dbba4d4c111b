package io.nudge.queue.dispatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks one locker among eligible candidates with probability proportional to its weight.
 * <p>
 * Candidates are laid out by ascending process id, each covering {@code weight} consecutive
 * positions of the range {@code [0, totalWeight)}; the candidate covering
 * {@code floorMod(ticket, totalWeight)} wins. Work is linear in the number of candidates and
 * independent of the weights themselves.
 */
public final class WeightedSelector {

  private static final Comparator<DispatchCandidate> BY_PROCESS_ID =
      Comparator.comparingInt(DispatchCandidate::processId);

  private WeightedSelector() {
  }

  public static Optional<Integer> select(List<DispatchCandidate> candidates, long ticket) {
    Objects.requireNonNull(candidates, "candidates");
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    List<DispatchCandidate> ordered = new ArrayList<>(candidates);
    ordered.forEach(candidate -> Objects.requireNonNull(candidate, "candidate"));
    ordered.sort(BY_PROCESS_ID);

    long total = 0;
    for (int i = 0; i < ordered.size(); i++) {
      if (i > 0 && ordered.get(i - 1).processId() == ordered.get(i).processId()) {
        throw new IllegalArgumentException("duplicate candidate: " + ordered.get(i).processId());
      }
      total += ordered.get(i).weight();
    }

    long position = Math.floorMod(ticket, total);
    for (DispatchCandidate candidate : ordered) {
      if (position < candidate.weight()) {
        return Optional.of(candidate.processId());
      }
      position -= candidate.weight();
    }
    throw new IllegalStateException("position " + position + " outside total weight " + total);
  }

  public static Optional<Integer> select(List<DispatchCandidate> candidates,
                                         DispatchTicketSource tickets,
                                         long jobId) {
    Objects.requireNonNull(tickets, "tickets");
    return select(candidates, tickets.ticketFor(jobId));
  }
}
