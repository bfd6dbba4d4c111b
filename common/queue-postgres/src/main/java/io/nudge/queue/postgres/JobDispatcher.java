package io.nudge.queue.postgres;

import io.nudge.queue.QueueJson;
import io.nudge.queue.channel.ChannelNaming;
import io.nudge.queue.dispatch.DispatchCandidate;
import io.nudge.queue.dispatch.DispatchOutcome;
import io.nudge.queue.dispatch.DispatchResult;
import io.nudge.queue.dispatch.DispatchTicketSource;
import io.nudge.queue.dispatch.WeightedSelector;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the single wake-up notification for a freshly inserted job.
 * <p>
 * Runs on the inserting connection, inside the inserting transaction: {@code pg_notify} is only
 * delivered when that transaction commits, so a listener can never be woken for a job it cannot
 * see yet, and a rolled-back insert never wakes anyone.
 */
public final class JobDispatcher {

  private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

  private static final String NOTIFY_SQL = "SELECT pg_notify(?, ?)";

  private final ChannelNaming lockerChannels;
  private final DispatchTicketSource tickets;

  public JobDispatcher() {
    this(ChannelNaming.LOCKER, DispatchTicketSource.jobId());
  }

  public JobDispatcher(ChannelNaming lockerChannels, DispatchTicketSource tickets) {
    this.lockerChannels = Objects.requireNonNull(lockerChannels, "lockerChannels");
    this.tickets = Objects.requireNonNull(tickets, "tickets");
  }

  /**
   * Picks one listening locker for {@code queue}, weighted by worker count, and notifies it.
   * Sends nothing when no locker is eligible.
   */
  public DispatchResult dispatch(Connection connection, long jobId, String queue, int priority, Instant runAt)
      throws SQLException {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(runAt, "runAt");
    List<DispatchCandidate> candidates = LockerRepository.candidatesFor(connection, queue);
    Optional<Integer> target = WeightedSelector.select(candidates, tickets, jobId);
    if (target.isEmpty()) {
      log.debug("No listening locker for queue '{}'; job {} left for polling", queue, jobId);
      return DispatchResult.of(DispatchOutcome.NO_ELIGIBLE_LOCKER);
    }

    String channel = lockerChannels.channelFor(target.get());
    String payload = QueueJson.write(payload(jobId, queue, priority, runAt), "dispatch payload");
    try (PreparedStatement ps = connection.prepareStatement(NOTIFY_SQL)) {
      ps.setString(1, channel);
      ps.setString(2, payload);
      ps.execute();
    }
    log.debug("Job {} dispatched to {} ({} eligible locker(s))", jobId, channel, candidates.size());
    return DispatchResult.notified(target.get(), channel);
  }

  static Map<String, Object> payload(long jobId, String queue, int priority, Instant runAt) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("job_id", jobId);
    payload.put("queue", queue);
    payload.put("priority", priority);
    payload.put("run_at", DateTimeFormatter.ISO_INSTANT.format(runAt));
    return payload;
  }
}
