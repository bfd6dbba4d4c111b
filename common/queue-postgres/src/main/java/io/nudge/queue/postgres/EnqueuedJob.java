package io.nudge.queue.postgres;

import io.nudge.queue.dispatch.DispatchResult;
import java.time.Instant;

/**
 * The stored job as returned by the insert, plus the dispatch decision made for it.
 */
public record EnqueuedJob(long id, String queue, int priority, Instant runAt, String jobClass, DispatchResult dispatch) {
}
