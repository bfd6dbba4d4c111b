package io.nudge.queue.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A live worker pool's presence row in {@code que_lockers}.
 *
 * @param processId locker identity; the dispatcher notifies {@code que_locker_<processId>}
 * @param workerCount dispatch weight
 * @param workerPriorities priority ceilings of the pool's workers; {@code null} entries mean "any"
 * @param hostProcessId operating system pid of the worker process
 * @param hostname host the worker process runs on
 * @param listening whether the pool currently accepts notifications
 * @param queues queue names the pool works, {@code ""} being the default queue
 */
public record LockerRegistration(int processId,
                                 int workerCount,
                                 List<Integer> workerPriorities,
                                 int hostProcessId,
                                 String hostname,
                                 boolean listening,
                                 List<String> queues) {

  public LockerRegistration {
    Objects.requireNonNull(hostname, "hostname");
    workerPriorities = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(workerPriorities, "workerPriorities")));
    Objects.requireNonNull(queues, "queues");
    if (queues.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("queues must not contain null: " + queues);
    }
    queues = List.copyOf(queues);
  }
}
