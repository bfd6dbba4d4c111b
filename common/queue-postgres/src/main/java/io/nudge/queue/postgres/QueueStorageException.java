package io.nudge.queue.postgres;

/**
 * Record store failure other than a check-constraint violation.
 */
public class QueueStorageException extends RuntimeException {

  public QueueStorageException(String message) {
    super(message);
  }

  public QueueStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
