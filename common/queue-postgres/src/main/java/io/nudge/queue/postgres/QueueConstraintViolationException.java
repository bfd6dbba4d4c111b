package io.nudge.queue.postgres;

/**
 * A write was rejected by one of the record store's named check constraints, e.g.
 * {@code data_format}, {@code queue_length}, {@code run_at_valid} or {@code valid_queues}.
 */
public class QueueConstraintViolationException extends QueueStorageException {

  private final String constraint;

  public QueueConstraintViolationException(String constraint, String message, Throwable cause) {
    super(message, cause);
    this.constraint = constraint;
  }

  /**
   * Name of the violated constraint, or {@code null} if the server did not report one.
   */
  public String constraint() {
    return constraint;
  }
}
