package io.nudge.queue.listen;

/**
 * Failure on a listener's dedicated connection.
 */
public class ListenerException extends RuntimeException {

  public ListenerException(String message) {
    super(message);
  }

  public ListenerException(String message, Throwable cause) {
    super(message, cause);
  }
}
