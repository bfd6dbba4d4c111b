package io.nudge.queue.diagnostics;

/**
 * Receives problems that must not be raised in the caller's context, such as a notification
 * payload that failed to decode.
 */
@FunctionalInterface
public interface ErrorNotifier {

  /**
   * Reports the error without blocking and without throwing.
   */
  void notifyAsync(Throwable error);
}
