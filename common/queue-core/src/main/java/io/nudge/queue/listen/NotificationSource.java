package io.nudge.queue.listen;

import java.time.Duration;
import java.util.List;

/**
 * A dedicated connection that can subscribe to channels and receive notifications.
 * <p>
 * Implementations are used by one listener at a time and are not thread-safe. All failures are
 * reported as {@link ListenerException}.
 */
public interface NotificationSource extends AutoCloseable {

  /**
   * Identity of the underlying live connection (the database backend pid), unique among
   * concurrently open connections.
   */
  int connectionIdentity();

  void listen(String channel);

  /**
   * Blocks up to {@code timeout} until at least one notification is available and returns every
   * notification available at that point. {@link Duration#ZERO} returns only what is already
   * available without waiting. Returns an empty list on timeout.
   */
  List<Notification> await(Duration timeout);

  /**
   * Stops listening on every channel and discards notifications that arrived but were not
   * consumed.
   */
  void unlistenAll();

  /**
   * Releases the underlying connection. Callers unlisten first.
   */
  @Override
  void close();
}
