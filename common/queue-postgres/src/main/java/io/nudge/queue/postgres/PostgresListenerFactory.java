package io.nudge.queue.postgres;

import io.nudge.queue.channel.ChannelNaming;
import io.nudge.queue.listen.NotificationDecoder;
import io.nudge.queue.listen.QueueListener;
import java.util.Objects;
import javax.sql.DataSource;

/**
 * Opens listeners, each on its own connection checked out from the pool.
 */
public final class PostgresListenerFactory {

  private final DataSource dataSource;
  private final ChannelNaming listenerChannels;
  private final NotificationDecoder decoder;

  public PostgresListenerFactory(DataSource dataSource, ChannelNaming listenerChannels, NotificationDecoder decoder) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.listenerChannels = Objects.requireNonNull(listenerChannels, "listenerChannels");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  /**
   * Opens an unsubscribed listener. Close it to release the connection.
   */
  public QueueListener open() {
    return new QueueListener(PostgresNotificationSource.checkout(dataSource), listenerChannels, decoder);
  }

  /**
   * Opens a listener that is already subscribed to its channel.
   */
  public QueueListener openSubscribed() {
    QueueListener listener = open();
    try {
      listener.subscribe();
      return listener;
    } catch (RuntimeException e) {
      try {
        listener.close();
      } catch (RuntimeException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }
}
