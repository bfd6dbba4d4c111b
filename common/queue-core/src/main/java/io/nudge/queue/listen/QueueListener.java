package io.nudge.queue.listen;

import io.nudge.queue.channel.ChannelNaming;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-worker-pool consumer of the pool's notification channel.
 * <p>
 * Owns one dedicated {@link NotificationSource} for its whole life. Use it with
 * try-with-resources: {@link #close()} unlistens and drains before the connection is released, on
 * every exit path, so stale notifications never leak into the next user of that connection.
 * Not thread-safe; one thread drives a listener.
 */
public final class QueueListener implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(QueueListener.class);

  private final NotificationSource source;
  private final ChannelNaming naming;
  private final NotificationDecoder decoder;

  private String channel;
  private boolean closed;

  public QueueListener(NotificationSource source, ChannelNaming naming, NotificationDecoder decoder) {
    this.source = Objects.requireNonNull(source, "source");
    this.naming = Objects.requireNonNull(naming, "naming");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  /**
   * Starts listening on the channel derived from the dedicated connection's identity. Repeated
   * calls on the same connection are no-ops.
   */
  public void subscribe() {
    ensureOpen();
    if (channel != null) {
      return;
    }
    String target = naming.channelFor(source.connectionIdentity());
    source.listen(target);
    channel = target;
    log.debug("Listening on {}", target);
  }

  /**
   * Waits up to {@code timeout} for notifications and returns the validated messages keyed by
   * message type, or an empty map when nothing arrived in time.
   * <p>
   * Only the first wait uses {@code timeout}; once a batch has arrived, further notifications are
   * drained without waiting, so the call never takes much longer than {@code timeout}.
   *
   * @throws NullPointerException if {@code timeout} is null
   * @throws IllegalArgumentException if {@code timeout} is negative
   */
  public Map<String, List<Map<String, Object>>> waitForMessages(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative, got: " + timeout);
    }
    ensureOpen();

    List<String> payloads = new ArrayList<>();
    Duration remaining = timeout;
    while (true) {
      List<Notification> batch = source.await(remaining);
      if (batch.isEmpty()) {
        break;
      }
      remaining = Duration.ZERO;
      for (Notification notification : batch) {
        payloads.add(notification.payload());
      }
    }
    return decoder.decode(payloads);
  }

  public Map<String, List<Map<String, Object>>> waitForMessages(long timeout, TimeUnit unit) {
    Objects.requireNonNull(unit, "unit");
    if (timeout < 0) {
      throw new IllegalArgumentException("timeout must not be negative, got: " + timeout);
    }
    return waitForMessages(Duration.ofNanos(unit.toNanos(timeout)));
  }

  /**
   * Stops listening and discards notifications that arrived but were not consumed. Safe to call
   * when not subscribed.
   */
  public void unsubscribe() {
    ensureOpen();
    source.unlistenAll();
    if (channel != null) {
      log.debug("Stopped listening on {}", channel);
    }
    channel = null;
  }

  /**
   * Channel currently listened on, or {@code null}.
   */
  public String channel() {
    return channel;
  }

  public boolean subscribed() {
    return channel != null;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      source.unlistenAll();
      channel = null;
    } finally {
      source.close();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("listener is closed");
    }
  }
}
