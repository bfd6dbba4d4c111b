package io.nudge.queue.listen;

import java.util.Objects;

/**
 * A raw notification as received on a channel.
 *
 * @param channel channel the notification was sent on
 * @param senderPid backend pid of the notifying session
 * @param payload raw payload text, untrusted
 */
public record Notification(String channel, int senderPid, String payload) {

  public Notification {
    Objects.requireNonNull(channel, "channel");
    payload = payload == null ? "" : payload;
  }
}
