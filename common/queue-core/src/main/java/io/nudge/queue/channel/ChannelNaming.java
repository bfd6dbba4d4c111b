package io.nudge.queue.channel;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Maps a live identity to its notification channel name, {@code <namespace>_<identity>}.
 * <p>
 * The dispatcher addresses lockers with {@link #LOCKER} and the listener subscribes with
 * {@link #LISTENER}. The identity must be unique among concurrently live connections, which is why
 * the listener side derives it from the database backend pid rather than an application id.
 */
public record ChannelNaming(String namespace) {

  public static final String DEFAULT_LISTENER_NAMESPACE = "que_listener";
  public static final String DEFAULT_LOCKER_NAMESPACE = "que_locker";

  public static final ChannelNaming LISTENER = new ChannelNaming(DEFAULT_LISTENER_NAMESPACE);
  public static final ChannelNaming LOCKER = new ChannelNaming(DEFAULT_LOCKER_NAMESPACE);

  // Channel names end up unquoted in LISTEN statements.
  private static final Pattern NAMESPACE = Pattern.compile("[a-z_][a-z0-9_]{0,39}");

  public ChannelNaming {
    Objects.requireNonNull(namespace, "namespace");
    if (!NAMESPACE.matcher(namespace).matches()) {
      throw new IllegalArgumentException("namespace must be a lowercase identifier, got: " + namespace);
    }
  }

  public String channelFor(int identity) {
    if (identity < 0) {
      throw new IllegalArgumentException("identity must not be negative, got: " + identity);
    }
    return namespace + "_" + identity;
  }

  public boolean owns(String channel) {
    return channel != null && channel.startsWith(namespace + "_");
  }
}
