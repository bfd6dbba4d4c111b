package io.nudge.queue.postgres;

import io.nudge.queue.listen.ListenerException;
import io.nudge.queue.listen.Notification;
import io.nudge.queue.listen.NotificationSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link NotificationSource} on a connection checked out from a pool for a listener's lifetime.
 * <p>
 * The connection stays in auto-commit mode: pgjdbc only processes notifications while no
 * transaction is open. If unlistening fails, the connection is aborted instead of being handed
 * back to the pool with subscriptions still attached.
 */
public final class PostgresNotificationSource implements NotificationSource {

  private static final Logger log = LoggerFactory.getLogger(PostgresNotificationSource.class);

  private final Connection connection;
  private final PGConnection pgConnection;
  private final int backendPid;
  private boolean clean = true;
  private boolean closed;

  PostgresNotificationSource(Connection connection) throws SQLException {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.pgConnection = connection.unwrap(PGConnection.class);
    this.backendPid = pgConnection.getBackendPID();
  }

  /**
   * Checks out a dedicated connection from {@code dataSource}.
   */
  public static PostgresNotificationSource checkout(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    Connection connection;
    try {
      connection = dataSource.getConnection();
    } catch (SQLException e) {
      throw new ListenerException("Could not check out a listener connection", e);
    }
    try {
      connection.setAutoCommit(true);
      return new PostgresNotificationSource(connection);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw new ListenerException("Listener connection is not a PostgreSQL connection", e);
    }
  }

  @Override
  public int connectionIdentity() {
    return backendPid;
  }

  @Override
  public void listen(String channel) {
    execute("LISTEN " + quote(channel), "listen on " + channel);
  }

  @Override
  public List<Notification> await(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    try {
      PGNotification[] received = timeout.isZero() || timeout.isNegative()
          ? pgConnection.getNotifications()
          : pgConnection.getNotifications(toPositiveMillis(timeout));
      return convert(received);
    } catch (SQLException e) {
      clean = false;
      throw new ListenerException("Waiting for notifications failed on backend " + backendPid, e);
    }
  }

  @Override
  public void unlistenAll() {
    execute("UNLISTEN *", "unlisten");
    int discarded = 0;
    try {
      PGNotification[] pending;
      while ((pending = pgConnection.getNotifications()) != null && pending.length > 0) {
        discarded += pending.length;
      }
    } catch (SQLException e) {
      clean = false;
      throw new ListenerException("Draining notifications failed on backend " + backendPid, e);
    }
    if (discarded > 0) {
      log.debug("Discarded {} unconsumed notification(s) on backend {}", discarded, backendPid);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (!clean) {
        log.warn("Aborting listener connection of backend {} instead of returning it to the pool", backendPid);
        connection.abort(Runnable::run);
      }
      connection.close();
    } catch (SQLException e) {
      throw new ListenerException("Releasing listener connection of backend " + backendPid + " failed", e);
    }
  }

  private void execute(String sql, String action) {
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException e) {
      clean = false;
      throw new ListenerException("Could not " + action + " on backend " + backendPid, e);
    }
  }

  private static List<Notification> convert(PGNotification[] received) {
    if (received == null || received.length == 0) {
      return List.of();
    }
    List<Notification> notifications = new ArrayList<>(received.length);
    for (PGNotification notification : received) {
      notifications.add(new Notification(notification.getName(), notification.getPID(), notification.getParameter()));
    }
    return notifications;
  }

  // pgjdbc treats 0 as "wait forever".
  static int toPositiveMillis(Duration timeout) {
    long millis = timeout.toMillis();
    if (!timeout.minusMillis(millis).isZero()) {
      millis++;
    }
    return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, millis));
  }

  static String quote(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
