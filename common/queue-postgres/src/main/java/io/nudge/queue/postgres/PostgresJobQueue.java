package io.nudge.queue.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nudge.queue.QueueJson;
import io.nudge.queue.dispatch.DispatchOutcome;
import io.nudge.queue.dispatch.DispatchResult;
import io.nudge.queue.metrics.QueueMetrics;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Producer entry point: inserts a job and dispatches its wake-up notification in the same
 * transaction.
 * <p>
 * Dispatch is best effort. It runs inside a savepoint; if it fails, the savepoint is rolled back
 * and the job is committed anyway, to be found later by polling. Constraint violations on the
 * insert are never swallowed: they surface as {@link QueueConstraintViolationException}.
 */
public final class PostgresJobQueue {

  private static final Logger log = LoggerFactory.getLogger(PostgresJobQueue.class);

  private static final String INSERT_SQL = """
      INSERT INTO que_jobs (queue, priority, run_at, job_class, data)
      VALUES (?, ?, COALESCE(CAST(? AS timestamptz), now()), ?, CAST(? AS jsonb))
      RETURNING id, queue, priority, run_at, job_class, run_at <= now() AS ready
      """;

  private final DataSource dataSource;
  private final JobDispatcher dispatcher;
  private final ObjectMapper mapper;
  private final QueueMetrics metrics;

  /**
   * @param dispatcher {@code null} disables notifications
   */
  public PostgresJobQueue(DataSource dataSource, JobDispatcher dispatcher, ObjectMapper mapper, QueueMetrics metrics) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.dispatcher = dispatcher;
    this.mapper = mapper != null ? mapper : QueueJson.mapper();
    this.metrics = metrics != null ? metrics : QueueMetrics.noop();
  }

  public PostgresJobQueue(DataSource dataSource) {
    this(dataSource, new JobDispatcher(), QueueJson.mapper(), QueueMetrics.noop());
  }

  /**
   * Inserts and dispatches in a transaction of its own, then commits.
   */
  public EnqueuedJob enqueue(NewJob job) {
    Objects.requireNonNull(job, "job");
    try (Connection connection = dataSource.getConnection()) {
      return inOwnTransaction(connection, job);
    } catch (SQLException e) {
      throw SqlErrors.translate("enqueue " + job.jobClass(), e);
    }
  }

  /**
   * Inserts and dispatches on the caller's connection. When the connection is in a transaction,
   * the caller commits and the notification goes out with that commit; in auto-commit mode a
   * transaction is opened and committed here.
   */
  public EnqueuedJob enqueue(Connection connection, NewJob job) {
    Objects.requireNonNull(connection, "connection");
    Objects.requireNonNull(job, "job");
    try {
      if (connection.getAutoCommit()) {
        return inOwnTransaction(connection, job);
      }
      return insertAndDispatch(connection, job);
    } catch (SQLException e) {
      throw SqlErrors.translate("enqueue " + job.jobClass(), e);
    }
  }

  private EnqueuedJob inOwnTransaction(Connection connection, NewJob job) throws SQLException {
    boolean autoCommit = connection.getAutoCommit();
    connection.setAutoCommit(false);
    try {
      EnqueuedJob enqueued = insertAndDispatch(connection, job);
      connection.commit();
      return enqueued;
    } catch (SQLException | RuntimeException | Error e) {
      // Restoring auto-commit below would otherwise commit the half-done transaction.
      rollback(connection, e);
      throw e;
    } finally {
      connection.setAutoCommit(autoCommit);
    }
  }

  private EnqueuedJob insertAndDispatch(Connection connection, NewJob job) throws SQLException {
    Inserted row = insert(connection, job);
    DispatchResult dispatch = dispatch(connection, row);
    metrics.dispatch(dispatch.outcome());
    return new EnqueuedJob(row.id(), row.queue(), row.priority(), row.runAt(), row.jobClass(), dispatch);
  }

  private Inserted insert(Connection connection, NewJob job) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
      ps.setString(1, job.queue());
      ps.setInt(2, job.priority());
      if (job.runAt() == null) {
        ps.setNull(3, Types.TIMESTAMP_WITH_TIMEZONE);
      } else {
        ps.setObject(3, OffsetDateTime.ofInstant(job.runAt(), ZoneOffset.UTC), Types.TIMESTAMP_WITH_TIMEZONE);
      }
      ps.setString(4, job.jobClass());
      ps.setString(5, QueueJson.writeWith(mapper, job.data(), "job data"));
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new QueueStorageException("Insert of " + job.jobClass() + " returned no row");
        }
        return new Inserted(
            rs.getLong("id"),
            rs.getString("queue"),
            rs.getInt("priority"),
            rs.getObject("run_at", OffsetDateTime.class).toInstant(),
            rs.getString("job_class"),
            rs.getBoolean("ready"));
      }
    }
  }

  private DispatchResult dispatch(Connection connection, Inserted row) throws SQLException {
    if (dispatcher == null) {
      return DispatchResult.of(DispatchOutcome.DISABLED);
    }
    if (!row.ready()) {
      return DispatchResult.of(DispatchOutcome.NOT_READY);
    }
    Savepoint savepoint = connection.setSavepoint();
    try {
      DispatchResult result = dispatcher.dispatch(connection, row.id(), row.queue(), row.priority(), row.runAt());
      connection.releaseSavepoint(savepoint);
      return result;
    } catch (SQLException | RuntimeException e) {
      // Rolling back to the savepoint keeps the insert; if even that fails the transaction is lost.
      connection.rollback(savepoint);
      log.warn("Dispatch of job {} on queue '{}' failed; it stays discoverable by polling: {}",
          row.id(), row.queue(), e.toString());
      return DispatchResult.of(DispatchOutcome.FAILED);
    }
  }

  private static void rollback(Connection connection, Throwable cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
    }
  }

  private record Inserted(long id, String queue, int priority, Instant runAt, String jobClass, boolean ready) {
  }
}
