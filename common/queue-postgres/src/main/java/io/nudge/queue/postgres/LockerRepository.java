package io.nudge.queue.postgres;

import io.nudge.queue.dispatch.DispatchCandidate;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@code que_lockers}. Worker pools register at startup, adjust their capacity
 * while running and deregister on clean shutdown; the dispatcher only reads.
 */
public final class LockerRepository {

  private static final Logger log = LoggerFactory.getLogger(LockerRepository.class);

  private static final String COLUMNS = """
      process_id, worker_count, worker_priorities, host_process_id, hostname, listening, queues
      """;

  private static final String INSERT_SQL = """
      INSERT INTO que_lockers (
        process_id,
        worker_count,
        worker_priorities,
        host_process_id,
        hostname,
        listening,
        queues
      ) VALUES (?, ?, ?, ?, ?, ?, ?)
      """;

  private static final String LISTENING_FOR_QUEUE_SQL = "SELECT " + COLUMNS + """
      FROM que_lockers
      WHERE listening AND queues @> ARRAY[CAST(? AS text)]
      ORDER BY process_id
      """;

  private static final String CANDIDATES_FOR_QUEUE_SQL = """
      SELECT process_id, worker_count
      FROM que_lockers
      WHERE listening AND queues @> ARRAY[CAST(? AS text)]
      """;

  private final DataSource dataSource;

  public LockerRepository(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public void register(LockerRegistration registration) {
    Objects.requireNonNull(registration, "registration");
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
      ps.setInt(1, registration.processId());
      ps.setInt(2, registration.workerCount());
      ps.setArray(3, connection.createArrayOf("integer", registration.workerPriorities().toArray(new Integer[0])));
      ps.setInt(4, registration.hostProcessId());
      ps.setString(5, registration.hostname());
      ps.setBoolean(6, registration.listening());
      ps.setArray(7, connection.createArrayOf("text", registration.queues().toArray(new String[0])));
      ps.executeUpdate();
      log.info("Registered locker {} with {} worker(s) for queues {}",
          registration.processId(), registration.workerCount(), registration.queues());
    } catch (SQLException e) {
      throw SqlErrors.translate("register locker " + registration.processId(), e);
    }
  }

  /**
   * @return whether a locker with that id existed
   */
  public boolean updateWorkerCount(int processId, int workerCount) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement("UPDATE que_lockers SET worker_count = ? WHERE process_id = ?")) {
      ps.setInt(1, workerCount);
      ps.setInt(2, processId);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw SqlErrors.translate("update worker count of locker " + processId, e);
    }
  }

  /**
   * @return whether a locker with that id existed
   */
  public boolean setListening(int processId, boolean listening) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement("UPDATE que_lockers SET listening = ? WHERE process_id = ?")) {
      ps.setBoolean(1, listening);
      ps.setInt(2, processId);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw SqlErrors.translate("set listening on locker " + processId, e);
    }
  }

  /**
   * @return whether a locker with that id existed
   */
  public boolean deregister(int processId) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement("DELETE FROM que_lockers WHERE process_id = ?")) {
      ps.setInt(1, processId);
      boolean removed = ps.executeUpdate() > 0;
      if (removed) {
        log.info("Deregistered locker {}", processId);
      }
      return removed;
    } catch (SQLException e) {
      throw SqlErrors.translate("deregister locker " + processId, e);
    }
  }

  public List<LockerRegistration> findAll() {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement("SELECT " + COLUMNS + " FROM que_lockers ORDER BY process_id")) {
      return readAll(ps);
    } catch (SQLException e) {
      throw SqlErrors.translate("list lockers", e);
    }
  }

  /**
   * Listening lockers whose queues contain {@code queue} exactly.
   */
  public List<LockerRegistration> findListening(String queue) {
    Objects.requireNonNull(queue, "queue");
    try (Connection connection = dataSource.getConnection();
         PreparedStatement ps = connection.prepareStatement(LISTENING_FOR_QUEUE_SQL)) {
      ps.setString(1, queue);
      return readAll(ps);
    } catch (SQLException e) {
      throw SqlErrors.translate("list lockers for queue '" + queue + "'", e);
    }
  }

  /**
   * Dispatch read path: process id and weight of every listening locker for {@code queue}.
   */
  static List<DispatchCandidate> candidatesFor(Connection connection, String queue) throws SQLException {
    Objects.requireNonNull(queue, "queue");
    List<DispatchCandidate> candidates = new ArrayList<>();
    try (PreparedStatement ps = connection.prepareStatement(CANDIDATES_FOR_QUEUE_SQL)) {
      ps.setString(1, queue);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          candidates.add(new DispatchCandidate(rs.getInt("process_id"), rs.getInt("worker_count")));
        }
      }
    }
    return candidates;
  }

  private static List<LockerRegistration> readAll(PreparedStatement ps) throws SQLException {
    List<LockerRegistration> lockers = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        lockers.add(new LockerRegistration(
            rs.getInt("process_id"),
            rs.getInt("worker_count"),
            Arrays.asList((Integer[]) readArray(rs.getArray("worker_priorities"))),
            rs.getInt("host_process_id"),
            rs.getString("hostname"),
            rs.getBoolean("listening"),
            Arrays.asList((String[]) readArray(rs.getArray("queues")))));
      }
    }
    return lockers;
  }

  private static Object readArray(Array array) throws SQLException {
    try {
      return array.getArray();
    } finally {
      array.free();
    }
  }
}
