package io.nudge.queue.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.core.type.TypeReference;
import io.nudge.queue.QueueJson;
import io.nudge.queue.channel.ChannelNaming;
import io.nudge.queue.dispatch.DispatchOutcome;
import io.nudge.queue.dispatch.DispatchTicketSource;
import io.nudge.queue.metrics.QueueMetrics;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JobDispatchIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("queue")
          .withUsername("queue")
          .withPassword("queue");

  private static DriverManagerDataSource dataSource;
  private static JdbcTemplate jdbc;

  private LockerRepository lockers;
  private PostgresJobQueue queue;
  private Connection locker;

  @BeforeAll
  static void setup() {
    dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    jdbc = new JdbcTemplate(dataSource);
    QueueSchema.migrate(dataSource);
  }

  @BeforeEach
  void cleanTables() throws SQLException {
    jdbc.execute("TRUNCATE que_jobs, que_lockers RESTART IDENTITY");
    lockers = new LockerRepository(dataSource);
    queue = new PostgresJobQueue(dataSource);
    locker = dataSource.getConnection();
  }

  @AfterEach
  void closeLocker() throws SQLException {
    locker.close();
  }

  @Test
  void insertWithoutLockersSucceedsSilently() throws Exception {
    listen("que_locker_1");

    EnqueuedJob job = queue.enqueue(NewJob.builder("MyJob").build());

    assertThat(job.dispatch().outcome()).isEqualTo(DispatchOutcome.NO_ELIGIBLE_LOCKER);
    assertThat(jdbc.queryForObject("SELECT count(*) FROM que_jobs", Integer.class)).isEqualTo(1);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void notifiesTheOnlyListeningLockerOnce() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    listen("que_locker_1");

    EnqueuedJob job = queue.enqueue(NewJob.builder("MyJob").build());

    assertThat(job.dispatch().outcome()).isEqualTo(DispatchOutcome.NOTIFIED);
    assertThat(job.dispatch().channel()).isEqualTo("que_locker_1");
    List<PGNotification> received = receive(Duration.ofSeconds(3));
    assertThat(received).hasSize(1);
    assertThat(received.get(0).getName()).isEqualTo("que_locker_1");

    Map<String, Object> payload = parse(received.get(0).getParameter());
    assertThat(payload).containsOnlyKeys("job_id", "priority", "queue", "run_at");
    assertThat(payload).containsEntry("priority", 100).containsEntry("queue", "");
    assertThat(((Number) payload.get("job_id")).longValue()).isEqualTo(job.id());
    Instant runAt = Instant.parse((String) payload.get("run_at"));
    assertThat(runAt).isCloseTo(Instant.now(), within(3, ChronoUnit.SECONDS));
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void lockersOnOtherQueuesAreNotNotified() throws Exception {
    lockers.register(locker(1, 1, List.of("other_queue")));
    listen("que_locker_1");

    EnqueuedJob defaultQueue = queue.enqueue(NewJob.builder("MyJob").build());

    assertThat(defaultQueue.dispatch().outcome()).isEqualTo(DispatchOutcome.NO_ELIGIBLE_LOCKER);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();

    EnqueuedJob otherQueue = queue.enqueue(NewJob.builder("MyJob").queue("other_queue").build());

    assertThat(otherQueue.dispatch().target()).contains(1);
    assertThat(receive(Duration.ofSeconds(3))).singleElement()
        .satisfies(notification -> assertThat(parse(notification.getParameter())).containsEntry("queue", "other_queue"));
  }

  @Test
  void lockersThatAreNotListeningAreSkipped() throws Exception {
    lockers.register(locker(1, 4, List.of("")));
    lockers.setListening(1, false);
    listen("que_locker_1");

    assertThat(queue.enqueue(NewJob.builder("MyJob").build()).dispatch().outcome())
        .isEqualTo(DispatchOutcome.NO_ELIGIBLE_LOCKER);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void splitsJobsByWorkerCount() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    lockers.register(locker(2, 2, List.of("")));
    listen("que_locker_1");
    listen("que_locker_2");

    for (int i = 0; i < 6; i++) {
      queue.enqueue(NewJob.builder("MyJob").build());
    }

    Map<String, Integer> perChannel = new HashMap<>();
    List<PGNotification> received = new ArrayList<>();
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (received.size() < 6 && System.nanoTime() < deadline) {
      received.addAll(receive(Duration.ofMillis(500)));
    }
    received.forEach(notification -> perChannel.merge(notification.getName(), 1, Integer::sum));

    assertThat(perChannel).containsEntry("que_locker_1", 2).containsEntry("que_locker_2", 4);
  }

  @Test
  void futureJobsAreNotDispatched() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    listen("que_locker_1");

    EnqueuedJob job = queue.enqueue(NewJob.builder("MyJob").runAt(Instant.now().plus(Duration.ofHours(1))).build());

    assertThat(job.dispatch().outcome()).isEqualTo(DispatchOutcome.NOT_READY);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void notificationFollowsTheCallersTransaction() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    listen("que_locker_1");

    try (Connection producer = dataSource.getConnection()) {
      producer.setAutoCommit(false);
      queue.enqueue(producer, NewJob.builder("MyJob").build());
      assertThat(receive(Duration.ofMillis(300))).isEmpty();
      producer.rollback();

      queue.enqueue(producer, NewJob.builder("MyJob").priority(5).build());
      producer.commit();
    }

    assertThat(receive(Duration.ofSeconds(3))).singleElement()
        .satisfies(notification -> assertThat(parse(notification.getParameter())).containsEntry("priority", 5));
    assertThat(jdbc.queryForObject("SELECT count(*) FROM que_jobs", Integer.class)).isEqualTo(1);
  }

  @Test
  void failedDispatchKeepsTheJob() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    listen("que_locker_1");
    DispatchTicketSource broken = jobId -> {
      throw new IllegalStateException("no tickets left");
    };
    PostgresJobQueue failing = new PostgresJobQueue(dataSource,
        new JobDispatcher(ChannelNaming.LOCKER, broken), QueueJson.mapper(), QueueMetrics.noop());

    EnqueuedJob job = failing.enqueue(NewJob.builder("MyJob").build());

    assertThat(job.dispatch().outcome()).isEqualTo(DispatchOutcome.FAILED);
    assertThat(jdbc.queryForObject("SELECT count(*) FROM que_jobs WHERE id = ?", Integer.class, job.id()))
        .isEqualTo(1);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void errorDuringDispatchLeavesNoJobBehind() {
    DispatchTicketSource exhausted = jobId -> {
      throw new StackOverflowError("ticket source exhausted");
    };
    PostgresJobQueue failing = new PostgresJobQueue(dataSource,
        new JobDispatcher(ChannelNaming.LOCKER, exhausted), QueueJson.mapper(), QueueMetrics.noop());

    assertThatThrownBy(() -> failing.enqueue(NewJob.builder("MyJob").build()))
        .isInstanceOf(StackOverflowError.class);
    assertThat(jdbc.queryForObject("SELECT count(*) FROM que_jobs", Integer.class)).isZero();
  }

  @Test
  void disabledDispatcherOnlyInserts() throws Exception {
    lockers.register(locker(1, 1, List.of("")));
    listen("que_locker_1");
    PostgresJobQueue quiet = new PostgresJobQueue(dataSource, null, null, null);

    assertThat(quiet.enqueue(NewJob.builder("MyJob").build()).dispatch().outcome())
        .isEqualTo(DispatchOutcome.DISABLED);
    assertThat(receive(Duration.ofMillis(300))).isEmpty();
  }

  @Test
  void storesDefaultsAndData() {
    EnqueuedJob job = queue.enqueue(NewJob.builder("SendEmail")
        .data(Map.of("args", List.of("user@example.com", 3)))
        .build());

    Map<String, Object> row = jdbc.queryForMap(
        "SELECT priority, queue, job_class, data::text AS data, error_count FROM que_jobs WHERE id = ?", job.id());
    assertThat(row).containsEntry("priority", 100)
        .containsEntry("queue", "")
        .containsEntry("job_class", "SendEmail")
        .containsEntry("error_count", 0);
    assertThat(parse((String) row.get("data"))).containsEntry("args", List.of("user@example.com", 3));
  }

  private void listen(String channel) throws SQLException {
    try (Statement statement = locker.createStatement()) {
      statement.execute("LISTEN " + channel);
    }
  }

  private List<PGNotification> receive(Duration timeout) throws SQLException {
    PGNotification[] notifications = locker.unwrap(PGConnection.class).getNotifications((int) timeout.toMillis());
    return notifications == null ? List.of() : List.of(notifications);
  }

  private static LockerRegistration locker(int processId, int workerCount, List<String> queues) {
    return new LockerRegistration(processId, workerCount, List.of(1, 10, 50), 4242, "worker-host", true, queues);
  }

  private static Map<String, Object> parse(String json) {
    try {
      return QueueJson.mapper().readValue(json, new TypeReference<Map<String, Object>>() {
      });
    } catch (Exception e) {
      throw new AssertionError("not JSON: " + json, e);
    }
  }
}
