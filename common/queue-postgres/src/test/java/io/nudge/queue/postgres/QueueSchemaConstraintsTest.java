package io.nudge.queue.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nudge.queue.dispatch.DispatchCandidate;
import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class QueueSchemaConstraintsTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("queue")
          .withUsername("queue")
          .withPassword("queue");

  private static DriverManagerDataSource dataSource;
  private static JdbcTemplate jdbc;

  private PostgresJobQueue queue;
  private LockerRepository lockers;

  @BeforeAll
  static void setup() {
    dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    jdbc = new JdbcTemplate(dataSource);
    QueueSchema.migrate(dataSource);
  }

  @BeforeEach
  void cleanTables() {
    jdbc.execute("TRUNCATE que_jobs, que_lockers");
    queue = new PostgresJobQueue(dataSource);
    lockers = new LockerRepository(dataSource);
  }

  @Test
  void migrationIsRepeatable() {
    assertThat(QueueSchema.migrate(dataSource).migrationsExecuted).isZero();
  }

  @Test
  void dataMustBeAnObjectWithOptionalArgsArray() {
    assertRawInsertRejected("'[]'", "data_format");
    assertRawInsertRejected("'[{\"args\":[]}]'", "data_format");
    assertRawInsertRejected("'4'", "data_format");
    assertRawInsertRejected("'{\"args\":4}'", "data_format");

    assertThatCode(() -> insertRaw("'{}'")).doesNotThrowAnyException();
    assertThatCode(() -> insertRaw("'{\"args\":[1,\"two\"],\"kwargs\":{}}'")).doesNotThrowAnyException();
  }

  @Test
  void dataViolationsSurfaceWithTheirConstraintName() {
    assertThatThrownBy(() -> queue.enqueue(NewJob.builder("MyJob").data(Map.of("args", 4)).build()))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("data_format"));
    assertThat(jdbc.queryForObject("SELECT count(*) FROM que_jobs", Integer.class)).isZero();
  }

  @Test
  void queueNameIsLimitedToSixtyBytes() {
    assertThatCode(() -> queue.enqueue(NewJob.builder("MyJob").queue("a".repeat(60)).build()))
        .doesNotThrowAnyException();
    assertThatCode(() -> queue.enqueue(NewJob.builder("MyJob").queue("é".repeat(30)).build()))
        .doesNotThrowAnyException();

    assertThatThrownBy(() -> queue.enqueue(NewJob.builder("MyJob").queue("a".repeat(61)).build()))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("queue_length"));
    assertThatThrownBy(() -> queue.enqueue(NewJob.builder("MyJob").queue("é".repeat(31)).build()))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("queue_length"));
  }

  @Test
  void runAtMustBeFinite() {
    assertThatThrownBy(() -> jdbc.update(
        "INSERT INTO que_jobs (job_class, run_at) VALUES ('MyJob', 'infinity')"))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("run_at_valid");
    assertThatThrownBy(() -> jdbc.update(
        "INSERT INTO que_jobs (job_class, run_at) VALUES ('MyJob', '-infinity')"))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining("run_at_valid");
  }

  @Test
  void acceptsValidLocker() {
    lockers.register(locker(3, List.of(1, 10, 50), List.of("", "mailers")));

    assertThat(lockers.findAll()).singleElement().satisfies(stored -> {
      assertThat(stored.processId()).isEqualTo(3);
      assertThat(stored.queues()).containsExactly("", "mailers");
      assertThat(stored.workerPriorities()).containsExactly(1, 10, 50);
    });
    assertThat(lockers.findListening("mailers")).hasSize(1);
    assertThat(lockers.findListening("mail")).isEmpty();
  }

  @Test
  void workerPrioritiesMayContainAnyMarkers() {
    lockers.register(locker(4, Arrays.asList(10, null), List.of("")));

    assertThat(lockers.findAll().get(0).workerPriorities()).containsExactly(10, null);
  }

  @Test
  void lockerQueuesMustBeANonEmptyFlatArray() {
    assertThatThrownBy(() -> lockers.register(locker(1, List.of(1), List.of())))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("valid_queues"));
    assertRawLockerRejected("'{1}'", "'{{a}}'", "valid_queues");
  }

  @Test
  void lockerQueuesMustNotContainNull() {
    assertRawLockerRejected("'{1}'", "'{\"\",NULL}'", "valid_queues");
    assertRawLockerRejected("'{1}'", "ARRAY[NULL]::text[]", "valid_queues");
  }

  @Test
  void dispatchCandidatesCarryProcessIdAndWeight() throws Exception {
    lockers.register(locker(7, List.of(1), List.of("", "mailers")));
    lockers.register(locker(8, List.of(1), List.of("mailers")));

    try (Connection connection = dataSource.getConnection()) {
      assertThat(LockerRepository.candidatesFor(connection, "mailers"))
          .containsExactlyInAnyOrder(new DispatchCandidate(7, 2), new DispatchCandidate(8, 2));
      assertThat(LockerRepository.candidatesFor(connection, "")).containsExactly(new DispatchCandidate(7, 2));
    }
  }

  @Test
  void lockerWorkerPrioritiesMustBeANonEmptyFlatArray() {
    assertThatThrownBy(() -> lockers.register(locker(1, List.of(), List.of(""))))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("valid_worker_priorities"));
    assertRawLockerRejected("'{{1}}'", "'{a}'", "valid_worker_priorities");
  }

  @Test
  void lockerNeedsAtLeastOneWorker() {
    LockerRegistration idle = new LockerRegistration(1, 0, List.of(1), 99, "host", true, List.of(""));

    assertThatThrownBy(() -> lockers.register(idle))
        .isInstanceOfSatisfying(QueueConstraintViolationException.class,
            e -> assertThat(e.constraint()).isEqualTo("valid_worker_count"));
  }

  @Test
  void lockerLifecycle() {
    lockers.register(locker(5, List.of(1), List.of("")));

    assertThat(lockers.updateWorkerCount(5, 8)).isTrue();
    assertThat(lockers.setListening(5, false)).isTrue();
    assertThat(lockers.findAll().get(0).workerCount()).isEqualTo(8);
    assertThat(lockers.findListening("")).isEmpty();
    assertThat(lockers.deregister(5)).isTrue();
    assertThat(lockers.deregister(5)).isFalse();
    assertThat(lockers.updateWorkerCount(5, 2)).isFalse();
  }

  @Test
  void duplicateLockerIsAStorageError() {
    lockers.register(locker(6, List.of(1), List.of("")));

    assertThatThrownBy(() -> lockers.register(locker(6, List.of(1), List.of(""))))
        .isInstanceOf(QueueStorageException.class)
        .isNotInstanceOf(QueueConstraintViolationException.class);
  }

  private void assertRawInsertRejected(String data, String constraint) {
    assertThatThrownBy(() -> insertRaw(data))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining(constraint);
  }

  private void insertRaw(String data) {
    jdbc.update("INSERT INTO que_jobs (job_class, data) VALUES ('MyJob', " + data + ")");
  }

  private void assertRawLockerRejected(String priorities, String queues, String constraint) {
    assertThatThrownBy(() -> jdbc.update(
        "INSERT INTO que_lockers (process_id, worker_count, worker_priorities, host_process_id, hostname, listening, queues)"
            + " VALUES (1, 1, " + priorities + ", 99, 'host', true, " + queues + ")"))
        .isInstanceOf(DataIntegrityViolationException.class)
        .hasMessageContaining(constraint);
  }

  private static LockerRegistration locker(int processId, List<Integer> priorities, List<String> queues) {
    return new LockerRegistration(processId, 2, priorities, 99, "host", true, queues);
  }
}
