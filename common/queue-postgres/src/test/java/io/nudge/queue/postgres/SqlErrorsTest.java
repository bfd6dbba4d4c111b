package io.nudge.queue.postgres;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;

class SqlErrorsTest {

  @Test
  void checkViolationsCarryTheConstraintName() {
    SQLException cause = new SQLException(
        "ERROR: new row for relation \"que_jobs\" violates check constraint \"queue_length\"", "23514");

    QueueStorageException translated = SqlErrors.translate("enqueue MyJob", cause);

    assertThat(translated).isInstanceOf(QueueConstraintViolationException.class).hasCause(cause);
    assertThat(((QueueConstraintViolationException) translated).constraint()).isEqualTo("queue_length");
    assertThat(translated.getMessage()).isEqualTo("enqueue MyJob violates check constraint \"queue_length\"");
  }

  @Test
  void unnamedCheckViolationKeepsNullConstraint() {
    QueueStorageException translated = SqlErrors.translate("enqueue", new SQLException("check failed", "23514"));

    assertThat(((QueueConstraintViolationException) translated).constraint()).isNull();
  }

  @Test
  void otherFailuresAreStorageErrors() {
    SQLException cause = new SQLException("connection refused", "08001");

    QueueStorageException translated = SqlErrors.translate("list lockers", cause);

    assertThat(translated).isNotInstanceOf(QueueConstraintViolationException.class)
        .hasMessage("list lockers failed: connection refused")
        .hasCause(cause);
  }
}
