package io.nudge.queue.postgres;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

/**
 * Translates JDBC failures into the queue's unchecked exceptions.
 */
final class SqlErrors {

  static final String CHECK_VIOLATION = "23514";

  private static final Pattern CONSTRAINT_IN_MESSAGE = Pattern.compile("violates check constraint \"([^\"]+)\"");

  private SqlErrors() {
  }

  static QueueStorageException translate(String action, SQLException e) {
    if (CHECK_VIOLATION.equals(e.getSQLState())) {
      String constraint = constraintOf(e);
      return new QueueConstraintViolationException(
          constraint,
          action + " violates check constraint \"" + constraint + "\"",
          e);
    }
    return new QueueStorageException(action + " failed: " + e.getMessage(), e);
  }

  static String constraintOf(SQLException e) {
    if (e instanceof PSQLException psql) {
      ServerErrorMessage server = psql.getServerErrorMessage();
      if (server != null && server.getConstraint() != null) {
        return server.getConstraint();
      }
    }
    String message = e.getMessage();
    if (message != null) {
      Matcher matcher = CONSTRAINT_IN_MESSAGE.matcher(message);
      if (matcher.find()) {
        return matcher.group(1);
      }
    }
    return null;
  }
}
