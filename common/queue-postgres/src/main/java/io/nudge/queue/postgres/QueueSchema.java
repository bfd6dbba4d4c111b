package io.nudge.queue.postgres;

import java.util.Objects;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the {@code que_jobs} and {@code que_lockers} tables with their check constraints.
 * <p>
 * Uses its own Flyway history table so it can live next to an application's migrations.
 */
public final class QueueSchema {

  private static final Logger log = LoggerFactory.getLogger(QueueSchema.class);

  public static final String LOCATION = "classpath:db/queue-nudge";
  public static final String HISTORY_TABLE = "queue_nudge_schema_history";

  private QueueSchema() {
  }

  public static MigrateResult migrate(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    MigrateResult result = Flyway.configure()
        .dataSource(dataSource)
        .locations(LOCATION)
        .table(HISTORY_TABLE)
        .baselineOnMigrate(true)
        .baselineVersion("0")
        .load()
        .migrate();
    log.info("Queue schema at version {} ({} migration(s) applied)", result.targetSchemaVersion, result.migrationsExecuted);
    return result;
  }
}
