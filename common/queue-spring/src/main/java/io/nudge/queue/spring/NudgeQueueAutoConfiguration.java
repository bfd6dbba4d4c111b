package io.nudge.queue.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.nudge.queue.QueueJson;
import io.nudge.queue.channel.ChannelNaming;
import io.nudge.queue.diagnostics.AsyncErrorNotifier;
import io.nudge.queue.diagnostics.ErrorNotifier;
import io.nudge.queue.dispatch.DispatchTicketSource;
import io.nudge.queue.listen.NotificationDecoder;
import io.nudge.queue.message.MessageRegistry;
import io.nudge.queue.metrics.MicrometerQueueMetrics;
import io.nudge.queue.metrics.QueueMetrics;
import io.nudge.queue.postgres.JobDispatcher;
import io.nudge.queue.postgres.LockerRepository;
import io.nudge.queue.postgres.PostgresJobQueue;
import io.nudge.queue.postgres.PostgresListenerFactory;
import io.nudge.queue.postgres.QueueSchema;
import java.security.SecureRandom;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the dispatcher, job queue, locker repository and listener factory against the
 * application's {@link DataSource}.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnClass({DataSource.class, PGConnection.class})
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "nudge.queue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(NudgeQueueProperties.class)
public class NudgeQueueAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(NudgeQueueAutoConfiguration.class);

  @Bean
  @ConditionalOnProperty(prefix = "nudge.queue.schema", name = "migrate", havingValue = "true", matchIfMissing = true)
  QueueSchemaInitializer queueSchemaInitializer(DataSource dataSource) {
    return new QueueSchemaInitializer(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  MessageRegistry queueMessageRegistry() {
    return MessageRegistry.defaults();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(ErrorNotifier.class)
  AsyncErrorNotifier queueErrorNotifier(NudgeQueueProperties properties) {
    return new AsyncErrorNotifier(error -> log.warn("Queue notification problem: {}", error.getMessage(), error),
        properties.getDiagnostics().getThreadName());
  }

  @Bean
  @ConditionalOnMissingBean
  QueueMetrics queueMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
    MeterRegistry registry = meterRegistry.getIfAvailable();
    return registry != null ? new MicrometerQueueMetrics(registry) : QueueMetrics.noop();
  }

  @Bean
  @ConditionalOnMissingBean
  JobDispatcher jobDispatcher(NudgeQueueProperties properties) {
    NudgeQueueProperties.Dispatch dispatch = properties.getDispatch();
    DispatchTicketSource tickets = dispatch.getTicket() == NudgeQueueProperties.Ticket.RANDOM
        ? DispatchTicketSource.random(new SecureRandom())
        : DispatchTicketSource.jobId();
    return new JobDispatcher(new ChannelNaming(dispatch.getChannelNamespace()), tickets);
  }

  @Bean
  @ConditionalOnMissingBean
  PostgresJobQueue postgresJobQueue(DataSource dataSource,
                                    JobDispatcher jobDispatcher,
                                    NudgeQueueProperties properties,
                                    ObjectProvider<ObjectMapper> objectMapper,
                                    QueueMetrics queueMetrics) {
    JobDispatcher dispatcher = properties.getDispatch().isEnabled() ? jobDispatcher : null;
    return new PostgresJobQueue(dataSource, dispatcher, objectMapper.getIfAvailable(QueueJson::mapper), queueMetrics);
  }

  @Bean
  @ConditionalOnMissingBean
  LockerRepository lockerRepository(DataSource dataSource) {
    return new LockerRepository(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  NotificationDecoder notificationDecoder(MessageRegistry registry,
                                          ErrorNotifier errorNotifier,
                                          QueueMetrics queueMetrics) {
    return new NotificationDecoder(QueueJson.mapper(), registry, errorNotifier, queueMetrics);
  }

  @Bean
  @ConditionalOnMissingBean
  PostgresListenerFactory postgresListenerFactory(DataSource dataSource,
                                                  NotificationDecoder decoder,
                                                  NudgeQueueProperties properties) {
    return new PostgresListenerFactory(dataSource,
        new ChannelNaming(properties.getListener().getChannelNamespace()), decoder);
  }

  /**
   * Runs the queue schema migration once the context starts.
   */
  static final class QueueSchemaInitializer implements InitializingBean {

    private final DataSource dataSource;

    QueueSchemaInitializer(DataSource dataSource) {
      this.dataSource = dataSource;
    }

    @Override
    public void afterPropertiesSet() {
      QueueSchema.migrate(dataSource);
    }
  }
}
