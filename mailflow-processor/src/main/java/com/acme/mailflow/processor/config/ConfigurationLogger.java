package com.acme.mailflow.processor.config;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.RateLimitConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.queue.QueueFactory;
import com.acme.mailflow.queue.QueueName;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment to avoid configuration errors.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final TimeoutConfig timeoutConfig;
  private final QueueConfig queueConfig;
  private final PollerConfig pollerConfig;
  private final RateLimitConfig rateLimitConfig;
  private final QueueFactory queueFactory;

  @Property(name = "micronaut.server.port", defaultValue = "8080")
  private int serverPort;

  @Property(name = "datasources.default.url", defaultValue = "")
  private String datasourceUrl;

  @Property(name = "datasources.default.maximum-pool-size", defaultValue = "10")
  private int maxPoolSize;

  @Property(name = "db.dialect", defaultValue = "PostgreSQL")
  private String dialect;

  @Property(name = "redisson.address", defaultValue = "(not set)")
  private String redisAddress;

  public ConfigurationLogger(
      TimeoutConfig timeoutConfig,
      QueueConfig queueConfig,
      PollerConfig pollerConfig,
      RateLimitConfig rateLimitConfig,
      QueueFactory queueFactory) {
    this.timeoutConfig = timeoutConfig;
    this.queueConfig = queueConfig;
    this.pollerConfig = pollerConfig;
    this.rateLimitConfig = rateLimitConfig;
    this.queueFactory = queueFactory;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");

    LOG.info("━━━ Server Configuration ━━━");
    LOG.info("  Port:               {} (HTTP endpoint listening port)", serverPort);
    LOG.info("");

    LOG.info("━━━ Database Configuration ━━━");
    LOG.info("  JDBC URL:           {} ({} dialect)", datasourceUrl, dialect);
    LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
    LOG.info("");

    LOG.info("━━━ Queue Configuration ━━━");
    LOG.info("  Broker:             {} at {}", queueConfig.getBroker(), redisAddress);
    LOG.info("  Mode:               {}", queueFactory.isDegraded() ? "DEGRADED (jobs dropped)" : "ACTIVE");
    LOG.info("  Environment:        {}", queueConfig.getEnvironment());
    LOG.info("  Attempts:           {} (exponential backoff from {})", queueConfig.getDefaultAttempts(), queueConfig.getBackoffDelay());
    for (QueueName queue : QueueName.values()) {
      LOG.info("  {}: concurrency {}", String.format("%-27s", queue.id()), queueConfig.concurrencyFor(queue));
    }
    LOG.info("");

    LOG.info("━━━ Timeouts ━━━");
    LOG.info("  Collaborator Call:  {} (mail, mailbox and calendar providers)", timeoutConfig.getCollaboratorCall());
    LOG.info("  Stalled Job Lease:  {} (after which a claimed job is recovered)", timeoutConfig.getStalledJobLease());
    LOG.info("  Shutdown Ceiling:   {} (overall worker drain limit)", timeoutConfig.getShutdownCeiling());
    LOG.info("");

    LOG.info("━━━ Pollers ━━━");
    LOG.info("  Enabled:            {}", pollerConfig.isEnabled() ? "YES" : "NO");
    LOG.info("  Scheduled Email:    every {}", pollerConfig.getScheduledEmailInterval());
    LOG.info("  Snooze Restore:     every {}", pollerConfig.getSnoozeInterval());
    LOG.info("  Calendar Sync:      every {}", pollerConfig.getCalendarSyncInterval());
    LOG.info("  Outbox:             every {} (batch {})", pollerConfig.getOutboxInterval(), pollerConfig.getOutboxBatchSize());
    LOG.info("");

    LOG.info("━━━ Rate Limiting ━━━");
    LOG.info("  Enabled:            {}", rateLimitConfig.isEnabled() ? "YES" : "NO");
    LOG.info("  Per IP:             {} per {}", rateLimitConfig.getIpMaxRequests(), rateLimitConfig.getWindow());
    LOG.info("  Per User:           {} per {}", rateLimitConfig.getUserMaxRequests(), rateLimitConfig.getWindow());
    LOG.info("");

    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");
  }
}
