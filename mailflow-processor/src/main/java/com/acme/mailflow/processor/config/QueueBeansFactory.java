package com.acme.mailflow.processor.config;

import com.acme.mailflow.broker.redis.RedissonCounterStore;
import com.acme.mailflow.broker.redis.RedissonJobStore;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.queue.InMemoryJobStore;
import com.acme.mailflow.queue.NullQueueFactory;
import com.acme.mailflow.queue.QueueFactory;
import com.acme.mailflow.queue.StoreBackedQueueFactory;
import com.acme.mailflow.ratelimit.InMemoryCounterStore;
import com.acme.mailflow.spi.CounterStore;
import io.micronaut.context.BeanProvider;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the job broker from {@code mailflow.queue.broker}. A Redis broker that is not configured
 * or cannot be reached leaves the process in degraded mode instead of failing startup.
 */
@Factory
public class QueueBeansFactory {
  private static final Logger LOG = LoggerFactory.getLogger(QueueBeansFactory.class);

  @Singleton
  public QueueFactory queueFactory(
      QueueConfig config,
      TimeoutConfig timeouts,
      Clock clock,
      BeanProvider<RedissonClient> redisson) {
    return create(config, timeouts, clock, () -> resolve(redisson));
  }

  /** Rate-limit counters share the Redis connection when there is one. */
  @Singleton
  public CounterStore counterStore(QueueConfig config, Clock clock, BeanProvider<RedissonClient> redisson) {
    if (QueueConfig.BROKER_REDIS.equals(brokerOf(config))) {
      Optional<RedissonClient> client = resolve(redisson);
      if (client.isPresent()) {
        return new RedissonCounterStore(client.get());
      }
    }
    LOG.warn("Rate limit counters kept in process memory; limits are per instance");
    return new InMemoryCounterStore(clock);
  }

  static QueueFactory create(
      QueueConfig config,
      TimeoutConfig timeouts,
      Clock clock,
      Supplier<Optional<RedissonClient>> redisson) {
    String broker = brokerOf(config);
    switch (broker) {
      case QueueConfig.BROKER_MEMORY -> {
        LOG.info("Using in-process job broker; jobs do not survive a restart");
        return new StoreBackedQueueFactory(new InMemoryJobStore(), config, timeouts, clock);
      }
      case QueueConfig.BROKER_REDIS -> {
        Optional<RedissonClient> client = redisson.get();
        if (client.isEmpty()) {
          LOG.warn("Redis broker not available, queues run in degraded mode (jobs are dropped)");
          return new NullQueueFactory();
        }
        LOG.info("Using Redis job broker");
        return new StoreBackedQueueFactory(
            new RedissonJobStore(client.get(), clock), config, timeouts, clock);
      }
      case QueueConfig.BROKER_NONE -> {
        LOG.warn("Job broker disabled, queues run in degraded mode (jobs are dropped)");
        return new NullQueueFactory();
      }
      default -> throw new IllegalArgumentException("Unknown mailflow.queue.broker: " + broker);
    }
  }

  private static String brokerOf(QueueConfig config) {
    return config.getBroker() == null
        ? QueueConfig.BROKER_NONE
        : config.getBroker().trim().toLowerCase(Locale.ROOT);
  }

  private static Optional<RedissonClient> resolve(BeanProvider<RedissonClient> provider) {
    try {
      return provider.isPresent() ? Optional.of(provider.get()) : Optional.empty();
    } catch (RuntimeException e) {
      LOG.warn("Could not connect to Redis: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
