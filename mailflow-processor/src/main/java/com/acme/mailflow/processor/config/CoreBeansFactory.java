package com.acme.mailflow.processor.config;

import com.acme.mailflow.bounce.BounceClassifier;
import com.acme.mailflow.bounce.BounceRule;
import com.acme.mailflow.config.BounceConfig;
import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.RateLimitConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.ratelimit.FixedWindowRateLimiter;
import com.acme.mailflow.spi.CounterStore;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this factory binds its POJOs to the
 * {@code mailflow.*} keys of application.yml.
 */
@Factory
public class CoreBeansFactory {

  /** Creates TimeoutConfig bean populated from mailflow.timeouts.* properties */
  @Singleton
  @ConfigurationProperties("mailflow.timeouts")
  public TimeoutConfig timeoutConfig() {
    return new TimeoutConfig();
  }

  /** Creates QueueConfig bean populated from mailflow.queue.* properties */
  @Singleton
  @ConfigurationProperties("mailflow.queue")
  public QueueConfig queueConfig() {
    return new QueueConfig();
  }

  @Singleton
  @ConfigurationProperties("mailflow.rate-limit")
  public RateLimitConfig rateLimitConfig() {
    return new RateLimitConfig();
  }

  @Singleton
  @ConfigurationProperties("mailflow.pollers")
  public PollerConfig pollerConfig() {
    return new PollerConfig();
  }

  @Singleton
  @ConfigurationProperties("mailflow.bounce")
  public BounceConfig bounceConfig() {
    return new BounceConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Configured rules run before the built-in ones. */
  @Singleton
  public BounceClassifier bounceClassifier(BounceConfig config) {
    return BounceClassifier.withExtraRules(
        config.getExtraRules().stream().map(BounceRule::parse).toList());
  }

  @Singleton
  public FixedWindowRateLimiter rateLimiter(
      CounterStore counters, RateLimitConfig config, Clock clock) {
    return new FixedWindowRateLimiter(counters, config, clock);
  }
}
