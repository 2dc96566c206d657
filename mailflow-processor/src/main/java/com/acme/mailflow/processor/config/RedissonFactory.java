package com.acme.mailflow.processor.config;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/**
 * Shared Redis connection for the job broker and the rate-limit counters. Creation fails when
 * Redis is unreachable; callers resolve the client lazily and degrade.
 */
@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Property(name = "redisson.connect-timeout-millis", defaultValue = "3000") int connectTimeout,
      @Property(name = "redisson.retry-attempts", defaultValue = "2") int retryAttempts) {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(address)
        .setConnectTimeout(connectTimeout)
        .setRetryAttempts(retryAttempts);
    return Redisson.create(config);
  }
}
