package com.acme.mailflow.ratelimit;

import com.acme.mailflow.config.RateLimitConfig;
import com.acme.mailflow.spi.CounterStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window request counter keyed by origin. Counters live in a shared {@link CounterStore} so
 * every instance sees the same totals.
 *
 * <p>A request is admitted when the store fails.
 */
public class FixedWindowRateLimiter {
  private static final Logger LOG = LoggerFactory.getLogger(FixedWindowRateLimiter.class);
  private static final Duration EXPIRY_SLACK = Duration.ofSeconds(10);

  private final CounterStore counters;
  private final RateLimitConfig config;
  private final Clock clock;

  public FixedWindowRateLimiter(CounterStore counters, RateLimitConfig config, Clock clock) {
    this.counters = counters;
    this.config = config;
    this.clock = clock;
  }

  public Optional<RateLimitDecision> checkIp(String ip) {
    return check(ip, config.getIpMaxRequests());
  }

  public Optional<RateLimitDecision> checkUser(String userId) {
    return check("user:" + userId, config.getUserMaxRequests());
  }

  /**
   * Counts one request for {@code origin}. Empty when limiting is switched off or the counter store
   * is unavailable.
   */
  public Optional<RateLimitDecision> check(String origin, long limit) {
    if (!config.isEnabled()) {
      return Optional.empty();
    }
    long windowSeconds = config.getWindow().toSeconds();
    long nowSeconds = clock.instant().getEpochSecond();
    long windowStart = nowSeconds / windowSeconds;
    long reset = (windowStart + 1) * windowSeconds;
    String key = "rate_limit:" + origin + ":" + windowStart;

    long count;
    try {
      count = counters.increment(key, config.getWindow().plus(EXPIRY_SLACK));
    } catch (RuntimeException e) {
      LOG.warn("Rate limit store unavailable, admitting request origin={}: {}", origin, e.getMessage());
      return Optional.empty();
    }

    if (count > limit) {
      return Optional.of(RateLimitDecision.reject(limit, reset, windowSeconds));
    }
    return Optional.of(RateLimitDecision.allow(limit, count, reset));
  }

  public boolean isExcluded(String path) {
    if (path == null) {
      return false;
    }
    return config.getExcludedPaths().stream().anyMatch(path::startsWith);
  }
}
