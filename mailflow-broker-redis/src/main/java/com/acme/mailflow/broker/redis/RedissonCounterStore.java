package com.acme.mailflow.broker.redis;

import com.acme.mailflow.spi.CounterStore;
import java.time.Duration;
import org.redisson.api.RAtomicLong;
import org.redisson.api.RedissonClient;

/** Fixed-window counters on Redis; errors propagate so the limiter can fail open. */
public class RedissonCounterStore implements CounterStore {

  private final RedissonClient redisson;

  public RedissonCounterStore(RedissonClient redisson) {
    this.redisson = redisson;
  }

  @Override
  public long increment(String key, Duration ttl) {
    RAtomicLong counter = redisson.getAtomicLong(key);
    long value = counter.incrementAndGet();
    if (value == 1) {
      counter.expire(ttl);
    }
    return value;
  }
}
