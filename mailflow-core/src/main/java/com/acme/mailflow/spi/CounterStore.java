package com.acme.mailflow.spi;

import java.time.Duration;

/** Shared counters for fixed-window rate limiting. */
public interface CounterStore {

  /**
   * Atomically increments {@code key} and returns the new value. The first increment sets the
   * key's expiry to {@code ttl}.
   */
  long increment(String key, Duration ttl);
}
