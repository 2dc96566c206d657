package com.acme.mailflow.ratelimit;

import com.acme.mailflow.spi.CounterStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local counters, used when no shared store is configured. */
public class InMemoryCounterStore implements CounterStore {

  private record Counter(long value, Instant expiresAt) {}

  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryCounterStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public long increment(String key, Duration ttl) {
    Instant now = clock.instant();
    counters.values().removeIf(c -> !c.expiresAt().isAfter(now));
    return counters
        .compute(
            key,
            (k, c) ->
                c == null || !c.expiresAt().isAfter(now)
                    ? new Counter(1, now.plus(ttl))
                    : new Counter(c.value() + 1, c.expiresAt()))
        .value();
  }
}
