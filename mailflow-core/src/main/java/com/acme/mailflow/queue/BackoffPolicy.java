package com.acme.mailflow.queue;

import java.time.Duration;

/** Delay between failed attempts of a job. */
public record BackoffPolicy(Kind kind, Duration delay) {

  public enum Kind {
    FIXED,
    EXPONENTIAL
  }

  public static BackoffPolicy exponential(Duration base) {
    return new BackoffPolicy(Kind.EXPONENTIAL, base);
  }

  public static BackoffPolicy fixed(Duration delay) {
    return new BackoffPolicy(Kind.FIXED, delay);
  }

  /**
   * Delay before the next run after {@code attemptsMade} failures. Exponential backoff doubles the
   * base delay per failure: 5s, 10s, 20s...
   */
  public Duration delayFor(int attemptsMade) {
    if (kind == Kind.FIXED || attemptsMade <= 1) {
      return delay;
    }
    return delay.multipliedBy(1L << Math.min(attemptsMade - 1, 20));
  }
}
