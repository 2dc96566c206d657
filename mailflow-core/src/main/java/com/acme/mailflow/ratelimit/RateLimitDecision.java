package com.acme.mailflow.ratelimit;

/**
 * Result of one rate-limit check.
 *
 * @param resetEpochSeconds end of the current window, in epoch seconds
 * @param retryAfterSeconds seconds a rejected caller should wait; 0 when allowed
 */
public record RateLimitDecision(
    boolean allowed, long limit, long remaining, long resetEpochSeconds, long retryAfterSeconds) {

  static RateLimitDecision allow(long limit, long count, long resetEpochSeconds) {
    return new RateLimitDecision(true, limit, Math.max(0, limit - count), resetEpochSeconds, 0);
  }

  static RateLimitDecision reject(long limit, long resetEpochSeconds, long retryAfterSeconds) {
    return new RateLimitDecision(false, limit, 0, resetEpochSeconds, retryAfterSeconds);
  }
}
