package com.acme.mailflow.queue;

/** In-process token bucket refilled continuously at a fixed rate per second. */
public class TokenBucket {

  private final long capacity;
  private double tokens;
  private long lastRefillNanos;

  public TokenBucket(long permitsPerSecond) {
    this.capacity = Math.max(1, permitsPerSecond);
    this.tokens = capacity;
    this.lastRefillNanos = System.nanoTime();
  }

  public synchronized boolean tryAcquire() {
    long now = System.nanoTime();
    tokens = Math.min(capacity, tokens + (now - lastRefillNanos) * capacity / 1_000_000_000d);
    lastRefillNanos = now;
    if (tokens >= 1) {
      tokens -= 1;
      return true;
    }
    return false;
  }

  public long capacity() {
    return capacity;
  }
}
