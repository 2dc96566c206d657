package com.acme.mailflow.queue;

import java.time.Duration;

/**
 * Per-enqueue options. Null fields fall back to the queue defaults; a null job id gets a random
 * one, which disables de-duplication.
 */
public record JobOptions(String jobId, Integer attempts, BackoffPolicy backoff, Duration delay) {

  public static JobOptions defaults() {
    return new JobOptions(null, null, null, null);
  }

  public static JobOptions withJobId(String jobId) {
    return new JobOptions(jobId, null, null, null);
  }

  public JobOptions attempts(int attempts) {
    return new JobOptions(jobId, attempts, backoff, delay);
  }

  public JobOptions backoff(BackoffPolicy backoff) {
    return new JobOptions(jobId, attempts, backoff, delay);
  }

  public JobOptions delay(Duration delay) {
    return new JobOptions(jobId, attempts, backoff, delay);
  }
}
