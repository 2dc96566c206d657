package com.acme.mailflow.queue;

/**
 * Handles the jobs of one queue. Implementations must be idempotent: a job can run more than
 * once after a crash or a retry.
 */
public interface JobProcessor<T> {

  Class<T> payloadType();

  /**
   * Processes one job. Throwing schedules a retry with backoff; a {@link
   * com.acme.mailflow.core.PermanentException} skips the remaining attempts.
   */
  JobResult process(Job<T> job) throws Exception;

  /** Called once a job has used up its attempts or failed permanently. */
  default void onExhausted(Job<T> job, Exception error) {
  }
}
