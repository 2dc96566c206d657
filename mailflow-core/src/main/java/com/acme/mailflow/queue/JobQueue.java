package com.acme.mailflow.queue;

/** Producer side of a named queue. */
public interface JobQueue<T> {

  QueueName name();

  /**
   * Adds a job. Returns false when a job with the same id already exists (waiting, delayed, active
   * or failed) or when the queue is degraded.
   */
  boolean enqueue(String jobName, T payload, JobOptions options);

  default boolean enqueue(T payload, JobOptions options) {
    return enqueue(name().id(), payload, options);
  }

  /** True when jobs are silently dropped because no broker is available. */
  boolean isDegraded();
}
