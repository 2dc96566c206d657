package com.acme.mailflow.queue;

import java.time.Instant;

/**
 * A job handed to a processor.
 *
 * @param attemptsMade failed attempts before this run, 0 on the first run
 */
public record Job<T>(
    QueueName queue,
    String jobId,
    String name,
    T payload,
    int attemptsMade,
    int maxAttempts,
    Instant enqueuedAt) {

  public boolean isLastAttempt() {
    return attemptsMade + 1 >= maxAttempts;
  }
}
