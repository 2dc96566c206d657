package com.acme.mailflow.spi;

import com.acme.mailflow.queue.BackoffPolicy;
import com.acme.mailflow.queue.QueueName;
import java.time.Instant;

/** Broker-side representation of a job; the payload is kept as JSON. */
public record StoredJob(
    QueueName queue,
    String jobId,
    String name,
    String payload,
    int attemptsMade,
    int maxAttempts,
    BackoffPolicy backoff,
    Instant enqueuedAt,
    String lastError) {

  public StoredJob withFailure(int attemptsMade, String error) {
    return new StoredJob(
        queue, jobId, name, payload, attemptsMade, maxAttempts, backoff, enqueuedAt, error);
  }
}
