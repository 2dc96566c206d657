package com.acme.mailflow.domain;

import java.time.Instant;

/** A job waiting to be handed to its queue; written in the same transaction as the business row. */
public record OutboxEvent(
    Long id,
    String queueName,
    String jobId,
    String jobName,
    String payload,
    OutboxStatus status,
    int attempts,
    Instant nextAttemptAt,
    Instant createdAt,
    String lastError) {

  public static OutboxEvent pending(String queueName, String jobId, String jobName, String payload, Instant now) {
    return new OutboxEvent(null, queueName, jobId, jobName, payload, OutboxStatus.NEW, 0, now, now, null);
  }
}
