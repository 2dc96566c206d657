package com.acme.mailflow.processor.outbox;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.domain.OutboxEvent;
import com.acme.mailflow.processor.poller.AbstractPoller;
import com.acme.mailflow.processor.queue.QueueRegistry;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.QueueName;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.List;

/**
 * Publishes claimed outbox rows to their queues. A row that cannot be published is put back with
 * exponential backoff capped at five minutes; rows left CLAIMED by a crashed dispatcher are
 * recovered first.
 */
@Singleton
public class OutboxDispatcher extends AbstractPoller {

  private final OutboxService outbox;
  private final QueueRegistry queues;
  private final PollerConfig pollers;

  public OutboxDispatcher(OutboxService outbox, QueueRegistry queues, PollerConfig pollers) {
    this.outbox = outbox;
    this.queues = queues;
    this.pollers = pollers;
  }

  @Override
  public String name() {
    return "outbox";
  }

  @Override
  public Duration interval() {
    return pollers.getOutboxInterval();
  }

  @Override
  protected int doPoll() {
    int recovered = outbox.recoverStuck(pollers.getOutboxClaimTimeout());
    if (recovered > 0) {
      log.info("Recovered {} stuck CLAIMED outbox events", recovered);
    }

    List<OutboxEvent> rows = outbox.claim(pollers.getOutboxBatchSize());
    if (!rows.isEmpty()) {
      log.debug("Dispatching {} outbox events", rows.size());
    }

    int published = 0;
    for (OutboxEvent row : rows) {
      try {
        if (queues.isDegraded()) {
          throw new IllegalStateException("job broker unavailable");
        }
        boolean added =
            queues.enqueueJson(
                QueueName.fromId(row.queueName()),
                row.jobName(),
                row.payload(),
                JobOptions.withJobId(row.jobId()));
        if (!added) {
          log.debug("Outbox event {} already queued as jobId={}", row.id(), row.jobId());
        }
        outbox.markPublished(row.id());
        published++;
      } catch (Exception e) {
        Duration backoff = backoff(row.attempts() + 1);
        log.warn("Failed to publish outbox id={} queue={}, retry in {}: {}",
            row.id(), row.queueName(), backoff, e.getMessage());
        outbox.reschedule(row.id(), backoff, e.getMessage());
      }
    }
    return published;
  }

  static Duration backoff(int attempt) {
    return Duration.ofSeconds(Math.min(300L, 1L << Math.min(attempt, 9)));
  }
}
