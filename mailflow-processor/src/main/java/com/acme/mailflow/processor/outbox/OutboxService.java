package com.acme.mailflow.processor.outbox;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.OutboxEvent;
import com.acme.mailflow.domain.OutboxStatus;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.OutboxRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Outbox for fire-and-forget enqueues. {@link #publish} joins the caller's transaction, so the job
 * is queued exactly when the caller's own writes commit; {@link OutboxDispatcher} moves it to the
 * broker.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class OutboxService {
  private final OutboxRepository repository;
  private final Clock clock;

  @Transactional
  public long publish(QueueName queue, String jobId, Object payload) {
    return publish(queue, jobId, queue.id(), payload);
  }

  @Transactional
  public long publish(QueueName queue, String jobId, String jobName, Object payload) {
    long id =
        repository.insert(
            OutboxEvent.pending(queue.id(), jobId, jobName, Jsons.toJson(payload), clock.instant()));
    log.debug("Outbox event {} written for queue={} jobId={}", id, queue, jobId);
    return id;
  }

  /** The dispatcher leaves the event alone until {@code notBefore}. */
  @Transactional
  public long publishAt(QueueName queue, String jobId, Object payload, Instant notBefore) {
    Instant now = clock.instant();
    OutboxEvent event =
        new OutboxEvent(
            null,
            queue.id(),
            jobId,
            queue.id(),
            Jsons.toJson(payload),
            OutboxStatus.NEW,
            0,
            notBefore.isBefore(now) ? now : notBefore,
            now,
            null);
    long id = repository.insert(event);
    log.debug("Outbox event {} written for queue={} jobId={} notBefore={}", id, queue, jobId, notBefore);
    return id;
  }

  @Transactional
  public List<OutboxEvent> claim(int max) {
    return repository.claimBatch(max, clock.instant());
  }

  @Transactional
  public void markPublished(long id) {
    repository.markPublished(id, clock.instant());
  }

  @Transactional
  public void reschedule(long id, Duration backoff, String error) {
    repository.markFailed(id, error, clock.instant().plus(backoff));
  }

  @Transactional
  public int recoverStuck(Duration claimTimeout) {
    return repository.recoverStuck(claimTimeout, clock.instant());
  }
}
