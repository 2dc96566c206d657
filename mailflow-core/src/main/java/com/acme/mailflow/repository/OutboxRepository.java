package com.acme.mailflow.repository;

import com.acme.mailflow.domain.OutboxEvent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public interface OutboxRepository {

  long insert(OutboxEvent event);

  /** Claims up to {@code limit} NEW rows whose next attempt is due. */
  List<OutboxEvent> claimBatch(int limit, Instant now);

  void markPublished(long id, Instant at);

  void markFailed(long id, String error, Instant nextAttemptAt);

  /** Puts CLAIMED rows older than {@code claimTimeout} back to NEW. */
  int recoverStuck(Duration claimTimeout, Instant now);
}
