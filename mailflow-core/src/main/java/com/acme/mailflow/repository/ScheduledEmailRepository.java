package com.acme.mailflow.repository;

import com.acme.mailflow.domain.ScheduledEmail;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduledEmailRepository {

  Optional<ScheduledEmail> findById(String id);

  /** PENDING rows with {@code scheduledAt <= now}, oldest first. */
  List<ScheduledEmail> findDue(Instant now, int limit);

  /** Moves a PENDING row to SENT; returns false when the row was not PENDING. */
  boolean markSent(String id, Instant sentAt);

  boolean markFailed(String id, String error);
}
