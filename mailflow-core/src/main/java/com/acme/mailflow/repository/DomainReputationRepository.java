package com.acme.mailflow.repository;

import com.acme.mailflow.reputation.DomainReputation;
import com.acme.mailflow.reputation.ReputationMetrics;
import java.time.Instant;
import java.util.Optional;

/** Counter updates are single atomic statements so concurrent senders never lose increments. */
public interface DomainReputationRepository {

  Optional<DomainReputation> find(String domainId);

  /** Counts one sent and delivered message, creating the row on first send. */
  void recordSent(String domainId, Instant at);

  /** The increments below only touch an existing row. */
  void incrementDelivered(String domainId);

  void incrementOpened(String domainId);

  void incrementClicked(String domainId);

  void updateMetrics(
      String domainId, long bounced, long complained, ReputationMetrics metrics, Instant calculatedAt);

  void setWarmup(String domainId, boolean inWarmup, Instant startedAt);
}
