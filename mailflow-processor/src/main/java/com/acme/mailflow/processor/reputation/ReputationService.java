package com.acme.mailflow.processor.reputation;

import com.acme.mailflow.repository.BounceRepository;
import com.acme.mailflow.repository.DomainReputationRepository;
import com.acme.mailflow.repository.WarmupRepository;
import com.acme.mailflow.reputation.DomainReputation;
import com.acme.mailflow.reputation.ReputationCalculator;
import com.acme.mailflow.reputation.ReputationMetrics;
import com.acme.mailflow.reputation.SendingLimits;
import com.acme.mailflow.reputation.WarmupDay;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sender reputation per sending domain. Counters move through store-side increments; rates and
 * score are recomputed from the last 30 days of bounces and complaints.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class ReputationService {
  static final Duration RATE_WINDOW = Duration.ofDays(30);

  private final DomainReputationRepository reputations;
  private final WarmupRepository warmups;
  private final BounceRepository bounces;
  private final Clock clock;

  @Transactional(readOnly = true)
  public SendingLimits getSendingLimits(String domainId) {
    Optional<DomainReputation> reputation = reputations.find(domainId);
    int warmupDays =
        reputation.filter(DomainReputation::inWarmup).isPresent()
            ? warmups.countDays(domainId)
            : 0;
    return ReputationCalculator.sendingLimits(reputation, warmupDays);
  }

  @Transactional(readOnly = true)
  public boolean isDomainInGoodStanding(String domainId) {
    return ReputationCalculator.isGoodStanding(reputations.find(domainId));
  }

  /** Creates the domain record on first use and counts the send against an open warm-up day. */
  @Transactional
  public void recordEmailSent(String domainId) {
    reputations.recordSent(domainId, clock.instant());
    Optional<WarmupDay> day = warmups.findOpenDay(domainId);
    day.ifPresent(d -> warmups.incrementActual(domainId, d.day(), 1));
  }

  @Transactional
  public void recordEmailDelivered(String domainId) {
    reputations.incrementDelivered(domainId);
  }

  @Transactional
  public void recordEmailOpened(String domainId) {
    reputations.incrementOpened(domainId);
  }

  @Transactional
  public void recordEmailClicked(String domainId) {
    reputations.incrementClicked(domainId);
  }

  /** Empty when the domain has never sent. */
  @Transactional
  public Optional<ReputationMetrics> recalculate(String domainId) {
    Optional<DomainReputation> found = reputations.find(domainId);
    if (found.isEmpty()) {
      log.debug("No reputation record for domain {}, nothing to recalculate", domainId);
      return Optional.empty();
    }
    DomainReputation r = found.get();
    Instant now = clock.instant();
    Instant since = now.minus(RATE_WINDOW);
    long bounced = bounces.countDomainBounces(domainId, since);
    long complained = bounces.countDomainComplaints(domainId, since);

    ReputationMetrics metrics =
        ReputationCalculator.calculate(
            r.totalSent(), r.totalDelivered(), bounced, complained, r.totalOpened(), r.totalClicked());
    reputations.updateMetrics(domainId, bounced, complained, metrics, now);

    if (metrics.score() != r.reputationScore()) {
      log.info(
          "Reputation of domain {} changed {} -> {} (bounceRate={} complaintRate={})",
          domainId,
          r.reputationScore(),
          metrics.score(),
          metrics.bounceRate(),
          metrics.complaintRate());
    }
    return Optional.of(metrics);
  }
}
