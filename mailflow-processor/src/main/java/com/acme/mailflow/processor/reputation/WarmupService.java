package com.acme.mailflow.processor.reputation;

import com.acme.mailflow.repository.DomainReputationRepository;
import com.acme.mailflow.repository.WarmupRepository;
import com.acme.mailflow.reputation.DomainReputation;
import com.acme.mailflow.reputation.ReputationCalculator;
import com.acme.mailflow.reputation.WarmupDay;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Warm-up schedule of a new sending domain: day 1 allows 50 sends, each completed day grows the
 * next target by half up to 10,000, and warm-up ends after day 30.
 */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class WarmupService {

  private final DomainReputationRepository reputations;
  private final WarmupRepository warmups;
  private final Clock clock;

  /** No-op when the domain is already warming up. */
  @Transactional
  public void startWarmup(String domainId) {
    Optional<DomainReputation> existing = reputations.find(domainId);
    if (existing.map(DomainReputation::inWarmup).orElse(false)) {
      log.debug("Domain {} already in warm-up", domainId);
      return;
    }
    Instant now = clock.instant();
    reputations.setWarmup(domainId, true, now);
    warmups.insertDay(new WarmupDay(domainId, 1, ReputationCalculator.WARMUP_START_VOLUME, 0, null));
    log.info("Started warm-up for domain {} (day 1 target {})", domainId, ReputationCalculator.WARMUP_START_VOLUME);
  }

  @Transactional
  public void completeWarmupDay(String domainId, int day, int actualVolume) {
    Optional<WarmupDay> open = warmups.findOpenDay(domainId);
    warmups.completeDay(domainId, day, actualVolume, clock.instant());

    int nextDay = day + 1;
    if (nextDay > ReputationCalculator.WARMUP_DAYS) {
      Instant startedAt =
          reputations.find(domainId).map(DomainReputation::warmupStartedAt).orElse(null);
      reputations.setWarmup(domainId, false, startedAt);
      log.info("Warm-up complete for domain {} after {} days", domainId, day);
      return;
    }
    int previousTarget =
        open.filter(d -> d.day() == day)
            .map(WarmupDay::targetVolume)
            .orElse(ReputationCalculator.warmupDailyLimit(day - 1));
    int target = ReputationCalculator.nextWarmupTarget(previousTarget);
    warmups.insertDay(new WarmupDay(domainId, nextDay, target, 0, null));
    log.info("Warm-up day {} closed for domain {} ({} sent), day {} target {}",
        day, domainId, actualVolume, nextDay, target);
  }

  /** False when the open warm-up day has fewer than {@code requestedCount} sends left. */
  @Transactional(readOnly = true)
  public boolean canSend(String domainId, int requestedCount) {
    boolean inWarmup = reputations.find(domainId).map(DomainReputation::inWarmup).orElse(false);
    if (!inWarmup) {
      return true;
    }
    Optional<WarmupDay> open = warmups.findOpenDay(domainId);
    if (open.isPresent() && requestedCount > open.get().remaining()) {
      log.info("Warm-up limit reached for domain {} day {} (remaining {})",
          domainId, open.get().day(), open.get().remaining());
      return false;
    }
    return true;
  }
}
