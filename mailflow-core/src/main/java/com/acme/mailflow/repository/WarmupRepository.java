package com.acme.mailflow.repository;

import com.acme.mailflow.reputation.WarmupDay;
import java.time.Instant;
import java.util.Optional;

public interface WarmupRepository {

  void insertDay(WarmupDay day);

  Optional<WarmupDay> findOpenDay(String domainId);

  /** Recorded warm-up days, the open one included. */
  int countDays(String domainId);

  void completeDay(String domainId, int day, int actualVolume, Instant completedAt);

  void incrementActual(String domainId, int day, int count);
}
