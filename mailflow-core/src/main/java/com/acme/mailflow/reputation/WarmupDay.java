package com.acme.mailflow.reputation;

import java.time.Instant;

/** One day of a domain's warm-up schedule; {@code completedAt} is null while the day is open. */
public record WarmupDay(
    String domainId, int day, int targetVolume, int actualVolume, Instant completedAt) {

  public boolean isOpen() {
    return completedAt == null;
  }

  public int remaining() {
    return Math.max(0, targetVolume - actualVolume);
  }
}
