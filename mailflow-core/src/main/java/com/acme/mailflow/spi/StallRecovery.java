package com.acme.mailflow.spi;

import java.util.List;

/**
 * Outcome of one stalled-job pass. An expired lease counts as a failed attempt, so a job that keeps
 * killing its worker ends in {@code exhausted} once its attempts run out.
 */
public record StallRecovery(int requeued, List<StoredJob> exhausted) {

  public static StallRecovery none() {
    return new StallRecovery(0, List.of());
  }

  public boolean isEmpty() {
    return requeued == 0 && exhausted.isEmpty();
  }
}
