package com.acme.mailflow.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a processor run that did not throw.
 *
 * <p>{@link #notYetDue(Duration)} asks the queue to run the same job again once the remaining time
 * has passed, without consuming an attempt.
 */
public final class JobResult {

  private static final JobResult COMPLETED = new JobResult(false, Duration.ZERO);

  private final boolean notYetDue;
  private final Duration remaining;

  private JobResult(boolean notYetDue, Duration remaining) {
    this.notYetDue = notYetDue;
    this.remaining = remaining;
  }

  public static JobResult completed() {
    return COMPLETED;
  }

  public static JobResult notYetDue(Duration remaining) {
    Objects.requireNonNull(remaining, "remaining");
    return new JobResult(true, remaining.isNegative() ? Duration.ZERO : remaining);
  }

  public boolean isNotYetDue() {
    return notYetDue;
  }

  public Duration remaining() {
    return remaining;
  }

  @Override
  public String toString() {
    return notYetDue ? "NotYetDue[" + remaining + "]" : "Completed";
  }
}
