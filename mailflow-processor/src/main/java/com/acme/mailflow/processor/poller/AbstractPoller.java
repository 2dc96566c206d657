package com.acme.mailflow.processor.poller;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A periodic promotion pass. Runs never overlap: a call made while the previous one is still in
 * flight is skipped. Failures are logged and count as zero rows so the schedule keeps going.
 */
public abstract class AbstractPoller {
  protected final Logger log = LoggerFactory.getLogger(getClass());

  private final AtomicBoolean inFlight = new AtomicBoolean();

  public abstract String name();

  public abstract Duration interval();

  /** Returns the number of rows handled. */
  protected abstract int doPoll();

  public final int poll() {
    if (!inFlight.compareAndSet(false, true)) {
      log.warn("Poller {} still running, skipping this cycle", name());
      return 0;
    }
    try {
      int handled = doPoll();
      if (handled > 0) {
        log.info("Poller {} handled {} rows", name(), handled);
      } else {
        log.debug("Poller {} found nothing to do", name());
      }
      return handled;
    } catch (RuntimeException e) {
      log.error("Poller {} failed: {}", name(), e.getMessage(), e);
      return 0;
    } finally {
      inFlight.set(false);
    }
  }
}
