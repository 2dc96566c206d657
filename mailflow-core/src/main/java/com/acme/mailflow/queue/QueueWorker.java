package com.acme.mailflow.queue;

import java.time.Duration;

/** Consumer side of a named queue. */
public interface QueueWorker {

  QueueName queue();

  boolean isRunning();

  int activeJobs();

  /** Stops taking jobs and waits up to {@code grace} for running jobs to finish. */
  void close(Duration grace);
}
