package com.acme.mailflow.spi;

import com.acme.mailflow.queue.QueueName;
import java.time.Instant;
import java.util.Optional;

/**
 * Storage primitives a broker must offer for the queue runtime. Implementations must make {@link
 * #add} and {@link #claimNext} atomic across processes.
 */
public interface JobStore extends AutoCloseable {

  /**
   * Stores a job that becomes runnable at {@code runAt}. Returns false when the job id is already
   * known in any state.
   */
  boolean add(StoredJob job, Instant runAt);

  /** Takes the oldest runnable job and leases it until {@code leaseUntil}. */
  Optional<StoredJob> claimNext(QueueName queue, Instant now, Instant leaseUntil);

  /** Removes a successfully processed job. */
  void complete(QueueName queue, String jobId);

  /** Puts an active job back to waiting, runnable at {@code runAt}. */
  void release(StoredJob job, Instant runAt);

  /** Moves an active job to the dead set. Its id stays reserved. */
  void markDead(StoredJob job);

  /**
   * Handles jobs whose lease expired: each counts one failed attempt and goes back to waiting, or
   * to the dead set when no attempts are left.
   */
  StallRecovery recoverStalled(QueueName queue, Instant now);

  /** Takes one permit from the queue-wide token bucket. */
  boolean tryAcquireRate(QueueName queue, long permitsPerSecond);

  Optional<StoredJob> find(QueueName queue, String jobId);

  long count(QueueName queue, JobState state);

  @Override
  void close();
}
