package com.acme.mailflow.queue;

import com.acme.mailflow.spi.JobState;
import com.acme.mailflow.spi.JobStore;
import com.acme.mailflow.spi.StallRecovery;
import com.acme.mailflow.spi.StoredJob;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-process job store for local development and tests. Jobs do not survive a restart.
 */
public class InMemoryJobStore implements JobStore {

  private static final class Lane {
    final Map<String, StoredJob> jobs = new LinkedHashMap<>();
    final Map<String, Instant> waiting = new LinkedHashMap<>();
    final Map<String, Instant> active = new LinkedHashMap<>();
    final Map<String, StoredJob> dead = new LinkedHashMap<>();
    TokenBucket bucket;
  }

  static final String STALLED_ERROR = "Job lease expired before it finished";

  private final Map<QueueName, Lane> lanes = new EnumMap<>(QueueName.class);

  private Lane lane(QueueName queue) {
    return lanes.computeIfAbsent(queue, q -> new Lane());
  }

  @Override
  public synchronized boolean add(StoredJob job, Instant runAt) {
    Lane lane = lane(job.queue());
    if (lane.jobs.containsKey(job.jobId())) {
      return false;
    }
    lane.jobs.put(job.jobId(), job);
    lane.waiting.put(job.jobId(), runAt);
    return true;
  }

  @Override
  public synchronized Optional<StoredJob> claimNext(
      QueueName queue, Instant now, Instant leaseUntil) {
    Lane lane = lane(queue);
    String next = null;
    Instant earliest = null;
    for (var entry : lane.waiting.entrySet()) {
      Instant runAt = entry.getValue();
      if (!runAt.isAfter(now) && (earliest == null || runAt.isBefore(earliest))) {
        next = entry.getKey();
        earliest = runAt;
      }
    }
    if (next == null) {
      return Optional.empty();
    }
    lane.waiting.remove(next);
    lane.active.put(next, leaseUntil);
    return Optional.of(lane.jobs.get(next));
  }

  @Override
  public synchronized void complete(QueueName queue, String jobId) {
    Lane lane = lane(queue);
    lane.active.remove(jobId);
    lane.waiting.remove(jobId);
    lane.jobs.remove(jobId);
  }

  @Override
  public synchronized void release(StoredJob job, Instant runAt) {
    Lane lane = lane(job.queue());
    lane.active.remove(job.jobId());
    lane.jobs.put(job.jobId(), job);
    lane.waiting.put(job.jobId(), runAt);
  }

  @Override
  public synchronized void markDead(StoredJob job) {
    Lane lane = lane(job.queue());
    lane.active.remove(job.jobId());
    lane.waiting.remove(job.jobId());
    lane.jobs.put(job.jobId(), job);
    lane.dead.put(job.jobId(), job);
  }

  @Override
  public synchronized StallRecovery recoverStalled(QueueName queue, Instant now) {
    Lane lane = lane(queue);
    List<String> expired = new ArrayList<>();
    lane.active.forEach(
        (id, leaseUntil) -> {
          if (leaseUntil.isBefore(now)) {
            expired.add(id);
          }
        });
    int requeued = 0;
    List<StoredJob> exhausted = new ArrayList<>();
    for (String id : expired) {
      lane.active.remove(id);
      StoredJob job = lane.jobs.get(id);
      StoredJob stalled = job.withFailure(job.attemptsMade() + 1, STALLED_ERROR);
      lane.jobs.put(id, stalled);
      if (stalled.attemptsMade() >= stalled.maxAttempts()) {
        lane.dead.put(id, stalled);
        exhausted.add(stalled);
      } else {
        lane.waiting.put(id, now);
        requeued++;
      }
    }
    return new StallRecovery(requeued, exhausted);
  }

  @Override
  public synchronized boolean tryAcquireRate(QueueName queue, long permitsPerSecond) {
    Lane lane = lane(queue);
    if (lane.bucket == null || lane.bucket.capacity() != Math.max(1, permitsPerSecond)) {
      lane.bucket = new TokenBucket(permitsPerSecond);
    }
    return lane.bucket.tryAcquire();
  }

  @Override
  public synchronized Optional<StoredJob> find(QueueName queue, String jobId) {
    return Optional.ofNullable(lane(queue).jobs.get(jobId));
  }

  @Override
  public synchronized long count(QueueName queue, JobState state) {
    Lane lane = lane(queue);
    return switch (state) {
      case WAITING -> lane.waiting.size();
      case ACTIVE -> lane.active.size();
      case DEAD -> lane.dead.size();
    };
  }

  @Override
  public synchronized void close() {
    lanes.clear();
  }
}
