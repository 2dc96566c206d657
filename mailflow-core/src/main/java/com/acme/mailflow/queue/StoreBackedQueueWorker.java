package com.acme.mailflow.queue;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.core.TransientException;
import com.acme.mailflow.spi.JobStore;
import com.acme.mailflow.spi.StallRecovery;
import com.acme.mailflow.spi.StoredJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls jobs of one queue from a {@link JobStore} and runs them on a bounded pool.
 *
 * <p>A single dispatcher thread claims jobs only when a slot is free and the queue-wide token
 * bucket grants a permit. Failed jobs are released with backoff until their attempts run out.
 */
class StoreBackedQueueWorker<T> implements QueueWorker {
  private static final Logger LOG = LoggerFactory.getLogger(StoreBackedQueueWorker.class);
  private static final Duration MAX_STALL_CHECK = Duration.ofSeconds(30);

  private final QueueName queue;
  private final JobStore store;
  private final JobProcessor<T> processor;
  private final int concurrency;
  private final long permitsPerSecond;
  private final Duration pollInterval;
  private final Duration lease;
  private final Clock clock;

  private final Semaphore slots;
  private final ExecutorService pool;
  private final Thread dispatcher;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicInteger active = new AtomicInteger();
  private Instant nextStallCheck = Instant.MIN;

  StoreBackedQueueWorker(
      QueueName queue,
      JobStore store,
      JobProcessor<T> processor,
      int concurrency,
      long permitsPerSecond,
      Duration pollInterval,
      Duration lease,
      Clock clock) {
    this.queue = queue;
    this.store = store;
    this.processor = processor;
    this.concurrency = concurrency;
    this.permitsPerSecond = permitsPerSecond;
    this.pollInterval = pollInterval;
    this.lease = lease;
    this.clock = clock;
    this.slots = new Semaphore(concurrency);
    AtomicInteger threadNo = new AtomicInteger();
    this.pool =
        Executors.newFixedThreadPool(
            concurrency,
            r -> {
              Thread t = new Thread(r, queue.id() + "-worker-" + threadNo.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    this.dispatcher = new Thread(this::dispatchLoop, queue.id() + "-dispatcher");
    this.dispatcher.setDaemon(true);
  }

  void start() {
    if (running.compareAndSet(false, true)) {
      dispatcher.start();
      LOG.info(
          "Worker started queue={} concurrency={} rate={}/s", queue, concurrency, permitsPerSecond);
    }
  }

  @Override
  public QueueName queue() {
    return queue;
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public int activeJobs() {
    return active.get();
  }

  private void dispatchLoop() {
    while (running.get()) {
      try {
        recoverStalledIfDue();
        if (!slots.tryAcquire(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
          continue;
        }
        Optional<StoredJob> claimed = Optional.empty();
        try {
          if (store.tryAcquireRate(queue, permitsPerSecond)) {
            Instant now = clock.instant();
            claimed = store.claimNext(queue, now, now.plus(lease));
          }
        } finally {
          if (claimed.isEmpty()) {
            slots.release();
          }
        }
        if (claimed.isEmpty()) {
          Thread.sleep(pollInterval.toMillis());
          continue;
        }
        submit(claimed.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        if (!running.get()) {
          break;
        }
        LOG.error("Dispatcher error queue={}: {}", queue, e.getMessage(), e);
        pause();
      }
    }
    LOG.debug("Dispatcher stopped queue={}", queue);
  }

  private void submit(StoredJob job) {
    try {
      pool.execute(
          () -> {
            active.incrementAndGet();
            try {
              run(job);
            } finally {
              active.decrementAndGet();
              slots.release();
            }
          });
    } catch (RejectedExecutionException e) {
      // Shutting down: the lease expires and another worker recovers the job.
      slots.release();
      LOG.warn("Worker closing, left job for stall recovery queue={} jobId={}", queue, job.jobId());
    }
  }

  private void run(StoredJob stored) {
    Job<T> job;
    try {
      job =
          new Job<>(
              queue,
              stored.jobId(),
              stored.name(),
              Jsons.fromJson(stored.payload(), processor.payloadType()),
              stored.attemptsMade(),
              stored.maxAttempts(),
              stored.enqueuedAt());
    } catch (IllegalArgumentException e) {
      LOG.error(
          "Unreadable job payload queue={} jobId={} payload={}: {}",
          queue,
          stored.jobId(),
          stored.payload(),
          e.getMessage());
      store.markDead(stored.withFailure(stored.attemptsMade() + 1, e.getMessage()));
      return;
    }

    try {
      JobResult result = processor.process(job);
      if (result.isNotYetDue()) {
        Instant runAt = clock.instant().plus(result.remaining());
        LOG.warn(
            "Job ran before it was due, rescheduled queue={} jobId={} runAt={}",
            queue,
            stored.jobId(),
            runAt);
        store.release(stored, runAt);
        return;
      }
      store.complete(queue, stored.jobId());
      LOG.info("Job completed queue={} jobId={}", queue, stored.jobId());
    } catch (Exception e) {
      onFailure(stored, job, e);
    }
  }

  private void onFailure(StoredJob stored, Job<T> job, Exception e) {
    int attemptsMade = stored.attemptsMade() + 1;
    String error = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
    StoredJob failed = stored.withFailure(attemptsMade, error);
    boolean terminal =
        e instanceof PermanentException
            || e instanceof IllegalArgumentException
            || attemptsMade >= stored.maxAttempts();

    if (!terminal) {
      Duration backoff = stored.backoff().delayFor(attemptsMade);
      store.release(failed, clock.instant().plus(backoff));
      LOG.warn(
          "Job failed queue={} jobId={} attempt={}/{} retryIn={}: {}",
          queue,
          stored.jobId(),
          attemptsMade,
          stored.maxAttempts(),
          backoff,
          error);
      return;
    }

    store.markDead(failed);
    LOG.error(
        "Job failed permanently queue={} jobId={} attempts={}/{}: {}",
        queue,
        stored.jobId(),
        attemptsMade,
        stored.maxAttempts(),
        error,
        e);
    runExhaustionHook(job, e);
  }

  private void exhaustStalled(StoredJob stored) {
    Job<T> job;
    try {
      job =
          new Job<>(
              queue,
              stored.jobId(),
              stored.name(),
              Jsons.fromJson(stored.payload(), processor.payloadType()),
              stored.attemptsMade(),
              stored.maxAttempts(),
              stored.enqueuedAt());
    } catch (IllegalArgumentException e) {
      LOG.error("Unreadable stalled job payload queue={} jobId={}: {}", queue, stored.jobId(), e.getMessage());
      return;
    }
    runExhaustionHook(job, new TransientException(stored.lastError()));
  }

  private void runExhaustionHook(Job<T> job, Exception error) {
    try {
      processor.onExhausted(job, error);
    } catch (Exception hookError) {
      LOG.error(
          "Exhaustion handler failed queue={} jobId={}: {}",
          queue,
          job.jobId(),
          hookError.getMessage(),
          hookError);
    }
  }

  private void recoverStalledIfDue() {
    Instant now = clock.instant();
    if (now.isBefore(nextStallCheck)) {
      return;
    }
    StallRecovery recovery = store.recoverStalled(queue, now);
    if (recovery.requeued() > 0) {
      LOG.info("Recovered {} stalled jobs queue={}", recovery.requeued(), queue);
    }
    for (StoredJob dead : recovery.exhausted()) {
      LOG.error(
          "Stalled job used up its attempts queue={} jobId={} attempts={}/{}",
          queue,
          dead.jobId(),
          dead.attemptsMade(),
          dead.maxAttempts());
      exhaustStalled(dead);
    }
    Duration every = lease.compareTo(MAX_STALL_CHECK) < 0 ? lease : MAX_STALL_CHECK;
    nextStallCheck = now.plus(every);
  }

  private void pause() {
    try {
      Thread.sleep(pollInterval.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close(Duration grace) {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    LOG.info("Closing worker queue={} activeJobs={}", queue, active.get());
    dispatcher.interrupt();
    pool.shutdown();
    try {
      if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Worker did not drain within {} queue={}, interrupting", grace, queue);
        pool.shutdownNow();
      }
      dispatcher.join(Math.max(1, pollInterval.toMillis() * 2));
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
