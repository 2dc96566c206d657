package com.acme.mailflow.queue;

import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.spi.JobStore;
import com.acme.mailflow.spi.StoredJob;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class StoreBackedJobQueue<T> implements JobQueue<T> {
  private static final Logger LOG = LoggerFactory.getLogger(StoreBackedJobQueue.class);

  private final QueueName name;
  private final JobStore store;
  private final QueueConfig config;
  private final Clock clock;

  StoreBackedJobQueue(QueueName name, JobStore store, QueueConfig config, Clock clock) {
    this.name = name;
    this.store = store;
    this.config = config;
    this.clock = clock;
  }

  @Override
  public QueueName name() {
    return name;
  }

  @Override
  public boolean enqueue(String jobName, T payload, JobOptions options) {
    JobOptions opts = options == null ? JobOptions.defaults() : options;
    String jobId = opts.jobId() == null ? UUID.randomUUID().toString() : opts.jobId();
    int attempts = opts.attempts() == null ? config.getDefaultAttempts() : opts.attempts();
    BackoffPolicy backoff = opts.backoff() == null ? config.defaultBackoff() : opts.backoff();

    Instant now = clock.instant();
    Instant runAt = opts.delay() == null ? now : now.plus(opts.delay());
    StoredJob job =
        new StoredJob(name, jobId, jobName, Jsons.toJson(payload), 0, attempts, backoff, now, null);

    boolean added = store.add(job, runAt);
    if (added) {
      LOG.debug("Enqueued job queue={} jobId={} runAt={}", name, jobId, runAt);
    } else {
      LOG.debug("Job already known, skipping queue={} jobId={}", name, jobId);
    }
    return added;
  }

  @Override
  public boolean isDegraded() {
    return false;
  }
}
