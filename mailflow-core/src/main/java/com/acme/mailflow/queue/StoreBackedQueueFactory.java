package com.acme.mailflow.queue;

import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.spi.JobStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Queue factory over a shared {@link JobStore}; one worker per queue name. */
public class StoreBackedQueueFactory implements QueueFactory {
  private static final Logger LOG = LoggerFactory.getLogger(StoreBackedQueueFactory.class);

  private final JobStore store;
  private final QueueConfig config;
  private final TimeoutConfig timeouts;
  private final Clock clock;
  private final Map<QueueName, JobQueue<?>> queues = new ConcurrentHashMap<>();
  private final Map<QueueName, StoreBackedQueueWorker<?>> workers = new ConcurrentHashMap<>();

  public StoreBackedQueueFactory(
      JobStore store, QueueConfig config, TimeoutConfig timeouts, Clock clock) {
    this.store = store;
    this.config = config;
    this.timeouts = timeouts;
    this.clock = clock;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> JobQueue<T> createQueue(QueueName name, Class<T> payloadType) {
    return (JobQueue<T>)
        queues.computeIfAbsent(name, n -> new StoreBackedJobQueue<T>(n, store, config, clock));
  }

  @Override
  public <T> Optional<QueueWorker> registerWorker(
      QueueName name, JobProcessor<T> processor, int concurrency) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
    }
    StoreBackedQueueWorker<T> worker =
        new StoreBackedQueueWorker<>(
            name,
            store,
            processor,
            concurrency,
            (long) concurrency * config.getJobsPerSecondPerSlot(),
            config.getPollInterval(),
            timeouts.getStalledJobLease(),
            clock);
    if (workers.putIfAbsent(name, worker) != null) {
      throw new IllegalStateException("Worker already registered for queue " + name);
    }
    worker.start();
    return Optional.of(worker);
  }

  @Override
  public boolean isDegraded() {
    return false;
  }

  @Override
  public void close() {
    workers.values().stream()
        .filter(StoreBackedQueueWorker::isRunning)
        .forEach(w -> w.close(Duration.ZERO));
    workers.clear();
    store.close();
    LOG.info("Queue factory closed");
  }
}
