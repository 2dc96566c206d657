package com.acme.mailflow.queue;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Degraded-mode factory: queues drop jobs, no worker is started. */
public class NullQueueFactory implements QueueFactory {
  private static final Logger LOG = LoggerFactory.getLogger(NullQueueFactory.class);

  @Override
  public <T> JobQueue<T> createQueue(QueueName name, Class<T> payloadType) {
    return new NullJobQueue<>(name);
  }

  @Override
  public <T> Optional<QueueWorker> registerWorker(
      QueueName name, JobProcessor<T> processor, int concurrency) {
    LOG.warn("Broker unavailable, worker for queue={} not started", name);
    return Optional.empty();
  }

  @Override
  public boolean isDegraded() {
    return true;
  }

  @Override
  public void close() {
    // nothing to release
  }
}
