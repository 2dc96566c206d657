package com.acme.mailflow.queue;

import java.util.Optional;

/** Binds queues and workers to one shared broker connection. */
public interface QueueFactory extends AutoCloseable {

  <T> JobQueue<T> createQueue(QueueName name, Class<T> payloadType);

  /** Starts a worker; empty when the factory is degraded and no worker can run. */
  <T> Optional<QueueWorker> registerWorker(QueueName name, JobProcessor<T> processor, int concurrency);

  boolean isDegraded();

  @Override
  void close();
}
