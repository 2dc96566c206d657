package com.acme.mailflow.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Queue used when no broker is reachable: every enqueue is logged and dropped. */
public class NullJobQueue<T> implements JobQueue<T> {
  private static final Logger LOG = LoggerFactory.getLogger(NullJobQueue.class);

  private final QueueName name;

  public NullJobQueue(QueueName name) {
    this.name = name;
  }

  @Override
  public QueueName name() {
    return name;
  }

  @Override
  public boolean enqueue(String jobName, T payload, JobOptions options) {
    LOG.warn(
        "Broker unavailable, dropping job queue={} jobId={} name={}",
        name,
        options == null ? null : options.jobId(),
        jobName);
    return false;
  }

  @Override
  public boolean isDegraded() {
    return true;
  }
}
