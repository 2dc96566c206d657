package com.acme.mailflow.processor.queue;

import com.acme.mailflow.queue.JobProcessor;
import com.acme.mailflow.queue.QueueName;

/** A job processor bound to the queue it consumes. Every bean of this type gets a worker. */
public interface QueueJobHandler<T> extends JobProcessor<T> {

  QueueName queue();
}
