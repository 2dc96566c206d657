package com.acme.mailflow.broker.redis;

import com.acme.mailflow.queue.QueueName;

/** Key layout of a queue in Redis. All keys of one queue share the {@code mailflow:<queue>:} prefix. */
final class RedisKeys {

  private static final String PREFIX = "mailflow:";

  private RedisKeys() {}

  /** Hash of jobId to job JSON; holds every job that has not completed, dead ones included. */
  static String jobs(QueueName queue) {
    return PREFIX + queue.id() + ":jobs";
  }

  /** Sorted set of waiting job ids scored by the epoch millis they become runnable. */
  static String waiting(QueueName queue) {
    return PREFIX + queue.id() + ":waiting";
  }

  /** Sorted set of claimed job ids scored by lease expiry. */
  static String active(QueueName queue) {
    return PREFIX + queue.id() + ":active";
  }

  /** Sorted set of dead job ids scored by time of death. */
  static String dead(QueueName queue) {
    return PREFIX + queue.id() + ":dead";
  }

  static String rateLimiter(QueueName queue) {
    return PREFIX + queue.id() + ":rate";
  }
}
