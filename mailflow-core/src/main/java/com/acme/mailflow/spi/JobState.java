package com.acme.mailflow.spi;

public enum JobState {
  /** Ready or delayed, waiting for a worker. */
  WAITING,
  ACTIVE,
  /** Used up its attempts or failed permanently; kept for inspection. */
  DEAD
}
