package com.acme.mailflow.domain;

public enum ScheduledEmailStatus {
  PENDING,
  SENT,
  FAILED
}
