package com.acme.mailflow.domain;

public enum ReminderStatus {
  SCHEDULED,
  COMPLETED,
  FAILED
}
