package com.acme.mailflow.domain;

public enum MessageLogStatus {
  PROCESSING,
  SENT,
  FAILED
}
