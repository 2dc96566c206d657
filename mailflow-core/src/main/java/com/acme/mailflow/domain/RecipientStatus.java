package com.acme.mailflow.domain;

public enum RecipientStatus {
  PENDING,
  SENT,
  FAILED,
  UNSUBSCRIBED,
  BOUNCED,
  SUPPRESSED
}
