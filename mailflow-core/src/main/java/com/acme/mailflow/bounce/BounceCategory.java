package com.acme.mailflow.bounce;

public enum BounceCategory {
  INVALID_EMAIL,
  MAILBOX_FULL,
  MESSAGE_TOO_LARGE,
  CONTENT_REJECTED,
  BLOCKED,
  OTHER
}
