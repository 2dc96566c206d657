package com.acme.mailflow.domain;

public enum OutboxStatus {
  NEW,
  CLAIMED,
  PUBLISHED
}
