package com.acme.mailflow.domain;

public enum CampaignStatus {
  DRAFT,
  SCHEDULED,
  RUNNING,
  PAUSED,
  COMPLETED,
  CANCELLED;

  public boolean isHalted() {
    return this == PAUSED || this == CANCELLED || this == COMPLETED;
  }
}
