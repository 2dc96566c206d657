package com.acme.mailflow.config;

import java.time.Duration;

/** Promotion poller cadence and batch sizes. Pure POJO - no framework dependencies. */
public class PollerConfig {

  private boolean enabled = true;
  private int batchSize = 100;
  private Duration scheduledEmailInterval = Duration.ofMinutes(1);
  private Duration snoozeInterval = Duration.ofMinutes(1);
  private Duration calendarSyncInterval = Duration.ofMinutes(15);
  private Duration calendarSyncWindow = Duration.ofDays(7);
  private Duration outboxInterval = Duration.ofSeconds(1);
  private int outboxBatchSize = 100;
  private Duration outboxClaimTimeout = Duration.ofSeconds(30);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getScheduledEmailInterval() {
    return scheduledEmailInterval;
  }

  public void setScheduledEmailInterval(Duration scheduledEmailInterval) {
    this.scheduledEmailInterval = scheduledEmailInterval;
  }

  public Duration getSnoozeInterval() {
    return snoozeInterval;
  }

  public void setSnoozeInterval(Duration snoozeInterval) {
    this.snoozeInterval = snoozeInterval;
  }

  public Duration getCalendarSyncInterval() {
    return calendarSyncInterval;
  }

  public void setCalendarSyncInterval(Duration calendarSyncInterval) {
    this.calendarSyncInterval = calendarSyncInterval;
  }

  public Duration getCalendarSyncWindow() {
    return calendarSyncWindow;
  }

  public void setCalendarSyncWindow(Duration calendarSyncWindow) {
    this.calendarSyncWindow = calendarSyncWindow;
  }

  public Duration getOutboxInterval() {
    return outboxInterval;
  }

  public void setOutboxInterval(Duration outboxInterval) {
    this.outboxInterval = outboxInterval;
  }

  public int getOutboxBatchSize() {
    return outboxBatchSize;
  }

  public void setOutboxBatchSize(int outboxBatchSize) {
    this.outboxBatchSize = outboxBatchSize;
  }

  public Duration getOutboxClaimTimeout() {
    return outboxClaimTimeout;
  }

  public void setOutboxClaimTimeout(Duration outboxClaimTimeout) {
    this.outboxClaimTimeout = outboxClaimTimeout;
  }
}
