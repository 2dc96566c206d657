package com.acme.mailflow.queue;

import java.util.Arrays;

/** The named work queues. Names are shared with the broker keyspace and must stay stable. */
public enum QueueName {
  CAMPAIGN_DISPATCH("campaign-dispatch"),
  FOLLOW_UP_DISPATCH("follow-up-dispatch"),
  TRACKING_EVENTS("tracking-events"),
  MEETING_REMINDER_DISPATCH("meeting-reminder-dispatch"),
  CALENDAR_SYNC("calendar-sync"),
  SCHEDULED_EMAIL("scheduled-email"),
  SNOOZE_RESTORE("snooze-restore"),
  CALENDAR_CONNECTION_SETUP("calendar-connection-setup");

  private final String id;

  QueueName(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static QueueName fromId(String id) {
    return Arrays.stream(values())
        .filter(q -> q.id.equals(id))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown queue: " + id));
  }

  @Override
  public String toString() {
    return id;
  }
}
