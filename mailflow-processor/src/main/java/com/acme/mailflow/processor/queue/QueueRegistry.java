package com.acme.mailflow.processor.queue;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.jobs.CalendarConnectionSetupJob;
import com.acme.mailflow.jobs.CalendarSyncJob;
import com.acme.mailflow.jobs.CampaignDispatchJob;
import com.acme.mailflow.jobs.FollowUpDispatchJob;
import com.acme.mailflow.jobs.MeetingReminderJob;
import com.acme.mailflow.jobs.ScheduledEmailJob;
import com.acme.mailflow.jobs.SnoozeRestoreJob;
import com.acme.mailflow.jobs.TrackingEventJob;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.JobQueue;
import com.acme.mailflow.queue.QueueFactory;
import com.acme.mailflow.queue.QueueName;
import jakarta.inject.Singleton;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Producer handles for the named queues, each bound to its payload type. */
@Singleton
public class QueueRegistry {

  private static final Map<QueueName, Class<?>> PAYLOAD_TYPES = new EnumMap<>(QueueName.class);

  static {
    PAYLOAD_TYPES.put(QueueName.CAMPAIGN_DISPATCH, CampaignDispatchJob.class);
    PAYLOAD_TYPES.put(QueueName.FOLLOW_UP_DISPATCH, FollowUpDispatchJob.class);
    PAYLOAD_TYPES.put(QueueName.TRACKING_EVENTS, TrackingEventJob.class);
    PAYLOAD_TYPES.put(QueueName.MEETING_REMINDER_DISPATCH, MeetingReminderJob.class);
    PAYLOAD_TYPES.put(QueueName.CALENDAR_SYNC, CalendarSyncJob.class);
    PAYLOAD_TYPES.put(QueueName.SCHEDULED_EMAIL, ScheduledEmailJob.class);
    PAYLOAD_TYPES.put(QueueName.SNOOZE_RESTORE, SnoozeRestoreJob.class);
    PAYLOAD_TYPES.put(QueueName.CALENDAR_CONNECTION_SETUP, CalendarConnectionSetupJob.class);
  }

  private final QueueFactory factory;
  private final Map<QueueName, JobQueue<?>> queues = new ConcurrentHashMap<>();

  public QueueRegistry(QueueFactory factory) {
    this.factory = factory;
  }

  public static Class<?> payloadType(QueueName name) {
    return PAYLOAD_TYPES.get(name);
  }

  @SuppressWarnings("unchecked")
  public <T> JobQueue<T> queue(QueueName name, Class<T> payloadType) {
    if (!payloadType.equals(PAYLOAD_TYPES.get(name))) {
      throw new IllegalArgumentException(
          "Queue " + name + " carries " + PAYLOAD_TYPES.get(name).getSimpleName()
              + ", not " + payloadType.getSimpleName());
    }
    return (JobQueue<T>) queues.computeIfAbsent(name, n -> factory.createQueue(n, payloadType));
  }

  /** Enqueues a payload kept as JSON, e.g. by the outbox. */
  public boolean enqueueJson(QueueName name, String jobName, String payloadJson, JobOptions options) {
    return enqueueTyped(name, PAYLOAD_TYPES.get(name), jobName, payloadJson, options);
  }

  public boolean isDegraded() {
    return factory.isDegraded();
  }

  private <T> boolean enqueueTyped(
      QueueName name, Class<T> type, String jobName, String payloadJson, JobOptions options) {
    T payload = Jsons.fromJson(payloadJson, type);
    return queue(name, type).enqueue(jobName, payload, options);
  }
}
