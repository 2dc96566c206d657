package com.acme.mailflow.processor.poller;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.jobs.CalendarSyncJob;
import com.acme.mailflow.processor.queue.QueueRegistry;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.JobQueue;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CalendarConnectionRepository;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Queues a busy-block sync for every connected calendar whose cadence has elapsed. Connections
 * without a positive cadence are synced manually only.
 */
@Singleton
public class CalendarSyncPoller extends AbstractPoller {

  private final CalendarConnectionRepository connections;
  private final QueueRegistry queues;
  private final PollerConfig pollers;
  private final QueueConfig queueConfig;
  private final Clock clock;

  public CalendarSyncPoller(
      CalendarConnectionRepository connections,
      QueueRegistry queues,
      PollerConfig pollers,
      QueueConfig queueConfig,
      Clock clock) {
    this.connections = connections;
    this.queues = queues;
    this.pollers = pollers;
    this.queueConfig = queueConfig;
    this.clock = clock;
  }

  @Override
  public String name() {
    return QueueName.CALENDAR_SYNC.id();
  }

  @Override
  public Duration interval() {
    return pollers.getCalendarSyncInterval();
  }

  @Override
  protected int doPoll() {
    Instant now = clock.instant();
    JobQueue<CalendarSyncJob> queue = queues.queue(QueueName.CALENDAR_SYNC, CalendarSyncJob.class);
    int queued = 0;
    for (CalendarConnection connection : connections.findWithCredentials()) {
      if (!isDue(connection, now)) {
        continue;
      }
      String jobId = jobId(connection, now);
      try {
        queue.enqueue(
            "sync-calendar",
            new CalendarSyncJob(
                connection.userId(),
                connection.id(),
                now,
                now.plus(pollers.getCalendarSyncWindow()),
                connection.calendars() == null || connection.calendars().isEmpty()
                    ? null
                    : connection.calendars()),
            JobOptions.withJobId(jobId)
                .attempts(queueConfig.getDefaultAttempts())
                .backoff(queueConfig.defaultBackoff()));
        queued++;
      } catch (RuntimeException e) {
        log.error("Failed to queue calendar sync for connection {}: {}", connection.id(), e.getMessage());
      }
    }
    return queued;
  }

  static boolean isDue(CalendarConnection connection, Instant now) {
    Integer cadence = connection.cadenceMinutes();
    if (cadence == null || cadence <= 0) {
      return false;
    }
    Instant last = connection.lastSyncedAt();
    return last == null || Duration.between(last, now).compareTo(Duration.ofMinutes(cadence)) >= 0;
  }

  /** One id per connection and cadence window, so a slow sync is not queued twice. */
  static String jobId(CalendarConnection connection, Instant now) {
    long windowMillis = Duration.ofMinutes(connection.cadenceMinutes()).toMillis();
    long windowStart = now.toEpochMilli() / windowMillis * windowMillis;
    return "calendar-sync-" + connection.id() + "-" + windowStart;
  }
}
