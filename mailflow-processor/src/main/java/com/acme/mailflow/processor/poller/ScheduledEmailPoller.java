package com.acme.mailflow.processor.poller;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.domain.ScheduledEmail;
import com.acme.mailflow.jobs.ScheduledEmailJob;
import com.acme.mailflow.processor.queue.QueueRegistry;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.JobQueue;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.ScheduledEmailRepository;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Promotes due PENDING scheduled emails into the scheduled-email queue. */
@Singleton
public class ScheduledEmailPoller extends AbstractPoller {

  private final ScheduledEmailRepository emails;
  private final QueueRegistry queues;
  private final PollerConfig pollers;
  private final QueueConfig queueConfig;
  private final Clock clock;

  public ScheduledEmailPoller(
      ScheduledEmailRepository emails,
      QueueRegistry queues,
      PollerConfig pollers,
      QueueConfig queueConfig,
      Clock clock) {
    this.emails = emails;
    this.queues = queues;
    this.pollers = pollers;
    this.queueConfig = queueConfig;
    this.clock = clock;
  }

  @Override
  public String name() {
    return QueueName.SCHEDULED_EMAIL.id();
  }

  @Override
  public Duration interval() {
    return pollers.getScheduledEmailInterval();
  }

  @Override
  protected int doPoll() {
    List<ScheduledEmail> due = emails.findDue(clock.instant(), pollers.getBatchSize());
    JobQueue<ScheduledEmailJob> queue = queues.queue(QueueName.SCHEDULED_EMAIL, ScheduledEmailJob.class);
    for (ScheduledEmail email : due) {
      String jobId = "scheduled-email-" + email.id();
      try {
        queue.enqueue(
            jobId,
            new ScheduledEmailJob(email.id(), email.userId()),
            JobOptions.withJobId(jobId)
                .attempts(queueConfig.getDefaultAttempts())
                .backoff(queueConfig.defaultBackoff()));
      } catch (RuntimeException e) {
        log.error("Failed to queue scheduled email {}: {}", email.id(), e.getMessage());
      }
    }
    return due.size();
  }
}
