package com.acme.mailflow.processor.poller;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.domain.EmailSnooze;
import com.acme.mailflow.jobs.SnoozeRestoreJob;
import com.acme.mailflow.processor.queue.QueueRegistry;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.JobQueue;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.SnoozeRepository;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/** Promotes snoozes whose wake-up time has passed into the snooze-restore queue. */
@Singleton
public class SnoozeRestorePoller extends AbstractPoller {

  private final SnoozeRepository snoozes;
  private final QueueRegistry queues;
  private final PollerConfig pollers;
  private final QueueConfig queueConfig;
  private final Clock clock;

  public SnoozeRestorePoller(
      SnoozeRepository snoozes,
      QueueRegistry queues,
      PollerConfig pollers,
      QueueConfig queueConfig,
      Clock clock) {
    this.snoozes = snoozes;
    this.queues = queues;
    this.pollers = pollers;
    this.queueConfig = queueConfig;
    this.clock = clock;
  }

  @Override
  public String name() {
    return QueueName.SNOOZE_RESTORE.id();
  }

  @Override
  public Duration interval() {
    return pollers.getSnoozeInterval();
  }

  @Override
  protected int doPoll() {
    List<EmailSnooze> due = snoozes.findDue(clock.instant(), pollers.getBatchSize());
    JobQueue<SnoozeRestoreJob> queue = queues.queue(QueueName.SNOOZE_RESTORE, SnoozeRestoreJob.class);
    for (EmailSnooze snooze : due) {
      String jobId = "snooze-restore-" + snooze.id();
      try {
        queue.enqueue(
            jobId,
            new SnoozeRestoreJob(snooze.id(), snooze.messageId(), snooze.userId()),
            JobOptions.withJobId(jobId)
                .attempts(queueConfig.getDefaultAttempts())
                .backoff(queueConfig.defaultBackoff()));
      } catch (RuntimeException e) {
        log.error("Failed to queue snooze restore {}: {}", snooze.id(), e.getMessage());
      }
    }
    return due.size();
  }
}
