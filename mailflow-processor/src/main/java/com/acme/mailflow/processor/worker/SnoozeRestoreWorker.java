package com.acme.mailflow.processor.worker;

import com.acme.mailflow.domain.EmailSnooze;
import com.acme.mailflow.jobs.SnoozeRestoreJob;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.SnoozeRepository;
import com.acme.mailflow.spi.MailboxClient;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Moves a snoozed message back to the inbox with its stored labels, then forgets the snooze. */
@Singleton
public class SnoozeRestoreWorker implements QueueJobHandler<SnoozeRestoreJob> {
  private static final Logger LOG = LoggerFactory.getLogger(SnoozeRestoreWorker.class);

  static final String INBOX = "INBOX";

  private final SnoozeRepository snoozes;
  private final MailboxClient mailbox;
  private final CollaboratorInvoker invoker;
  private final Clock clock;

  public SnoozeRestoreWorker(
      SnoozeRepository snoozes, MailboxClient mailbox, CollaboratorInvoker invoker, Clock clock) {
    this.snoozes = snoozes;
    this.mailbox = mailbox;
    this.invoker = invoker;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.SNOOZE_RESTORE;
  }

  @Override
  public Class<SnoozeRestoreJob> payloadType() {
    return SnoozeRestoreJob.class;
  }

  @Override
  public JobResult process(Job<SnoozeRestoreJob> job) throws Exception {
    SnoozeRestoreJob payload = job.payload();
    if (payload.snoozeId() == null) {
      throw new IllegalArgumentException("snoozeId missing");
    }
    LOG.info("Processing snooze restore id={} messageId={}", payload.snoozeId(), payload.messageId());

    Optional<EmailSnooze> found = snoozes.findById(payload.snoozeId());
    if (found.isEmpty()) {
      LOG.warn("Snooze not found id={}, already restored", payload.snoozeId());
      return JobResult.completed();
    }
    EmailSnooze snooze = found.get();
    Instant now = clock.instant();
    if (snooze.snoozeUntil().isAfter(now)) {
      return JobResult.notYetDue(Duration.between(now, snooze.snoozeUntil()));
    }

    Set<String> labels = new LinkedHashSet<>();
    labels.add(INBOX);
    if (snooze.labelIds() != null) {
      labels.addAll(snooze.labelIds());
    }
    List<String> labelIds = new ArrayList<>(labels);
    invoker.run(
        "restore snoozed message " + snooze.messageId(),
        () -> mailbox.restoreLabels(snooze.userId(), snooze.messageId(), labelIds));

    try {
      snoozes.delete(snooze.id());
    } catch (RuntimeException e) {
      LOG.error("Failed to delete snooze id={} after restore: {}", snooze.id(), e.getMessage());
    }
    LOG.info("Snooze restored id={} messageId={}", snooze.id(), snooze.messageId());
    return JobResult.completed();
  }
}
