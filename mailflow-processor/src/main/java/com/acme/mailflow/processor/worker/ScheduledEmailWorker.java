package com.acme.mailflow.processor.worker;

import com.acme.mailflow.domain.ReplyMetadata;
import com.acme.mailflow.domain.ScheduledEmail;
import com.acme.mailflow.domain.ScheduledEmailStatus;
import com.acme.mailflow.jobs.ScheduledEmailJob;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.processor.support.ReplyThreading;
import com.acme.mailflow.processor.support.ReplyThreading.ReplyThread;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.ScheduledEmailRepository;
import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.OutgoingMail;
import com.acme.mailflow.spi.SentMail;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends a PENDING scheduled email once it is due, optionally as a reply in an existing thread. */
@Singleton
public class ScheduledEmailWorker implements QueueJobHandler<ScheduledEmailJob> {
  private static final Logger LOG = LoggerFactory.getLogger(ScheduledEmailWorker.class);

  private final ScheduledEmailRepository emails;
  private final MailSender sender;
  private final ReplyThreading threading;
  private final CollaboratorInvoker invoker;
  private final Clock clock;

  public ScheduledEmailWorker(
      ScheduledEmailRepository emails,
      MailSender sender,
      ReplyThreading threading,
      CollaboratorInvoker invoker,
      Clock clock) {
    this.emails = emails;
    this.sender = sender;
    this.threading = threading;
    this.invoker = invoker;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.SCHEDULED_EMAIL;
  }

  @Override
  public Class<ScheduledEmailJob> payloadType() {
    return ScheduledEmailJob.class;
  }

  @Override
  public JobResult process(Job<ScheduledEmailJob> job) throws Exception {
    String id = job.payload().scheduledEmailId();
    if (id == null) {
      throw new IllegalArgumentException("scheduledEmailId missing");
    }
    LOG.info("Processing scheduled email id={} user={}", id, job.payload().userId());

    Optional<ScheduledEmail> found = emails.findById(id);
    if (found.isEmpty()) {
      LOG.warn("Scheduled email not found id={}", id);
      return JobResult.completed();
    }
    ScheduledEmail email = found.get();
    if (email.status() != ScheduledEmailStatus.PENDING) {
      LOG.info("Scheduled email already processed id={} status={}", id, email.status());
      return JobResult.completed();
    }
    Instant now = clock.instant();
    if (email.scheduledAt().isAfter(now)) {
      return JobResult.notYetDue(Duration.between(now, email.scheduledAt()));
    }

    String subject = email.subject();
    String threadId = null;
    Map<String, String> headers = Map.of();
    ReplyMetadata metadata = email.metadata() == null ? ReplyMetadata.NONE : email.metadata();
    if (metadata.sendAsReply()) {
      Optional<ReplyThread> thread =
          threading.resolve(email.userId(), metadata.replyToThreadId(), metadata.replyToMessageId());
      if (thread.isPresent()) {
        threadId = thread.get().threadId();
        headers = thread.get().headers();
        subject = ReplyThreading.replySubject(subject);
      }
    }

    OutgoingMail mail =
        new OutgoingMail(
            email.userId(),
            email.to(),
            email.cc() == null ? List.of() : email.cc(),
            email.bcc() == null ? List.of() : email.bcc(),
            subject,
            bodyHtml(email),
            headers,
            threadId);
    SentMail sent = invoker.call("send scheduled email " + id, () -> sender.send(mail));

    if (!emails.markSent(id, clock.instant())) {
      LOG.warn("Scheduled email id={} was sent but is no longer PENDING", id);
    }
    LOG.info("Scheduled email sent id={} messageId={}", id, sent.messageId());
    return JobResult.completed();
  }

  @Override
  public void onExhausted(Job<ScheduledEmailJob> job, Exception error) {
    String id = job.payload().scheduledEmailId();
    if (id != null && emails.markFailed(id, error.getMessage())) {
      LOG.info("Scheduled email id={} marked FAILED", id);
    }
  }

  static String bodyHtml(ScheduledEmail email) {
    if (email.html() != null && !email.html().isBlank()) {
      return email.html();
    }
    return email.body() == null ? "" : email.body().replace("\n", "<br>");
  }
}
