package com.acme.mailflow.processor.worker;

import com.acme.mailflow.domain.MeetingReminder;
import com.acme.mailflow.domain.ReminderStatus;
import com.acme.mailflow.jobs.MeetingReminderJob;
import com.acme.mailflow.processor.outbox.OutboxService;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.MeetingReminderRepository;
import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.OutgoingMail;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one nudge of a meeting reminder sequence and schedules the next one through the outbox.
 * The sequence stops once the invitee books or {@code maxSends} is reached. A failed send stays
 * scheduled for the queue's retries and the reminder fails only once they are used up.
 */
@Singleton
public class MeetingReminderWorker implements QueueJobHandler<MeetingReminderJob> {
  private static final Logger LOG = LoggerFactory.getLogger(MeetingReminderWorker.class);

  static final List<Integer> DEFAULT_PLAN_MINUTES = List.of(1440, 4320);
  static final Duration EARLY_TOLERANCE = Duration.ofSeconds(60);
  static final Duration FALLBACK_DELAY = Duration.ofMinutes(180);
  static final String NO_BOOKING_LINK = "No booking link available for reminder dispatch";

  private final MeetingReminderRepository reminders;
  private final MailSender sender;
  private final CollaboratorInvoker invoker;
  private final OutboxService outbox;
  private final Clock clock;

  public MeetingReminderWorker(
      MeetingReminderRepository reminders,
      MailSender sender,
      CollaboratorInvoker invoker,
      OutboxService outbox,
      Clock clock) {
    this.reminders = reminders;
    this.sender = sender;
    this.invoker = invoker;
    this.outbox = outbox;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.MEETING_REMINDER_DISPATCH;
  }

  @Override
  public Class<MeetingReminderJob> payloadType() {
    return MeetingReminderJob.class;
  }

  @Override
  public JobResult process(Job<MeetingReminderJob> job) throws Exception {
    String id = job.payload().reminderId();
    if (id == null) {
      throw new IllegalArgumentException("reminderId missing");
    }
    Optional<MeetingReminder> found = reminders.findById(id);
    if (found.isEmpty()) {
      LOG.warn("Meeting reminder not found id={}", id);
      return JobResult.completed();
    }
    MeetingReminder reminder = found.get();
    if (reminder.status() != ReminderStatus.SCHEDULED || reminder.nextSendAt() == null) {
      LOG.debug("Meeting reminder id={} not scheduled (status={})", id, reminder.status());
      return JobResult.completed();
    }

    Instant now = clock.instant();
    Duration early = Duration.between(now, reminder.nextSendAt());
    if (early.compareTo(EARLY_TOLERANCE) > 0) {
      return JobResult.notYetDue(early);
    }
    if (reminder.sendCount() >= reminder.maxSends()) {
      reminders.markCompleted(id);
      LOG.info("Meeting reminder id={} reached max sends", id);
      return JobResult.completed();
    }
    if (reminders.hasConfirmedBooking(reminder.meetingTypeId(), reminder.inviteeEmail())) {
      reminders.markCompleted(id);
      LOG.info("Meeting reminder id={} completed, invitee already booked", id);
      return JobResult.completed();
    }
    if (reminder.bookingUrl() == null || reminder.bookingUrl().isBlank()) {
      reminders.markFailed(id, NO_BOOKING_LINK, now);
      LOG.warn("Meeting reminder id={} has no booking link", id);
      return JobResult.completed();
    }

    OutgoingMail mail =
        OutgoingMail.simple(reminder.userId(), reminder.inviteeEmail(), subject(reminder), html(reminder));
    try {
      invoker.call("send meeting reminder " + id, () -> sender.send(mail));
    } catch (Exception e) {
      reminders.recordError(id, e.getMessage(), now);
      throw e;
    }

    int sent = reminder.sendCount() + 1;
    Instant next = nextSendAt(reminder, sent, clock.instant());
    reminders.recordSend(
        id, sent, now, next, next != null ? ReminderStatus.SCHEDULED : ReminderStatus.COMPLETED);
    if (next != null) {
      outbox.publishAt(
          QueueName.MEETING_REMINDER_DISPATCH,
          "meeting-reminder:" + id + ":" + (sent + 1),
          new MeetingReminderJob(id, sent + 1),
          next);
    }
    LOG.info("Meeting reminder id={} send {} delivered, next={}", id, sent, next);
    return JobResult.completed();
  }

  @Override
  public void onExhausted(Job<MeetingReminderJob> job, Exception error) {
    String id = job.payload().reminderId();
    if (id == null) {
      return;
    }
    reminders.markFailed(id, error.getMessage(), clock.instant());
    LOG.warn("Meeting reminder id={} failed after retries: {}", id, error.getMessage());
  }

  /** Null when the sequence is finished after {@code sendCount} sends. */
  static Instant nextSendAt(MeetingReminder reminder, int sendCount, Instant now) {
    List<Integer> plan =
        reminder.schedulePlanMinutes() == null || reminder.schedulePlanMinutes().isEmpty()
            ? DEFAULT_PLAN_MINUTES
            : reminder.schedulePlanMinutes();
    if (sendCount >= reminder.maxSends() || sendCount >= plan.size()) {
      return null;
    }
    Instant base = reminder.activationAt() == null ? now : reminder.activationAt();
    Instant candidate = base.plus(Duration.ofMinutes(plan.get(sendCount)));
    return candidate.isAfter(now) ? candidate : now.plus(FALLBACK_DELAY);
  }

  static String subject(MeetingReminder reminder) {
    return "Still want to meet with " + reminder.meetingName() + "?";
  }

  static String html(MeetingReminder reminder) {
    String invitee =
        reminder.inviteeName() == null || reminder.inviteeName().isBlank()
            ? reminder.inviteeEmail()
            : reminder.inviteeName();
    return "<p>Hi " + escape(invitee) + ",</p>"
        + "<p>Just a quick reminder to grab a slot for <strong>" + escape(reminder.meetingName())
        + "</strong>.</p>"
        + "<p>Fresh openings are limited right now, but you can still grab the next available time"
        + " that fits your schedule.</p>"
        + "<p><a href=\"" + escape(reminder.bookingUrl()) + "\">Pick a time</a></p>"
        + "<p>If none of these times work, reply to this email and we will coordinate something"
        + " that does.</p>";
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder out = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
