package com.acme.mailflow.processor.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.domain.MeetingReminder;
import com.acme.mailflow.domain.ReminderStatus;
import com.acme.mailflow.jobs.MeetingReminderJob;
import com.acme.mailflow.processor.outbox.OutboxService;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.MeetingReminderRepository;
import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.OutgoingMail;
import com.acme.mailflow.spi.SentMail;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("MeetingReminderWorker Tests")
class MeetingReminderWorkerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Instant ACTIVATED = NOW.minus(Duration.ofDays(1));

  @Mock private MeetingReminderRepository reminders;
  @Mock private MailSender sender;
  @Mock private OutboxService outbox;

  private CollaboratorInvoker invoker;
  private MeetingReminderWorker worker;

  @BeforeEach
  void setup() {
    invoker = new CollaboratorInvoker(new TimeoutConfig());
    worker = new MeetingReminderWorker(reminders, sender, invoker, outbox, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @AfterEach
  void teardown() {
    invoker.shutdown();
  }

  private static Job<MeetingReminderJob> job(int attempt) {
    return new Job<>(
        QueueName.MEETING_REMINDER_DISPATCH, "meeting-reminder:mr-1:" + attempt,
        "meeting-reminder-dispatch", new MeetingReminderJob("mr-1", attempt), 0, 3, NOW);
  }

  private static MeetingReminder reminder(int sendCount, int maxSends, Instant nextSendAt, String bookingUrl) {
    return new MeetingReminder(
        "mr-1", "u1", "mt-1", "Intro call", "ada@example.com", "Ada <Lovelace>", bookingUrl,
        ReminderStatus.SCHEDULED, sendCount, maxSends, List.of(1440, 4320), ACTIVATED,
        nextSendAt, null, null);
  }

  private void given(MeetingReminder reminder) {
    when(reminders.findById("mr-1")).thenReturn(Optional.of(reminder));
  }

  @Nested
  @DisplayName("Guards")
  class GuardTests {

    @Test
    @DisplayName("should wait when the send is more than a minute away")
    void testTooEarly() throws Exception {
      // Given
      given(reminder(0, 2, NOW.plus(Duration.ofMinutes(5)), "https://book.example/t"));

      // When
      JobResult result = worker.process(job(1));

      // Then
      assertThat(result.isNotYetDue()).isTrue();
      assertThat(result.remaining()).isEqualTo(Duration.ofMinutes(5));
      verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("should complete the sequence once max sends is reached")
    void testMaxSends() throws Exception {
      // Given
      given(reminder(2, 2, NOW, "https://book.example/t"));

      // When
      worker.process(job(3));

      // Then
      verify(reminders).markCompleted("mr-1");
      verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("should complete the sequence once the invitee has booked")
    void testAlreadyBooked() throws Exception {
      // Given
      given(reminder(0, 2, NOW, "https://book.example/t"));
      when(reminders.hasConfirmedBooking("mt-1", "ada@example.com")).thenReturn(true);

      // When
      worker.process(job(1));

      // Then
      verify(reminders).markCompleted("mr-1");
      verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("should fail the reminder when there is no booking link")
    void testNoBookingLink() throws Exception {
      // Given
      given(reminder(0, 2, NOW, null));

      // When
      worker.process(job(1));

      // Then
      verify(reminders).markFailed("mr-1", "No booking link available for reminder dispatch", NOW);
      verifyNoInteractions(sender);
    }

    @Test
    @DisplayName("should ignore reminders that are no longer scheduled")
    void testNotScheduled() throws Exception {
      // Given
      given(
          new MeetingReminder(
              "mr-1", "u1", "mt-1", "Intro call", "ada@example.com", null, "https://book.example/t",
              ReminderStatus.COMPLETED, 2, 2, List.of(), ACTIVATED, null, NOW, null));

      // When
      worker.process(job(3));

      // Then
      verifyNoInteractions(sender);
      verify(reminders, never()).markCompleted(any());
    }
  }

  @Nested
  @DisplayName("Sending")
  class SendTests {

    @Test
    @DisplayName("should send the nudge and schedule the next one through the outbox")
    void testSendsAndSchedulesNext() throws Exception {
      // Given
      given(reminder(0, 2, NOW.plusSeconds(30), "https://book.example/t?a=1&b=2"));
      when(sender.send(any())).thenReturn(new SentMail("msg-1", "t-1"));
      Instant next = ACTIVATED.plus(Duration.ofMinutes(4320));

      // When
      worker.process(job(1));

      // Then
      ArgumentCaptor<OutgoingMail> mail = ArgumentCaptor.forClass(OutgoingMail.class);
      verify(sender).send(mail.capture());
      assertThat(mail.getValue().to()).isEqualTo("ada@example.com");
      assertThat(mail.getValue().subject()).isEqualTo("Still want to meet with Intro call?");
      assertThat(mail.getValue().html())
          .contains("<p>Hi Ada &lt;Lovelace&gt;,</p>")
          .contains("href=\"https://book.example/t?a=1&amp;b=2\"")
          .contains("Pick a time");
      verify(reminders).recordSend("mr-1", 1, NOW, next, ReminderStatus.SCHEDULED);
      verify(outbox)
          .publishAt(
              QueueName.MEETING_REMINDER_DISPATCH,
              "meeting-reminder:mr-1:2",
              new MeetingReminderJob("mr-1", 2),
              next);
    }

    @Test
    @DisplayName("should complete after the last planned send")
    void testLastSend() throws Exception {
      // Given
      given(reminder(1, 2, NOW, "https://book.example/t"));
      when(sender.send(any())).thenReturn(new SentMail("msg-2", "t-1"));

      // When
      worker.process(job(2));

      // Then
      verify(reminders).recordSend("mr-1", 2, NOW, null, ReminderStatus.COMPLETED);
      verifyNoInteractions(outbox);
    }

    @Test
    @DisplayName("should keep the reminder scheduled and rethrow when sending fails")
    void testSendFailure() throws Exception {
      // Given
      given(reminder(0, 2, NOW, "https://book.example/t"));
      when(sender.send(any())).thenThrow(new IllegalStateException("quota exceeded"));

      // When / Then
      assertThatThrownBy(() -> worker.process(job(1))).hasMessage("quota exceeded");
      verify(reminders).recordError("mr-1", "quota exceeded", NOW);
      verify(reminders, never()).markFailed(any(), any(), any());
      verify(reminders, never()).recordSend(any(), anyInt(), any(), any(), any());
    }

    @Test
    @DisplayName("should fail the reminder once retries are exhausted")
    void testExhausted() {
      // When
      worker.onExhausted(job(1), new IllegalStateException("quota exceeded"));

      // Then
      verify(reminders).markFailed("mr-1", "quota exceeded", NOW);
    }
  }

  @Nested
  @DisplayName("nextSendAt")
  class NextSendTests {

    @Test
    @DisplayName("should push a planned time that already passed three hours out")
    void testPastCandidate() {
      // Given
      MeetingReminder late =
          new MeetingReminder(
              "mr-1", "u1", "mt-1", "Intro call", "ada@example.com", null, "u",
              ReminderStatus.SCHEDULED, 0, 3, List.of(60, 120), NOW.minus(Duration.ofDays(3)),
              NOW, null, null);

      // When / Then
      assertThat(MeetingReminderWorker.nextSendAt(late, 1, NOW)).isEqualTo(NOW.plus(Duration.ofHours(3)));
    }

    @Test
    @DisplayName("should fall back to the default plan when none is stored")
    void testDefaultPlan() {
      // Given
      MeetingReminder noPlan =
          new MeetingReminder(
              "mr-1", "u1", "mt-1", "Intro call", "ada@example.com", null, "u",
              ReminderStatus.SCHEDULED, 0, 5, List.of(), NOW, NOW, null, null);

      // When / Then
      assertThat(MeetingReminderWorker.nextSendAt(noPlan, 1, NOW))
          .isEqualTo(NOW.plus(Duration.ofMinutes(4320)));
      assertThat(MeetingReminderWorker.nextSendAt(noPlan, 2, NOW)).isNull();
    }
  }

  @Nested
  @DisplayName("Retries")
  class RetryTests {

    @Test
    @DisplayName("should send on the retry after a failed attempt")
    void testRetryAfterFailure() throws Exception {
      // Given
      InMemoryReminders store = new InMemoryReminders(reminder(0, 2, NOW, "https://book.example/t"));
      MeetingReminderWorker retrying =
          new MeetingReminderWorker(store, sender, invoker, outbox, Clock.fixed(NOW, ZoneOffset.UTC));
      when(sender.send(any()))
          .thenThrow(new IllegalStateException("connection reset"))
          .thenReturn(new SentMail("msg-1", "t-1"));

      // When
      assertThatThrownBy(() -> retrying.process(job(1))).hasMessage("connection reset");
      assertThat(store.reminder.status()).isEqualTo(ReminderStatus.SCHEDULED);
      assertThat(store.reminder.lastError()).isEqualTo("connection reset");
      retrying.process(job(1));

      // Then
      verify(sender, times(2)).send(any());
      assertThat(store.reminder.sendCount()).isEqualTo(1);
      assertThat(store.reminder.status()).isEqualTo(ReminderStatus.SCHEDULED);
    }
  }

  /** Single-row repository that keeps state across attempts. */
  private static final class InMemoryReminders implements MeetingReminderRepository {
    private MeetingReminder reminder;

    InMemoryReminders(MeetingReminder reminder) {
      this.reminder = reminder;
    }

    @Override
    public Optional<MeetingReminder> findById(String id) {
      return Optional.ofNullable(reminder).filter(r -> r.id().equals(id));
    }

    @Override
    public boolean hasConfirmedBooking(String meetingTypeId, String inviteeEmail) {
      return false;
    }

    @Override
    public void markCompleted(String id) {
      reminder = with(ReminderStatus.COMPLETED, reminder.sendCount(), null, reminder.lastSentAt(), reminder.lastError());
    }

    @Override
    public void markFailed(String id, String error, Instant at) {
      reminder = with(ReminderStatus.FAILED, reminder.sendCount(), null, reminder.lastSentAt(), error);
    }

    @Override
    public void recordError(String id, String error, Instant at) {
      reminder = with(reminder.status(), reminder.sendCount(), reminder.nextSendAt(), reminder.lastSentAt(), error);
    }

    @Override
    public void recordSend(String id, int sendCount, Instant sentAt, Instant nextSendAt, ReminderStatus status) {
      reminder = with(status, sendCount, nextSendAt, sentAt, reminder.lastError());
    }

    private MeetingReminder with(
        ReminderStatus status, int sendCount, Instant nextSendAt, Instant lastSentAt, String lastError) {
      MeetingReminder r = reminder;
      return new MeetingReminder(
          r.id(), r.userId(), r.meetingTypeId(), r.meetingName(), r.inviteeEmail(), r.inviteeName(),
          r.bookingUrl(), status, sendCount, r.maxSends(), r.schedulePlanMinutes(), r.activationAt(),
          nextSendAt, lastSentAt, lastError);
    }
  }
}
