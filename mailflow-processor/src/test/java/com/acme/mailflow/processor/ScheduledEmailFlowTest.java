package com.acme.mailflow.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.domain.ScheduledEmail;
import com.acme.mailflow.domain.ScheduledEmailStatus;
import com.acme.mailflow.processor.poller.ScheduledEmailPoller;
import com.acme.mailflow.processor.queue.QueueRegistry;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.processor.support.ReplyThreading;
import com.acme.mailflow.processor.worker.ScheduledEmailWorker;
import com.acme.mailflow.queue.InMemoryJobStore;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.queue.QueueWorker;
import com.acme.mailflow.queue.StoreBackedQueueFactory;
import com.acme.mailflow.repository.ScheduledEmailRepository;
import com.acme.mailflow.spi.JobState;
import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.MailboxClient;
import com.acme.mailflow.spi.SentMail;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Poller, in-process broker and worker wired together without a container. */
@ExtendWith(MockitoExtension.class)
@DisplayName("Scheduled email flow")
class ScheduledEmailFlowTest {

  @Mock private ScheduledEmailRepository emails;
  @Mock private MailSender sender;
  @Mock private MailboxClient mailbox;

  private final Clock clock = Clock.systemUTC();
  private InMemoryJobStore store;
  private StoreBackedQueueFactory factory;
  private CollaboratorInvoker invoker;

  @BeforeEach
  void setup() {
    QueueConfig config = new QueueConfig();
    config.setBroker(QueueConfig.BROKER_MEMORY);
    config.setPollInterval(Duration.ofMillis(10));
    config.setBackoffDelay(Duration.ofMillis(20));
    store = new InMemoryJobStore();
    factory = new StoreBackedQueueFactory(store, config, new TimeoutConfig(), clock);
    invoker = new CollaboratorInvoker(new TimeoutConfig());
  }

  @AfterEach
  void teardown() {
    factory.close();
    invoker.shutdown();
  }

  @Test
  @DisplayName("should send a due email exactly once across repeated polls")
  void testDueEmailSentOnce() throws Exception {
    // Given
    ScheduledEmail email =
        new ScheduledEmail(
            "se-1", "u1", "ada@example.com", List.of(), List.of(), "Hello", "Body", null,
            ScheduledEmailStatus.PENDING, Instant.now().minusSeconds(1), null, null, null);
    when(emails.findDue(any(), anyInt())).thenReturn(List.of(email));
    ScheduledEmail sent =
        new ScheduledEmail(
            "se-1", "u1", "ada@example.com", List.of(), List.of(), "Hello", "Body", null,
            ScheduledEmailStatus.SENT, email.scheduledAt(), Instant.now(), null, null);
    when(emails.findById("se-1")).thenReturn(Optional.of(email), Optional.of(sent));
    when(sender.send(any())).thenReturn(new SentMail("msg-1", "t-1"));
    when(emails.markSent(eq("se-1"), any())).thenReturn(true);

    QueueRegistry registry = new QueueRegistry(factory);
    ScheduledEmailPoller poller =
        new ScheduledEmailPoller(emails, registry, new PollerConfig(), new QueueConfig(), clock);
    ScheduledEmailWorker worker =
        new ScheduledEmailWorker(emails, sender, new ReplyThreading(mailbox, invoker), invoker, clock);
    Optional<QueueWorker> running = factory.registerWorker(QueueName.SCHEDULED_EMAIL, worker, 1);

    // When
    poller.poll();
    poller.poll();

    // Then
    assertThat(running).isPresent();
    await()
        .atMost(Duration.ofSeconds(5))
        .untilAsserted(() -> verify(emails).markSent(eq("se-1"), any()));
    await()
        .atMost(Duration.ofSeconds(5))
        .until(() -> store.find(QueueName.SCHEDULED_EMAIL, "scheduled-email-se-1").isEmpty());
    verify(sender, times(1)).send(any());
    assertThat(store.count(QueueName.SCHEDULED_EMAIL, JobState.DEAD)).isZero();
  }
}
