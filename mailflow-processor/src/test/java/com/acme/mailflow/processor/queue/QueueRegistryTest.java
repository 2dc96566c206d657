package com.acme.mailflow.processor.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.jobs.CampaignDispatchJob;
import com.acme.mailflow.jobs.ScheduledEmailJob;
import com.acme.mailflow.queue.InMemoryJobStore;
import com.acme.mailflow.queue.JobOptions;
import com.acme.mailflow.queue.NullQueueFactory;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.queue.StoreBackedQueueFactory;
import java.time.Clock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueueRegistry Tests")
class QueueRegistryTest {

  private StoreBackedQueueFactory factory;
  private QueueRegistry registry;

  @BeforeEach
  void setup() {
    factory =
        new StoreBackedQueueFactory(
            new InMemoryJobStore(), new QueueConfig(), new TimeoutConfig(), Clock.systemUTC());
    registry = new QueueRegistry(factory);
  }

  @AfterEach
  void teardown() {
    factory.close();
  }

  @Test
  @DisplayName("should know a payload type for every queue")
  void testPayloadTypes() {
    for (QueueName name : QueueName.values()) {
      assertThat(QueueRegistry.payloadType(name)).as(name.id()).isNotNull();
    }
    assertThat(QueueRegistry.payloadType(QueueName.CAMPAIGN_DISPATCH))
        .isEqualTo(CampaignDispatchJob.class);
  }

  @Test
  @DisplayName("should return the same queue handle on repeated lookups")
  void testQueueCached() {
    assertThat(registry.queue(QueueName.SCHEDULED_EMAIL, ScheduledEmailJob.class))
        .isSameAs(registry.queue(QueueName.SCHEDULED_EMAIL, ScheduledEmailJob.class));
  }

  @Test
  @DisplayName("should reject a payload type the queue does not carry")
  void testWrongPayloadType() {
    assertThatThrownBy(() -> registry.queue(QueueName.SCHEDULED_EMAIL, CampaignDispatchJob.class))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ScheduledEmailJob");
  }

  @Test
  @DisplayName("should enqueue JSON payloads once per job id")
  void testEnqueueJsonDeduplicates() {
    // Given
    String json = "{\"scheduledEmailId\":\"se-1\",\"userId\":\"u1\"}";

    // When
    boolean first =
        registry.enqueueJson(
            QueueName.SCHEDULED_EMAIL, "scheduled-email-se-1", json, JobOptions.withJobId("scheduled-email-se-1"));
    boolean second =
        registry.enqueueJson(
            QueueName.SCHEDULED_EMAIL, "scheduled-email-se-1", json, JobOptions.withJobId("scheduled-email-se-1"));

    // Then
    assertThat(first).isTrue();
    assertThat(second).isFalse();
  }

  @Test
  @DisplayName("should reject malformed JSON payloads")
  void testMalformedJson() {
    assertThatThrownBy(
            () ->
                registry.enqueueJson(
                    QueueName.SCHEDULED_EMAIL, "x", "{not json", JobOptions.withJobId("x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should report degraded mode from the factory")
  void testDegraded() {
    assertThat(registry.isDegraded()).isFalse();
    assertThat(new QueueRegistry(new NullQueueFactory()).isDegraded()).isTrue();
  }
}
