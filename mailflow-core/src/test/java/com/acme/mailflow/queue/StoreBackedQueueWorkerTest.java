package com.acme.mailflow.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.core.TransientException;
import com.acme.mailflow.spi.JobState;
import com.acme.mailflow.spi.StoredJob;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StoreBackedQueueWorker Tests")
class StoreBackedQueueWorkerTest {

  record Ping(String value) {}

  private InMemoryJobStore store;
  private StoreBackedQueueFactory factory;
  private JobQueue<Ping> queue;

  @BeforeEach
  void setup() {
    QueueConfig config = new QueueConfig();
    config.setPollInterval(Duration.ofMillis(10));
    config.setJobsPerSecondPerSlot(1000);
    config.setBackoffDelay(Duration.ofMillis(20));
    store = new InMemoryJobStore();
    factory = new StoreBackedQueueFactory(store, config, new TimeoutConfig(), Clock.systemUTC());
    queue = factory.createQueue(QueueName.SCHEDULED_EMAIL, Ping.class);
  }

  @AfterEach
  void teardown() {
    factory.close();
  }

  private static JobProcessor<Ping> processor(ThrowingHandler handler) {
    return new JobProcessor<>() {
      @Override
      public Class<Ping> payloadType() {
        return Ping.class;
      }

      @Override
      public JobResult process(Job<Ping> job) throws Exception {
        return handler.handle(job);
      }
    };
  }

  @FunctionalInterface
  interface ThrowingHandler {
    JobResult handle(Job<Ping> job) throws Exception;
  }

  @Nested
  @DisplayName("Completion")
  class CompletionTests {

    @Test
    @DisplayName("should run job and remove it from the store")
    void testCompletesAndRemoves() {
      // Given
      List<String> seen = new CopyOnWriteArrayList<>();
      factory.registerWorker(
          QueueName.SCHEDULED_EMAIL,
          processor(
              job -> {
                seen.add(job.payload().value());
                return JobResult.completed();
              }),
          2);

      // When
      boolean added = queue.enqueue(new Ping("hello"), JobOptions.withJobId("job-1"));

      // Then
      assertThat(added).isTrue();
      await().atMost(5, TimeUnit.SECONDS).until(() -> seen.contains("hello"));
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> store.find(QueueName.SCHEDULED_EMAIL, "job-1").isEmpty());
    }

    @Test
    @DisplayName("should ignore a second enqueue with the same job id")
    void testDuplicateJobId() {
      // When
      boolean first = queue.enqueue(new Ping("a"), JobOptions.withJobId("dup"));
      boolean second = queue.enqueue(new Ping("b"), JobOptions.withJobId("dup"));

      // Then
      assertThat(first).isTrue();
      assertThat(second).isFalse();
      assertThat(store.count(QueueName.SCHEDULED_EMAIL, JobState.WAITING)).isEqualTo(1);
    }

    @Test
    @DisplayName("should not run a delayed job before its delay")
    void testDelayedJob() throws Exception {
      // Given
      AtomicInteger calls = new AtomicInteger();
      factory.registerWorker(
          QueueName.SCHEDULED_EMAIL,
          processor(
              job -> {
                calls.incrementAndGet();
                return JobResult.completed();
              }),
          1);

      // When
      queue.enqueue(new Ping("later"), JobOptions.withJobId("late").delay(Duration.ofMillis(400)));
      Thread.sleep(100);

      // Then
      assertThat(calls.get()).isZero();
      await().atMost(5, TimeUnit.SECONDS).until(() -> calls.get() == 1);
    }
  }

  @Nested
  @DisplayName("Failures")
  class FailureTests {

    @Test
    @DisplayName("should retry until attempts are used up and then call the exhaustion hook")
    void testRetriesThenExhausts() {
      // Given
      AtomicInteger calls = new AtomicInteger();
      AtomicReference<Exception> exhausted = new AtomicReference<>();
      JobProcessor<Ping> failing =
          new JobProcessor<>() {
            @Override
            public Class<Ping> payloadType() {
              return Ping.class;
            }

            @Override
            public JobResult process(Job<Ping> job) {
              calls.incrementAndGet();
              throw new TransientException("smtp timeout");
            }

            @Override
            public void onExhausted(Job<Ping> job, Exception error) {
              exhausted.set(error);
            }
          };
      factory.registerWorker(QueueName.SCHEDULED_EMAIL, failing, 1);

      // When
      queue.enqueue(
          new Ping("x"),
          JobOptions.withJobId("retry-me").attempts(3).backoff(BackoffPolicy.exponential(Duration.ofMillis(10))));

      // Then
      await().atMost(5, TimeUnit.SECONDS).until(() -> exhausted.get() != null);
      assertThat(calls.get()).isEqualTo(3);
      assertThat(exhausted.get()).hasMessage("smtp timeout");
      assertThat(store.count(QueueName.SCHEDULED_EMAIL, JobState.DEAD)).isEqualTo(1);
      assertThat(store.find(QueueName.SCHEDULED_EMAIL, "retry-me"))
          .hasValueSatisfying(
              j -> {
                assertThat(j.attemptsMade()).isEqualTo(3);
                assertThat(j.lastError()).isEqualTo("smtp timeout");
              });
    }

    @Test
    @DisplayName("should skip remaining attempts on PermanentException")
    void testPermanentFailure() {
      // Given
      AtomicInteger calls = new AtomicInteger();
      factory.registerWorker(
          QueueName.SCHEDULED_EMAIL,
          processor(
              job -> {
                calls.incrementAndGet();
                throw new PermanentException("template missing");
              }),
          1);

      // When
      queue.enqueue(new Ping("x"), JobOptions.withJobId("perm").attempts(5));

      // Then
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> store.count(QueueName.SCHEDULED_EMAIL, JobState.DEAD) == 1);
      assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep the job id reserved after a terminal failure")
    void testDeadJobBlocksDuplicate() {
      // Given
      factory.registerWorker(
          QueueName.SCHEDULED_EMAIL,
          processor(
              job -> {
                throw new PermanentException("nope");
              }),
          1);
      queue.enqueue(new Ping("x"), JobOptions.withJobId("dead-1"));
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> store.count(QueueName.SCHEDULED_EMAIL, JobState.DEAD) == 1);

      // When
      boolean added = queue.enqueue(new Ping("x"), JobOptions.withJobId("dead-1"));

      // Then
      assertThat(added).isFalse();
    }

    @Test
    @DisplayName("should call the exhaustion hook for a job whose last lease expired")
    void testStalledJobExhausts() {
      // Given
      Instant now = Instant.now();
      store.add(
          new StoredJob(
              QueueName.SCHEDULED_EMAIL, "stalled-1", "ping", "{\"value\":\"x\"}", 2, 3,
              BackoffPolicy.exponential(Duration.ofSeconds(5)), now, "smtp timeout"),
          now.minusSeconds(600));
      store.claimNext(QueueName.SCHEDULED_EMAIL, now.minusSeconds(600), now.minusSeconds(300));
      AtomicReference<Job<Ping>> exhausted = new AtomicReference<>();
      AtomicInteger calls = new AtomicInteger();
      JobProcessor<Ping> processor =
          new JobProcessor<>() {
            @Override
            public Class<Ping> payloadType() {
              return Ping.class;
            }

            @Override
            public JobResult process(Job<Ping> job) {
              calls.incrementAndGet();
              return JobResult.completed();
            }

            @Override
            public void onExhausted(Job<Ping> job, Exception error) {
              exhausted.set(job);
            }
          };

      // When
      factory.registerWorker(QueueName.SCHEDULED_EMAIL, processor, 1);

      // Then
      await().atMost(5, TimeUnit.SECONDS).until(() -> exhausted.get() != null);
      assertThat(exhausted.get().payload()).isEqualTo(new Ping("x"));
      assertThat(calls.get()).isZero();
      assertThat(store.count(QueueName.SCHEDULED_EMAIL, JobState.DEAD)).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Not yet due")
  class NotYetDueTests {

    @Test
    @DisplayName("should reschedule without consuming an attempt")
    void testNotYetDueKeepsAttempts() {
      // Given
      List<Integer> attemptsSeen = new CopyOnWriteArrayList<>();
      factory.registerWorker(
          QueueName.SCHEDULED_EMAIL,
          processor(
              job -> {
                attemptsSeen.add(job.attemptsMade());
                return attemptsSeen.size() == 1
                    ? JobResult.notYetDue(Duration.ofMillis(50))
                    : JobResult.completed();
              }),
          1);

      // When
      queue.enqueue(new Ping("early"), JobOptions.withJobId("early-1").attempts(1));

      // Then
      await().atMost(5, TimeUnit.SECONDS).until(() -> attemptsSeen.size() == 2);
      assertThat(attemptsSeen).containsExactly(0, 0);
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> store.find(QueueName.SCHEDULED_EMAIL, "early-1").isEmpty());
    }
  }

  @Nested
  @DisplayName("Concurrency and shutdown")
  class ConcurrencyTests {

    @Test
    @DisplayName("should never run more jobs at once than the configured concurrency")
    void testConcurrencyBound() {
      // Given
      CountDownLatch release = new CountDownLatch(1);
      AtomicInteger running = new AtomicInteger();
      AtomicInteger peak = new AtomicInteger();
      QueueWorker worker =
          factory
              .registerWorker(
                  QueueName.SCHEDULED_EMAIL,
                  processor(
                      job -> {
                        peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                        release.await(5, TimeUnit.SECONDS);
                        running.decrementAndGet();
                        return JobResult.completed();
                      }),
                  2)
              .orElseThrow();

      // When
      for (int i = 0; i < 5; i++) {
        queue.enqueue(new Ping("p" + i), JobOptions.withJobId("c-" + i));
      }

      // Then
      await().atMost(5, TimeUnit.SECONDS).until(() -> worker.activeJobs() == 2);
      release.countDown();
      await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> store.count(QueueName.SCHEDULED_EMAIL, JobState.WAITING) == 0
              && worker.activeJobs() == 0);
      assertThat(peak.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("close should wait for the running job to finish")
    void testCloseDrains() {
      // Given
      CountDownLatch started = new CountDownLatch(1);
      AtomicInteger finished = new AtomicInteger();
      QueueWorker worker =
          factory
              .registerWorker(
                  QueueName.SCHEDULED_EMAIL,
                  processor(
                      job -> {
                        started.countDown();
                        Thread.sleep(150);
                        finished.incrementAndGet();
                        return JobResult.completed();
                      }),
                  1)
              .orElseThrow();
      queue.enqueue(new Ping("slow"), JobOptions.withJobId("slow-1"));
      await().atMost(5, TimeUnit.SECONDS).until(() -> started.getCount() == 0);

      // When
      worker.close(Duration.ofSeconds(5));

      // Then
      assertThat(finished.get()).isEqualTo(1);
      assertThat(worker.isRunning()).isFalse();
    }

    @Test
    @DisplayName("should refuse a second worker for the same queue")
    void testDuplicateWorker() {
      // Given
      factory.registerWorker(QueueName.SCHEDULED_EMAIL, processor(job -> JobResult.completed()), 1);

      // When / Then
      org.assertj.core.api.Assertions.assertThatThrownBy(
              () ->
                  factory.registerWorker(
                      QueueName.SCHEDULED_EMAIL, processor(job -> JobResult.completed()), 1))
          .isInstanceOf(IllegalStateException.class);
    }
  }
}
