package com.acme.mailflow.worker.lifecycle;

import com.acme.mailflow.config.PollerConfig;
import com.acme.mailflow.config.QueueConfig;
import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.processor.poller.AbstractPoller;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.queue.QueueFactory;
import com.acme.mailflow.queue.QueueWorker;
import io.micronaut.context.BeanContext;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the background side of the worker up once HTTP is serving and takes it down on
 * shutdown.
 *
 * <p>Startup runs on its own thread so health checks answer while migrations run: migrate, start one
 * worker per {@link QueueJobHandler} bean, then schedule every {@link AbstractPoller} bean with an
 * immediate first run. Shutdown cancels the pollers, closes all workers in parallel with a
 * per-worker grace period under an overall ceiling, closes the broker and waits a short buffer.
 */
@Singleton
public class LifecycleManager implements ApplicationEventListener<ServerStartupEvent> {
  private static final Logger LOG = LoggerFactory.getLogger(LifecycleManager.class);

  private final QueueFactory queueFactory;
  private final SchemaMigrator migrator;
  private final TaskScheduler scheduler;
  private final BeanContext beanContext;
  private final QueueConfig queueConfig;
  private final PollerConfig pollerConfig;
  private final TimeoutConfig timeouts;

  private final AtomicBoolean started = new AtomicBoolean();
  private final List<QueueWorker> workers = new ArrayList<>();
  private final List<ScheduledFuture<?>> schedules = new ArrayList<>();
  private boolean stopping;

  public LifecycleManager(
      QueueFactory queueFactory,
      SchemaMigrator migrator,
      @Named(TaskExecutors.SCHEDULED) TaskScheduler scheduler,
      BeanContext beanContext,
      QueueConfig queueConfig,
      PollerConfig pollerConfig,
      TimeoutConfig timeouts) {
    this.queueFactory = queueFactory;
    this.migrator = migrator;
    this.scheduler = scheduler;
    this.beanContext = beanContext;
    this.queueConfig = queueConfig;
    this.pollerConfig = pollerConfig;
    this.timeouts = timeouts;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    Thread startup = new Thread(this::startBackground, "mailflow-startup");
    startup.setDaemon(true);
    startup.start();
  }

  void startBackground() {
    try {
      migrator.migrate();
      synchronized (this) {
        if (stopping) {
          LOG.info("Shutdown requested before startup finished, not starting workers");
          return;
        }
        registerWorkers();
        startPollers();
      }
      LOG.info("Background processing started: {} workers, {} pollers",
          workers.size(), schedules.size());
    } catch (RuntimeException e) {
      LOG.error("Background startup failed: {}", e.getMessage(), e);
    }
  }

  private void registerWorkers() {
    if (queueFactory.isDegraded()) {
      LOG.warn("Job broker unavailable, no queue workers started");
      return;
    }
    for (QueueJobHandler<?> handler : beanContext.getBeansOfType(QueueJobHandler.class)) {
      int concurrency = queueConfig.concurrencyFor(handler.queue());
      Optional<QueueWorker> worker = queueFactory.registerWorker(handler.queue(), handler, concurrency);
      if (worker.isPresent()) {
        workers.add(worker.get());
        LOG.info("Worker started queue={} concurrency={}", handler.queue().id(), concurrency);
      } else {
        LOG.warn("Worker not started queue={}", handler.queue().id());
      }
    }
  }

  private void startPollers() {
    if (!pollerConfig.isEnabled()) {
      LOG.info("Pollers disabled (mailflow.pollers.enabled=false)");
      return;
    }
    for (AbstractPoller poller : beanContext.getBeansOfType(AbstractPoller.class)) {
      schedules.add(scheduler.scheduleWithFixedDelay(Duration.ZERO, poller.interval(), poller::poll));
      LOG.info("Poller scheduled name={} interval={}", poller.name(), poller.interval());
    }
  }

  @PreDestroy
  public void shutdown() {
    List<QueueWorker> running;
    List<ScheduledFuture<?>> scheduled;
    synchronized (this) {
      if (stopping) {
        return;
      }
      stopping = true;
      running = new ArrayList<>(workers);
      scheduled = new ArrayList<>(schedules);
    }
    LOG.info("Shutting down: {} pollers, {} workers", scheduled.size(), running.size());

    scheduled.forEach(future -> future.cancel(false));
    closeWorkers(running);

    try {
      queueFactory.close();
    } catch (RuntimeException e) {
      LOG.warn("Error closing job broker: {}", e.getMessage(), e);
    }

    pause(timeouts.getShutdownBuffer());
    LOG.info("Shutdown complete");
  }

  private void closeWorkers(List<QueueWorker> running) {
    if (running.isEmpty()) {
      return;
    }
    Duration grace = timeouts.getWorkerShutdownGrace();
    ExecutorService closer =
        Executors.newFixedThreadPool(
            running.size(),
            r -> {
              Thread t = new Thread(r, "mailflow-shutdown");
              t.setDaemon(true);
              return t;
            });
    try {
      CompletableFuture<?>[] closing =
          running.stream()
              .map(worker -> CompletableFuture.runAsync(() -> closeWorker(worker, grace), closer))
              .toArray(CompletableFuture[]::new);
      CompletableFuture.allOf(closing).get(timeouts.getShutdownCeiling().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.warn("Workers still busy after {}, abandoning remaining jobs", timeouts.getShutdownCeiling());
    } catch (ExecutionException e) {
      LOG.warn("Error closing workers: {}", e.getCause().getMessage(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while closing workers");
    } finally {
      closer.shutdownNow();
    }
  }

  private static void closeWorker(QueueWorker worker, Duration grace) {
    try {
      worker.close(grace);
      LOG.info("Worker closed queue={}", worker.queue().id());
    } catch (RuntimeException e) {
      LOG.warn("Error closing worker queue={}: {}", worker.queue().id(), e.getMessage(), e);
    }
  }

  private static void pause(Duration buffer) {
    if (buffer.isZero() || buffer.isNegative()) {
      return;
    }
    try {
      Thread.sleep(buffer.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
