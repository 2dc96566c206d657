package com.acme.mailflow.processor.support;

import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.core.TransientException;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs calls to external providers (mail, mailbox, calendar) with a hard timeout. A call that
 * overruns is cancelled and surfaces as a {@link TransientException} so the job is retried.
 */
@Singleton
public class CollaboratorInvoker {
  private static final Logger LOG = LoggerFactory.getLogger(CollaboratorInvoker.class);

  private final Duration timeout;
  private final ExecutorService executor;

  public CollaboratorInvoker(TimeoutConfig timeouts) {
    this.timeout = timeouts.getCollaboratorCall();
    AtomicInteger seq = new AtomicInteger();
    this.executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "collaborator-" + seq.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public <T> T call(String operation, Callable<T> call) throws Exception {
    Future<T> future = executor.submit(call);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOG.warn("{} timed out after {}", operation, timeout);
      throw new TransientException(operation + " timed out after " + timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception ex) {
        throw ex;
      }
      throw new TransientException(operation + " failed: " + cause, cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new TransientException(operation + " interrupted", e);
    }
  }

  public void run(String operation, CheckedRunnable action) throws Exception {
    call(
        operation,
        () -> {
          action.run();
          return null;
        });
  }

  @PreDestroy
  public void shutdown() {
    executor.shutdownNow();
  }

  @FunctionalInterface
  public interface CheckedRunnable {
    void run() throws Exception;
  }
}
