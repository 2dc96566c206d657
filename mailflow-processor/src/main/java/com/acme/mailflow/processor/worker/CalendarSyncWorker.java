package com.acme.mailflow.processor.worker;

import com.acme.mailflow.jobs.CalendarSyncJob;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CalendarConnectionRepository;
import com.acme.mailflow.spi.BusyBlock;
import com.acme.mailflow.spi.CalendarClient;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Refreshes the cached busy blocks of one calendar connection for the job's window. */
@Singleton
public class CalendarSyncWorker implements QueueJobHandler<CalendarSyncJob> {
  private static final Logger LOG = LoggerFactory.getLogger(CalendarSyncWorker.class);

  private final CalendarConnectionRepository connections;
  private final CalendarClient calendar;
  private final CollaboratorInvoker invoker;
  private final Clock clock;

  public CalendarSyncWorker(
      CalendarConnectionRepository connections,
      CalendarClient calendar,
      CollaboratorInvoker invoker,
      Clock clock) {
    this.connections = connections;
    this.calendar = calendar;
    this.invoker = invoker;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.CALENDAR_SYNC;
  }

  @Override
  public Class<CalendarSyncJob> payloadType() {
    return CalendarSyncJob.class;
  }

  @Override
  public JobResult process(Job<CalendarSyncJob> job) throws Exception {
    CalendarSyncJob p = job.payload();
    if (p.connectionId() == null || p.start() == null || p.end() == null) {
      throw new IllegalArgumentException("connectionId, start and end are required");
    }
    LOG.info("Processing calendar sync connection={} user={} window={}..{}",
        p.connectionId(), p.userId(), p.start(), p.end());

    if (connections.findById(p.connectionId()).isEmpty()) {
      LOG.warn("Calendar connection {} no longer exists, skipping sync", p.connectionId());
      return JobResult.completed();
    }

    List<BusyBlock> blocks =
        invoker.call(
            "fetch busy blocks for " + p.connectionId(),
            () -> calendar.fetchBusyBlocks(p.userId(), p.connectionId(), p.start(), p.end(), p.calendars()));
    int cached = connections.replaceBusyBlocks(p.connectionId(), p.start(), p.end(), blocks);
    connections.markSynced(p.connectionId(), clock.instant());

    LOG.info("Calendar sync completed connection={} cachedBlocks={}", p.connectionId(), cached);
    return JobResult.completed();
  }

  @Override
  public void onExhausted(Job<CalendarSyncJob> job, Exception error) {
    LOG.warn("Calendar sync for connection {} gave up, next poller cycle will retry: {}",
        job.payload().connectionId(), error.getMessage());
  }
}
