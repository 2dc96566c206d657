package com.acme.mailflow.processor.worker;

import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.domain.OAuthCredential;
import com.acme.mailflow.jobs.CalendarConnectionSetupJob;
import com.acme.mailflow.jobs.CalendarConnectionSetupJob.Profile;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CalendarConnectionRepository;
import com.acme.mailflow.spi.CalendarClient;
import com.acme.mailflow.spi.PrimaryCalendar;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finishes a calendar sign-in off the request path: stores the credential and creates or updates
 * the user's calendar connection with the primary calendar's metadata.
 */
@Singleton
public class CalendarConnectionSetupWorker implements QueueJobHandler<CalendarConnectionSetupJob> {
  private static final Logger LOG = LoggerFactory.getLogger(CalendarConnectionSetupWorker.class);

  static final String PROVIDER = "google";
  static final String PRIMARY = "primary";

  private final CalendarConnectionRepository connections;
  private final CalendarClient calendar;
  private final CollaboratorInvoker invoker;

  public CalendarConnectionSetupWorker(
      CalendarConnectionRepository connections, CalendarClient calendar, CollaboratorInvoker invoker) {
    this.connections = connections;
    this.calendar = calendar;
    this.invoker = invoker;
  }

  @Override
  public QueueName queue() {
    return QueueName.CALENDAR_CONNECTION_SETUP;
  }

  @Override
  public Class<CalendarConnectionSetupJob> payloadType() {
    return CalendarConnectionSetupJob.class;
  }

  @Override
  public JobResult process(Job<CalendarConnectionSetupJob> job) throws Exception {
    CalendarConnectionSetupJob p = job.payload();
    if (p.userId() == null || p.profile() == null || p.accessToken() == null) {
      throw new IllegalArgumentException("userId, profile and accessToken are required");
    }
    Profile profile = p.profile();
    LOG.info("Processing calendar connection setup user={} email={}", p.userId(), profile.email());

    PrimaryCalendar primary = primaryCalendar(p);

    connections.saveCredential(
        new OAuthCredential(
            p.userId(), PROVIDER, p.accessToken(), p.refreshToken(), p.scope(), p.tokenType(), p.expiryDate()));

    String accountEmail =
        profile.email() != null ? profile.email() : profile.id() != null ? profile.id() : p.userId();
    String connectionId =
        connections.upsert(
            new CalendarConnection(
                null,
                p.userId(),
                PROVIDER,
                accountEmail,
                primary.calendarId(),
                primary.timeZone(),
                null,
                null,
                List.of(),
                true));

    LOG.info("Calendar connection setup completed user={} connection={}", p.userId(), connectionId);
    return JobResult.completed();
  }

  /** Metadata is optional: sign-in still completes on the default calendar without it. */
  private PrimaryCalendar primaryCalendar(CalendarConnectionSetupJob p) {
    try {
      PrimaryCalendar primary =
          invoker.call(
              "fetch primary calendar for " + p.userId(),
              () -> calendar.fetchPrimaryCalendar(p.userId(), p.accessToken()));
      if (primary != null && primary.calendarId() != null) {
        return primary;
      }
    } catch (Exception e) {
      LOG.warn("Could not fetch primary calendar metadata user={}: {}", p.userId(), e.getMessage());
      if (p.scope() == null || !p.scope().contains("calendar")) {
        LOG.error("Calendar scope not granted for user={} scope={}", p.userId(), p.scope());
      }
    }
    return new PrimaryCalendar(PRIMARY, null);
  }
}
