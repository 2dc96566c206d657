package com.acme.mailflow.processor.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.acme.mailflow.config.TimeoutConfig;
import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.domain.OAuthCredential;
import com.acme.mailflow.jobs.CalendarConnectionSetupJob;
import com.acme.mailflow.jobs.CalendarConnectionSetupJob.Profile;
import com.acme.mailflow.jobs.CalendarSyncJob;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CalendarConnectionRepository;
import com.acme.mailflow.spi.BusyBlock;
import com.acme.mailflow.spi.CalendarClient;
import com.acme.mailflow.spi.PrimaryCalendar;
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
@DisplayName("Calendar worker Tests")
class CalendarWorkersTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private CalendarConnectionRepository connections;
  @Mock private CalendarClient calendar;

  private CollaboratorInvoker invoker;

  @BeforeEach
  void setup() {
    invoker = new CollaboratorInvoker(new TimeoutConfig());
  }

  @AfterEach
  void teardown() {
    invoker.shutdown();
  }

  private static CalendarConnection connection() {
    return new CalendarConnection(
        "cc-1", "u1", "google", "ada@example.com", "primary", "UTC", 15, null, List.of(), true);
  }

  @Nested
  @DisplayName("CalendarSyncWorker")
  class SyncTests {

    private CalendarSyncWorker worker;
    private final Instant end = NOW.plus(Duration.ofDays(7));

    @BeforeEach
    void setup() {
      worker = new CalendarSyncWorker(connections, calendar, invoker, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Job<CalendarSyncJob> job(String connectionId, List<String> calendars) {
      return new Job<>(
          QueueName.CALENDAR_SYNC, "calendar-sync-" + connectionId, "sync-calendar",
          new CalendarSyncJob("u1", connectionId, NOW, end, calendars), 0, 3, NOW);
    }

    @Test
    @DisplayName("should replace cached busy blocks and stamp the sync time")
    void testSyncs() throws Exception {
      // Given
      List<BusyBlock> blocks =
          List.of(new BusyBlock("primary", NOW.plusSeconds(3600), NOW.plusSeconds(7200)));
      when(connections.findById("cc-1")).thenReturn(Optional.of(connection()));
      when(calendar.fetchBusyBlocks("u1", "cc-1", NOW, end, List.of("primary", "team")))
          .thenReturn(blocks);
      when(connections.replaceBusyBlocks("cc-1", NOW, end, blocks)).thenReturn(1);

      // When
      worker.process(job("cc-1", List.of("primary", "team")));

      // Then
      verify(connections).replaceBusyBlocks("cc-1", NOW, end, blocks);
      verify(connections).markSynced("cc-1", NOW);
    }

    @Test
    @DisplayName("should skip a connection that was removed")
    void testRemovedConnection() throws Exception {
      // Given
      when(connections.findById("gone")).thenReturn(Optional.empty());

      // When
      worker.process(job("gone", null));

      // Then
      verifyNoInteractions(calendar);
    }

    @Test
    @DisplayName("should leave the cache untouched when the provider fails")
    void testProviderFailure() throws Exception {
      // Given
      when(connections.findById("cc-1")).thenReturn(Optional.of(connection()));
      when(calendar.fetchBusyBlocks(any(), any(), any(), any(), any()))
          .thenThrow(new IllegalStateException("token expired"));

      // When / Then
      assertThatThrownBy(() -> worker.process(job("cc-1", null))).hasMessage("token expired");
      verify(connections, never()).markSynced(any(), any());
    }

    @Test
    @DisplayName("should reject a job without a window")
    void testInvalidPayload() {
      Job<CalendarSyncJob> job =
          new Job<>(QueueName.CALENDAR_SYNC, "x", "sync-calendar",
              new CalendarSyncJob("u1", "cc-1", null, null, null), 0, 3, NOW);
      assertThatThrownBy(() -> worker.process(job)).isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("CalendarConnectionSetupWorker")
  class SetupTests {

    private CalendarConnectionSetupWorker worker;

    @BeforeEach
    void setup() {
      worker = new CalendarConnectionSetupWorker(connections, calendar, invoker);
    }

    private Job<CalendarConnectionSetupJob> job(Profile profile, String scope) {
      return new Job<>(
          QueueName.CALENDAR_CONNECTION_SETUP, "setup-u1", "calendar-connection-setup",
          new CalendarConnectionSetupJob(
              "u1", profile, "access", "refresh", scope, "Bearer", NOW.plusSeconds(3600)),
          0, 3, NOW);
    }

    private CalendarConnection upserted() {
      ArgumentCaptor<CalendarConnection> captor = ArgumentCaptor.forClass(CalendarConnection.class);
      verify(connections).upsert(captor.capture());
      return captor.getValue();
    }

    @Test
    @DisplayName("should store the credential and the primary calendar metadata")
    void testSetsUpConnection() throws Exception {
      // Given
      when(calendar.fetchPrimaryCalendar("u1", "access"))
          .thenReturn(new PrimaryCalendar("ada@example.com", "Europe/Berlin"));
      when(connections.upsert(any())).thenReturn("cc-9");

      // When
      worker.process(job(new Profile("ada@example.com", "sub-1", "Ada", null), "calendar.readonly"));

      // Then
      verify(connections)
          .saveCredential(
              new OAuthCredential(
                  "u1", "google", "access", "refresh", "calendar.readonly", "Bearer", NOW.plusSeconds(3600)));
      CalendarConnection connection = upserted();
      assertThat(connection.accountEmail()).isEqualTo("ada@example.com");
      assertThat(connection.calendarId()).isEqualTo("ada@example.com");
      assertThat(connection.timeZone()).isEqualTo("Europe/Berlin");
      assertThat(connection.hasCredential()).isTrue();
    }

    @Test
    @DisplayName("should fall back to the primary calendar when metadata cannot be read")
    void testMetadataFailure() throws Exception {
      // Given
      when(calendar.fetchPrimaryCalendar(any(), any())).thenThrow(new IllegalStateException("403"));
      when(connections.upsert(any())).thenReturn("cc-9");

      // When
      worker.process(job(new Profile(null, "sub-1", null, null), "email"));

      // Then
      CalendarConnection connection = upserted();
      assertThat(connection.calendarId()).isEqualTo("primary");
      assertThat(connection.timeZone()).isNull();
      assertThat(connection.accountEmail()).isEqualTo("sub-1");
    }

    @Test
    @DisplayName("should reject a job without a profile")
    void testMissingProfile() {
      assertThatThrownBy(() -> worker.process(job(null, "calendar")))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(connections);
    }
  }
}
