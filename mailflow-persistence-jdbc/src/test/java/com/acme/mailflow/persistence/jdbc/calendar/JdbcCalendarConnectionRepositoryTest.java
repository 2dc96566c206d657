package com.acme.mailflow.persistence.jdbc.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.domain.OAuthCredential;
import com.acme.mailflow.persistence.jdbc.H2RepositoryTestBase;
import com.acme.mailflow.spi.BusyBlock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JdbcCalendarConnectionRepositoryTest extends H2RepositoryTestBase {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");

    private JdbcCalendarConnectionRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        repository = new JdbcCalendarConnectionRepository(dataSource);
        execute("DELETE FROM calendar_busy_block", "DELETE FROM calendar_connection", "DELETE FROM oauth_credential");
    }

    private static CalendarConnection connection(String id, String userId, String calendarId) {
        return new CalendarConnection(id, userId, "google", userId + "@example.com", calendarId, "UTC", 30, null,
                List.of(calendarId), false);
    }

    @Nested
    @DisplayName("upsert")
    class Upsert {

        @Test
        @DisplayName("should insert once and then update the same account")
        void testUpsertIsIdempotent() {
            // Given
            String firstId = repository.upsert(connection("c-1", "u-1", "primary"));

            // When
            String secondId = repository.upsert(connection("c-2", "u-1", "work"));

            // Then
            assertThat(secondId).isEqualTo(firstId).isEqualTo("c-1");
            CalendarConnection stored = repository.findById("c-1").orElseThrow();
            assertThat(stored.calendarId()).isEqualTo("work");
            assertThat(stored.cadenceMinutes()).isEqualTo(30);
            assertThat(repository.findById("c-2")).isEmpty();
        }

        @Test
        @DisplayName("should generate an id when none is given")
        void testUpsertGeneratesId() {
            String id = repository.upsert(connection(null, "u-2", "primary"));

            assertThat(id).isNotBlank();
            assertThat(repository.findById(id)).isPresent();
        }
    }

    @Test
    @DisplayName("findWithCredentials should only return connections whose user holds a credential")
    void testFindWithCredentials() {
        // Given
        repository.upsert(connection("c-1", "u-1", "primary"));
        repository.upsert(connection("c-2", "u-2", "primary"));
        repository.saveCredential(new OAuthCredential("u-1", "google", "access", "refresh", "calendar", "Bearer",
                NOW.plus(Duration.ofHours(1))));

        // When
        List<CalendarConnection> connections = repository.findWithCredentials();

        // Then
        assertThat(connections).extracting(CalendarConnection::id).containsExactly("c-1");
        assertThat(connections.get(0).hasCredential()).isTrue();
    }

    @Test
    @DisplayName("saveCredential should keep the refresh token when a new one is absent")
    void testSaveCredentialKeepsRefreshToken() throws Exception {
        repository.saveCredential(new OAuthCredential("u-1", "google", "a-1", "r-1", null, "Bearer", NOW));
        repository.saveCredential(new OAuthCredential("u-1", "google", "a-2", null, null, "Bearer", NOW));

        assertThat(count("SELECT COUNT(*) FROM oauth_credential WHERE user_id = 'u-1' AND refresh_token = 'r-1' "
                + "AND access_token = 'a-2'")).isEqualTo(1);
    }

    @Test
    @DisplayName("replaceBusyBlocks should drop overlapping blocks and store the new ones")
    void testReplaceBusyBlocks() throws Exception {
        // Given
        repository.upsert(connection("c-1", "u-1", "primary"));
        Instant start = NOW;
        Instant end = NOW.plus(Duration.ofDays(7));
        repository.replaceBusyBlocks("c-1", start, end, List.of(
                new BusyBlock("primary", NOW.plus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(2)))));

        // When
        int stored = repository.replaceBusyBlocks("c-1", start, end, List.of(
                new BusyBlock("primary", NOW.plus(Duration.ofHours(3)), NOW.plus(Duration.ofHours(4))),
                new BusyBlock("primary", NOW.plus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(1)).plusSeconds(900))));

        // Then
        assertThat(stored).isEqualTo(2);
        assertThat(count("SELECT COUNT(*) FROM calendar_busy_block WHERE connection_id = 'c-1'")).isEqualTo(2);
    }

    @Test
    @DisplayName("markSynced should stamp the last sync time")
    void testMarkSynced() {
        repository.upsert(connection("c-1", "u-1", "primary"));

        repository.markSynced("c-1", NOW);

        assertThat(repository.findById("c-1").orElseThrow().lastSyncedAt()).isEqualTo(NOW);
    }
}
