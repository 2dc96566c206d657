package com.acme.mailflow.persistence.jdbc.snooze;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.mailflow.domain.EmailSnooze;
import com.acme.mailflow.persistence.jdbc.H2RepositoryTestBase;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcSnoozeRepositoryTest extends H2RepositoryTestBase {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");

    private JdbcSnoozeRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        repository = new JdbcSnoozeRepository(dataSource);
        execute("DELETE FROM email_snooze");
    }

    private void insert(String id, Instant until) throws Exception {
        update("INSERT INTO email_snooze (id, user_id, message_id, label_ids, snooze_until) VALUES (?, 'u-1', ?, ?, ?)",
                id, "msg-" + id, "[\"INBOX\",\"IMPORTANT\"]", until);
    }

    @Test
    @DisplayName("findDue should return expired snoozes with their labels")
    void testFindDue() throws Exception {
        // Given
        insert("s-1", NOW.minusSeconds(60));
        insert("s-2", NOW.plusSeconds(60));

        // When
        var due = repository.findDue(NOW, 10);

        // Then
        assertThat(due).extracting(EmailSnooze::id).containsExactly("s-1");
        assertThat(due.get(0).labelIds()).containsExactly("INBOX", "IMPORTANT");
        assertThat(due.get(0).messageId()).isEqualTo("msg-s-1");
    }

    @Test
    @DisplayName("delete should remove the snooze row")
    void testDelete() throws Exception {
        insert("s-1", NOW.minusSeconds(60));

        repository.delete("s-1");

        assertThat(repository.findById("s-1")).isEmpty();
    }
}
