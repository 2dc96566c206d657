package com.acme.mailflow.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.domain.OutboxEvent;
import com.acme.mailflow.persistence.jdbc.bounce.JdbcBounceRepository;
import com.acme.mailflow.persistence.jdbc.campaign.JdbcCampaignRepository;
import com.acme.mailflow.persistence.jdbc.outbox.H2OutboxRepository;
import com.acme.mailflow.persistence.jdbc.reputation.H2DomainReputationRepository;
import com.acme.mailflow.persistence.jdbc.scheduled.JdbcScheduledEmailRepository;
import com.acme.mailflow.bounce.BounceType;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Missing tables surface as permanent failures so jobs are not retried forever. */
class JdbcRepositoryExceptionTest extends H2RepositoryFaultyTestBase {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");

    @Test
    @DisplayName("scheduled email lookup should throw PermanentException when table is missing")
    void scheduledEmailLookupFails() {
        var repository = new JdbcScheduledEmailRepository(getDataSource());

        assertThatThrownBy(() -> repository.findDue(NOW, 10))
                .isInstanceOf(PermanentException.class)
                .hasMessageContaining("find due scheduled emails");
    }

    @Test
    @DisplayName("campaign lookup should throw PermanentException when table is missing")
    void campaignLookupFails() {
        var repository = new JdbcCampaignRepository(getDataSource());

        assertThatThrownBy(() -> repository.findCampaign("c-1"))
                .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("reputation upsert should throw PermanentException when table is missing")
    void reputationUpsertFails() {
        var repository = new H2DomainReputationRepository(getDataSource());

        assertThatThrownBy(() -> repository.recordSent("d-1", NOW))
                .isInstanceOf(PermanentException.class)
                .hasMessageContaining("record send for d-1");
    }

    @Test
    @DisplayName("bounce count should throw PermanentException when table is missing")
    void bounceCountFails() {
        var repository = new JdbcBounceRepository(getDataSource());

        assertThatThrownBy(() -> repository.countBounces("a@example.com", null, BounceType.HARD))
                .isInstanceOf(PermanentException.class);
    }

    @Test
    @DisplayName("outbox insert and claim should throw PermanentException when table is missing")
    void outboxFails() {
        var repository = new H2OutboxRepository(getDataSource());

        assertThatThrownBy(() -> repository.insert(OutboxEvent.pending("scheduled-email", "j-1", "send", "{}", NOW)))
                .isInstanceOf(PermanentException.class);
        assertThatThrownBy(() -> repository.claimBatch(10, NOW))
                .isInstanceOf(PermanentException.class)
                .hasMessageContaining("claim outbox batch");
    }
}
