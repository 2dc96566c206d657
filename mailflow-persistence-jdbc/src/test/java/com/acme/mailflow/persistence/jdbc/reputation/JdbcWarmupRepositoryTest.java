package com.acme.mailflow.persistence.jdbc.reputation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.persistence.jdbc.H2RepositoryTestBase;
import com.acme.mailflow.reputation.WarmupDay;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JdbcWarmupRepositoryTest extends H2RepositoryTestBase {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");

    private JdbcWarmupRepository repository;

    @BeforeEach
    void setUp() throws Exception {
        repository = new JdbcWarmupRepository(dataSource);
        execute("DELETE FROM email_warmup");
    }

    @Test
    @DisplayName("findOpenDay should return the latest uncompleted day")
    void testFindOpenDay() {
        // Given
        repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null));
        repository.completeDay("d-1", 1, 48, NOW);
        repository.insertDay(new WarmupDay("d-1", 2, 75, 0, null));

        // When
        WarmupDay open = repository.findOpenDay("d-1").orElseThrow();

        // Then
        assertThat(open.day()).isEqualTo(2);
        assertThat(open.targetVolume()).isEqualTo(75);
        assertThat(open.isOpen()).isTrue();
        assertThat(repository.countDays("d-1")).isEqualTo(2);
    }

    @Test
    @DisplayName("countDays should include a day that is still open")
    void testCountsOpenDay() {
        repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null));

        assertThat(repository.countDays("d-1")).isEqualTo(1);
        assertThat(repository.countDays("d-2")).isZero();
    }

    @Test
    @DisplayName("incrementActual should add to the day's volume")
    void testIncrementActual() {
        repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null));

        repository.incrementActual("d-1", 1, 3);
        repository.incrementActual("d-1", 1, 1);

        WarmupDay day = repository.findOpenDay("d-1").orElseThrow();
        assertThat(day.actualVolume()).isEqualTo(4);
        assertThat(day.remaining()).isEqualTo(46);
    }

    @Test
    @DisplayName("completeDay should only close an open day once")
    void testCompleteDayOnce() {
        repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null));

        repository.completeDay("d-1", 1, 50, NOW);
        repository.completeDay("d-1", 1, 10, NOW.plusSeconds(60));

        assertThat(repository.findOpenDay("d-1")).isEmpty();
        assertThat(repository.countDays("d-1")).isEqualTo(1);
    }

    @Test
    @DisplayName("inserting the same day twice should be a permanent failure")
    void testDuplicateDay() {
        repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null));

        assertThatThrownBy(() -> repository.insertDay(new WarmupDay("d-1", 1, 50, 0, null)))
                .isInstanceOf(PermanentException.class);
    }
}
