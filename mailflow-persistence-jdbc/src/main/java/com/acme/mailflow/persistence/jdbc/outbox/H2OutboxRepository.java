package com.acme.mailflow.persistence.jdbc.outbox;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.domain.OutboxEvent;
import com.acme.mailflow.domain.OutboxStatus;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

/**
 * H2 has no {@code UPDATE ... RETURNING}, so rows are selected first and then claimed one by one
 * with a status guard. A row another dispatcher claimed in between is skipped.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2OutboxRepository extends JdbcOutboxRepository {

    public H2OutboxRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected List<OutboxEvent> claim(Connection conn, int limit, Instant now) throws SQLException {
        String selectSql = "SELECT " + COLUMNS + """
                 FROM outbox_event
                WHERE status = 'NEW' AND next_attempt_at <= ?
                ORDER BY next_attempt_at ASC
                LIMIT ?
                """;
        List<OutboxEvent> candidates = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(map(rs));
                }
            }
        }

        String updateSql = """
                UPDATE outbox_event SET status = 'CLAIMED', claimed_at = ?
                WHERE id = ? AND status = 'NEW'
                """;
        List<OutboxEvent> claimed = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
            for (OutboxEvent event : candidates) {
                setInstant(ps, 1, now);
                ps.setLong(2, event.id());
                if (ps.executeUpdate() == 1) {
                    claimed.add(new OutboxEvent(
                            event.id(), event.queueName(), event.jobId(), event.jobName(), event.payload(),
                            OutboxStatus.CLAIMED, event.attempts(), event.nextAttemptAt(), event.createdAt(),
                            event.lastError()));
                }
            }
        }
        return claimed;
    }
}
