package com.acme.mailflow.persistence.jdbc.outbox;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.domain.OutboxEvent;
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

/** Claims with {@code FOR UPDATE SKIP LOCKED} so concurrent dispatchers never see the same row. */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresOutboxRepository extends JdbcOutboxRepository {

    private static final String CLAIM_SQL = """
            WITH available AS (
              SELECT id
              FROM outbox_event
              WHERE status = 'NEW' AND next_attempt_at <= ?
              ORDER BY next_attempt_at ASC
              LIMIT ? FOR UPDATE SKIP LOCKED
            )
            UPDATE outbox_event o
            SET status = 'CLAIMED', claimed_at = ?
            FROM available
            WHERE o.id = available.id
            RETURNING o.id, o.queue_name, o.job_id, o.job_name, o.payload, o.status, o.attempts,
                      o.next_attempt_at, o.created_at, o.last_error
            """;

    public PostgresOutboxRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected List<OutboxEvent> claim(Connection conn, int limit, Instant now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(CLAIM_SQL)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            setInstant(ps, 3, now);
            List<OutboxEvent> claimed = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    claimed.add(map(rs));
                }
            }
            return claimed;
        }
    }
}
