package com.acme.mailflow.persistence.jdbc.outbox;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.domain.OutboxEvent;
import com.acme.mailflow.domain.OutboxStatus;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.OutboxRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDBC outbox using the Template Method pattern. Dialects supply the batch claim, which is the only
 * statement that needs row locking.
 */
public abstract class JdbcOutboxRepository implements OutboxRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOutboxRepository.class);

    protected static final String COLUMNS = """
            id, queue_name, job_id, job_name, payload, status, attempts, next_attempt_at, created_at, last_error
            """;

    protected final DataSource dataSource;

    protected JdbcOutboxRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public long insert(OutboxEvent event) {
        String sql = """
                INSERT INTO outbox_event
                (queue_name, job_id, job_name, payload, status, attempts, next_attempt_at, created_at)
                VALUES (?, ?, ?, ?, 'NEW', 0, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql, new String[] {"id"})) {
            ps.setString(1, event.queueName());
            ps.setString(2, event.jobId());
            ps.setString(3, event.jobName());
            ps.setString(4, event.payload());
            setInstant(ps, 5, event.nextAttemptAt());
            setInstant(ps, 6, event.createdAt());
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    long id = rs.getLong(1);
                    LOG.debug("Inserted outbox event {} for {}/{}", id, event.queueName(), event.jobId());
                    return id;
                }
            }
            throw new SQLException("No id generated for outbox event " + event.jobId());
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert outbox event", LOG);
        }
    }

    @Override
    @Transactional
    public List<OutboxEvent> claimBatch(int limit, Instant now) {
        try (Connection conn = dataSource.getConnection()) {
            return claim(conn, limit, now);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim outbox batch", LOG);
        }
    }

    @Override
    @Transactional
    public void markPublished(long id, Instant at) {
        String sql = """
                UPDATE outbox_event SET status = 'PUBLISHED', published_at = ?, last_error = NULL
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, at);
            ps.setLong(2, id);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for markPublished: id={}", id);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbox event published", LOG);
        }
    }

    @Override
    @Transactional
    public void markFailed(long id, String error, Instant nextAttemptAt) {
        String sql = """
                UPDATE outbox_event
                SET status = 'NEW', attempts = attempts + 1, last_error = ?, next_attempt_at = ?, claimed_at = NULL
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, error);
            setInstant(ps, 2, nextAttemptAt);
            ps.setLong(3, id);
            if (ps.executeUpdate() == 0) {
                LOG.warn("No rows updated for markFailed: id={}", id);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark outbox event failed", LOG);
        }
    }

    @Override
    @Transactional
    public int recoverStuck(Duration claimTimeout, Instant now) {
        String sql = """
                UPDATE outbox_event SET status = 'NEW', claimed_at = NULL
                WHERE status = 'CLAIMED' AND claimed_at < ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, now.minus(claimTimeout));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "recover stuck outbox events", LOG);
        }
    }

    /** Moves up to {@code limit} due NEW rows to CLAIMED and returns them as claimed. */
    protected abstract List<OutboxEvent> claim(Connection conn, int limit, Instant now) throws SQLException;

    protected OutboxEvent map(ResultSet rs) throws SQLException {
        return new OutboxEvent(
                rs.getLong("id"),
                rs.getString("queue_name"),
                rs.getString("job_id"),
                rs.getString("job_name"),
                rs.getString("payload"),
                OutboxStatus.valueOf(rs.getString("status")),
                rs.getInt("attempts"),
                getInstant(rs, "next_attempt_at"),
                getInstant(rs, "created_at"),
                rs.getString("last_error"));
    }
}
