package com.acme.mailflow.persistence.jdbc.reputation;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.reputation.DomainReputation;
import com.acme.mailflow.reputation.ReputationMetrics;
import com.acme.mailflow.repository.DomainReputationRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reputation counters. Every increment is a single {@code x = x + 1} statement; the first-send
 * upsert is dialect specific and binds (domainId, createdAt, updatedAt).
 */
public abstract class JdbcDomainReputationRepository implements DomainReputationRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDomainReputationRepository.class);

    protected final DataSource dataSource;

    protected JdbcDomainReputationRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DomainReputation> find(String domainId) {
        String sql = """
                SELECT domain_id, total_sent, total_delivered, total_bounced, total_complained,
                       total_opened, total_clicked, bounce_rate, complaint_rate, open_rate, click_rate,
                       reputation_score, is_in_warmup, warmup_started_at, last_calculated_at
                FROM domain_reputation WHERE domain_id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, domainId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new DomainReputation(
                        rs.getString("domain_id"),
                        rs.getLong("total_sent"),
                        rs.getLong("total_delivered"),
                        rs.getLong("total_bounced"),
                        rs.getLong("total_complained"),
                        rs.getLong("total_opened"),
                        rs.getLong("total_clicked"),
                        rs.getDouble("bounce_rate"),
                        rs.getDouble("complaint_rate"),
                        rs.getDouble("open_rate"),
                        rs.getDouble("click_rate"),
                        rs.getInt("reputation_score"),
                        rs.getBoolean("is_in_warmup"),
                        getInstant(rs, "warmup_started_at"),
                        getInstant(rs, "last_calculated_at")));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find reputation of " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void recordSent(String domainId, Instant at) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getRecordSentSql())) {
            ps.setString(1, domainId);
            setInstant(ps, 2, at);
            setInstant(ps, 3, at);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "record send for " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void incrementDelivered(String domainId) {
        increment("total_delivered", domainId);
    }

    @Override
    @Transactional
    public void incrementOpened(String domainId) {
        increment("total_opened", domainId);
    }

    @Override
    @Transactional
    public void incrementClicked(String domainId) {
        increment("total_clicked", domainId);
    }

    private void increment(String column, String domainId) {
        String sql = "UPDATE domain_reputation SET " + column + " = " + column + " + 1 WHERE domain_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, domainId);
            if (ps.executeUpdate() == 0) {
                LOG.debug("No reputation row for {}, {} not counted", domainId, column);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "increment " + column + " for " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void updateMetrics(
            String domainId, long bounced, long complained, ReputationMetrics metrics, Instant calculatedAt) {
        String sql = """
                UPDATE domain_reputation
                SET total_bounced = ?, total_complained = ?, bounce_rate = ?, complaint_rate = ?,
                    open_rate = ?, click_rate = ?, reputation_score = ?, last_calculated_at = ?, updated_at = ?
                WHERE domain_id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, bounced);
            ps.setLong(2, complained);
            ps.setDouble(3, metrics.bounceRate());
            ps.setDouble(4, metrics.complaintRate());
            ps.setDouble(5, metrics.openRate());
            ps.setDouble(6, metrics.clickRate());
            ps.setInt(7, metrics.score());
            setInstant(ps, 8, calculatedAt);
            setInstant(ps, 9, calculatedAt);
            ps.setString(10, domainId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update reputation metrics for " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void setWarmup(String domainId, boolean inWarmup, Instant startedAt) {
        String update = """
                UPDATE domain_reputation SET is_in_warmup = ?, warmup_started_at = ?, updated_at = CURRENT_TIMESTAMP
                WHERE domain_id = ?
                """;
        String insert = """
                INSERT INTO domain_reputation (domain_id, is_in_warmup, warmup_started_at)
                VALUES (?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                ps.setBoolean(1, inWarmup);
                setInstant(ps, 2, startedAt);
                ps.setString(3, domainId);
                if (ps.executeUpdate() > 0) {
                    return;
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setString(1, domainId);
                ps.setBoolean(2, inWarmup);
                setInstant(ps, 3, startedAt);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "set warm-up flag for " + domainId, LOG);
        }
    }

    /** Inserts a row with one sent and delivered message, or increments both on an existing row. */
    protected abstract String getRecordSentSql();
}
