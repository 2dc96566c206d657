package com.acme.mailflow.persistence.jdbc.bounce;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.bounce.BounceEvent;
import com.acme.mailflow.bounce.BounceType;
import com.acme.mailflow.bounce.ComplaintEvent;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.BounceRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Append-only bounce and complaint history. */
@Singleton
public class JdbcBounceRepository implements BounceRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcBounceRepository.class);

    private final DataSource dataSource;

    public JdbcBounceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insertBounce(BounceEvent bounce) {
        String sql = """
                INSERT INTO email_bounce
                (recipient_email, message_log_id, domain_id, bounce_type, bounce_category, reason, raw_response, occurred_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, bounce.recipientEmail());
            ps.setString(2, bounce.messageLogId());
            ps.setString(3, bounce.domainId());
            ps.setString(4, bounce.type().name());
            ps.setString(5, bounce.category().name());
            ps.setString(6, bounce.reason());
            ps.setString(7, bounce.rawResponse());
            setInstant(ps, 8, bounce.occurredAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert bounce for " + bounce.recipientEmail(), LOG);
        }
    }

    @Override
    @Transactional
    public void insertComplaint(ComplaintEvent complaint) {
        String sql = """
                INSERT INTO email_complaint
                (recipient_email, message_log_id, domain_id, feedback_type, user_agent, occurred_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, complaint.recipientEmail());
            ps.setString(2, complaint.messageLogId());
            ps.setString(3, complaint.domainId());
            ps.setString(4, complaint.feedbackType());
            ps.setString(5, complaint.userAgent());
            setInstant(ps, 6, complaint.occurredAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                    e, "insert complaint for " + complaint.recipientEmail(), LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countBounces(String email, String domainId, BounceType type) {
        String sql = domainId == null
                ? "SELECT COUNT(*) FROM email_bounce WHERE LOWER(recipient_email) = LOWER(?) AND bounce_type = ?"
                : """
                SELECT COUNT(*) FROM email_bounce
                WHERE LOWER(recipient_email) = LOWER(?) AND bounce_type = ? AND domain_id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, email);
            ps.setString(2, type.name());
            if (domainId != null) {
                ps.setString(3, domainId);
            }
            return count(ps);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count bounces for " + email, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long countDomainBounces(String domainId, Instant since) {
        return countForDomain("email_bounce", domainId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countDomainComplaints(String domainId, Instant since) {
        return countForDomain("email_complaint", domainId, since);
    }

    private long countForDomain(String table, String domainId, Instant since) {
        String sql = "SELECT COUNT(*) FROM " + table + " WHERE domain_id = ? AND occurred_at >= ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, domainId);
            setInstant(ps, 2, since);
            return count(ps);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count " + table + " for " + domainId, LOG);
        }
    }

    private static long count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
