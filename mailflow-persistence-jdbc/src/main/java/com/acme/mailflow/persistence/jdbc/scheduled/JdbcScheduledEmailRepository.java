package com.acme.mailflow.persistence.jdbc.scheduled;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.ReplyMetadata;
import com.acme.mailflow.domain.ScheduledEmail;
import com.acme.mailflow.domain.ScheduledEmailStatus;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.ScheduledEmailRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcScheduledEmailRepository implements ScheduledEmailRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcScheduledEmailRepository.class);

    private static final String COLUMNS = """
            id, user_id, to_address, cc, bcc, subject, body, html, status,
            scheduled_at, sent_at, error, metadata
            """;

    private final DataSource dataSource;

    public JdbcScheduledEmailRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledEmail> findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM scheduled_email WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find scheduled email " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledEmail> findDue(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
                 FROM scheduled_email
                WHERE status = 'PENDING' AND scheduled_at <= ?
                ORDER BY scheduled_at ASC
                LIMIT ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            List<ScheduledEmail> due = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    due.add(map(rs));
                }
            }
            return due;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find due scheduled emails", LOG);
        }
    }

    @Override
    @Transactional
    public boolean markSent(String id, Instant sentAt) {
        String sql = """
                UPDATE scheduled_email SET status = 'SENT', sent_at = ?, error = NULL
                WHERE id = ? AND status = 'PENDING'
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, sentAt);
            ps.setString(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark scheduled email sent " + id, LOG);
        }
    }

    @Override
    @Transactional
    public boolean markFailed(String id, String error) {
        String sql = """
                UPDATE scheduled_email SET status = 'FAILED', error = ?
                WHERE id = ? AND status = 'PENDING'
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setString(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark scheduled email failed " + id, LOG);
        }
    }

    private static ScheduledEmail map(ResultSet rs) throws SQLException {
        return new ScheduledEmail(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("to_address"),
                Jsons.toStringList(rs.getString("cc")),
                Jsons.toStringList(rs.getString("bcc")),
                rs.getString("subject"),
                rs.getString("body"),
                rs.getString("html"),
                ScheduledEmailStatus.valueOf(rs.getString("status")),
                getInstant(rs, "scheduled_at"),
                getInstant(rs, "sent_at"),
                rs.getString("error"),
                metadata(rs.getString("metadata")));
    }

    private static ReplyMetadata metadata(String json) {
        Map<String, Object> raw = Jsons.toMap(json);
        if (raw.isEmpty()) {
            return ReplyMetadata.NONE;
        }
        return new ReplyMetadata(
                Boolean.TRUE.equals(raw.get("sendAsReply")),
                (String) raw.get("replyToMessageId"),
                (String) raw.get("replyToThreadId"));
    }
}
