package com.acme.mailflow.persistence.jdbc.messagelog;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.MessageLogStatus;
import com.acme.mailflow.domain.TrackingEventType;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.MessageLogRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcMessageLogRepository implements MessageLogRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMessageLogRepository.class);

    private static final String COLUMNS = """
            id, campaign_id, recipient_id, follow_up_step_id, user_id, subject, status,
            provider_message_id, thread_id, opens, clicks, sent_at, error
            """;

    private final DataSource dataSource;

    public JdbcMessageLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void create(MessageLog log) {
        String sql = """
                INSERT INTO message_log
                (id, campaign_id, recipient_id, follow_up_step_id, user_id, subject, status)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, log.id());
            ps.setString(2, log.campaignId());
            ps.setString(3, log.recipientId());
            ps.setString(4, log.followUpStepId());
            ps.setString(5, log.userId());
            ps.setString(6, log.subject());
            ps.setString(7, log.status().name());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create message log " + log.id(), LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MessageLog> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM message_log WHERE id = ?", id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MessageLog> findLatestSent(String recipientId) {
        return findOne("SELECT " + COLUMNS + """
                 FROM message_log
                WHERE recipient_id = ? AND status = 'SENT'
                ORDER BY sent_at DESC
                LIMIT 1
                """, recipientId);
    }

    private Optional<MessageLog> findOne(String sql, String param) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find message log " + param, LOG);
        }
    }

    @Override
    @Transactional
    public void markSent(String id, String providerMessageId, String threadId, Instant sentAt) {
        String sql = """
                UPDATE message_log
                SET status = 'SENT', provider_message_id = ?, thread_id = ?, sent_at = ?, error = NULL
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, providerMessageId);
            ps.setString(2, threadId);
            setInstant(ps, 3, sentAt);
            ps.setString(4, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark message log sent " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void markFailed(String id, String error) {
        String sql = "UPDATE message_log SET status = 'FAILED', error = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, error);
            ps.setString(2, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark message log failed " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void insertTrackingEvent(
            String messageLogId, TrackingEventType type, Map<String, Object> meta, Instant occurredAt) {
        String sql = """
                INSERT INTO tracking_event (message_log_id, event_type, meta, occurred_at)
                VALUES (?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, messageLogId);
            ps.setString(2, type.name());
            ps.setString(3, Jsons.toJson(meta == null ? Map.of() : meta));
            setInstant(ps, 4, occurredAt);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "insert tracking event for " + messageLogId, LOG);
        }
    }

    @Override
    @Transactional
    public void incrementOpens(String messageLogId) {
        increment("opens", messageLogId);
    }

    @Override
    @Transactional
    public void incrementClicks(String messageLogId) {
        increment("clicks", messageLogId);
    }

    private void increment(String column, String messageLogId) {
        String sql = "UPDATE message_log SET " + column + " = " + column + " + 1 WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, messageLogId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "increment " + column + " of " + messageLogId, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasTrackingEvent(String recipientId, TrackingEventType type) {
        String sql = """
                SELECT COUNT(*) FROM tracking_event t
                JOIN message_log m ON m.id = t.message_log_id
                WHERE m.recipient_id = ? AND t.event_type = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, recipientId);
            ps.setString(2, type.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "check tracking events of " + recipientId, LOG);
        }
    }

    private static MessageLog map(ResultSet rs) throws SQLException {
        return new MessageLog(
                rs.getString("id"),
                rs.getString("campaign_id"),
                rs.getString("recipient_id"),
                rs.getString("follow_up_step_id"),
                rs.getString("user_id"),
                rs.getString("subject"),
                MessageLogStatus.valueOf(rs.getString("status")),
                rs.getString("provider_message_id"),
                rs.getString("thread_id"),
                rs.getInt("opens"),
                rs.getInt("clicks"),
                getInstant(rs, "sent_at"),
                rs.getString("error"));
    }
}
