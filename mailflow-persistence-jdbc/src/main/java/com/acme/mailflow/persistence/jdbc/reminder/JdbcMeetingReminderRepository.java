package com.acme.mailflow.persistence.jdbc.reminder;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.MeetingReminder;
import com.acme.mailflow.domain.ReminderStatus;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.MeetingReminderRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcMeetingReminderRepository implements MeetingReminderRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMeetingReminderRepository.class);

    private final DataSource dataSource;

    public JdbcMeetingReminderRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MeetingReminder> findById(String id) {
        String sql = """
                SELECT id, user_id, meeting_type_id, meeting_name, invitee_email, invitee_name,
                       booking_url, status, send_count, max_sends, schedule_plan, activation_at,
                       next_send_at, last_sent_at, last_error
                FROM meeting_reminder WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find meeting reminder " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasConfirmedBooking(String meetingTypeId, String inviteeEmail) {
        String sql = """
                SELECT COUNT(*) FROM meeting_booking
                WHERE meeting_type_id = ? AND LOWER(invitee_email) = LOWER(?) AND status = 'CONFIRMED'
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, meetingTypeId);
            ps.setString(2, inviteeEmail);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "check bookings for " + inviteeEmail, LOG);
        }
    }

    @Override
    @Transactional
    public void markCompleted(String id) {
        String sql = """
                UPDATE meeting_reminder SET status = 'COMPLETED', next_send_at = NULL,
                       updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "complete meeting reminder " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void markFailed(String id, String error, Instant at) {
        String sql = """
                UPDATE meeting_reminder SET status = 'FAILED', next_send_at = NULL, last_error = ?,
                       updated_at = ?
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, error);
            setInstant(ps, 2, at);
            ps.setString(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "fail meeting reminder " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void recordError(String id, String error, Instant at) {
        String sql = "UPDATE meeting_reminder SET last_error = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, error);
            setInstant(ps, 2, at);
            ps.setString(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "record reminder error " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void recordSend(String id, int sendCount, Instant sentAt, Instant nextSendAt, ReminderStatus status) {
        String sql = """
                UPDATE meeting_reminder
                SET send_count = ?, last_sent_at = ?, next_send_at = ?, status = ?, updated_at = ?
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, sendCount);
            setInstant(ps, 2, sentAt);
            setInstant(ps, 3, nextSendAt);
            ps.setString(4, status.name());
            setInstant(ps, 5, sentAt);
            ps.setString(6, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "record reminder send " + id, LOG);
        }
    }

    private static MeetingReminder map(ResultSet rs) throws SQLException {
        List<Integer> plan = Jsons.toIntList(rs.getString("schedule_plan"));
        return new MeetingReminder(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("meeting_type_id"),
                rs.getString("meeting_name"),
                rs.getString("invitee_email"),
                rs.getString("invitee_name"),
                rs.getString("booking_url"),
                ReminderStatus.valueOf(rs.getString("status")),
                rs.getInt("send_count"),
                rs.getInt("max_sends"),
                plan,
                getInstant(rs, "activation_at"),
                getInstant(rs, "next_send_at"),
                getInstant(rs, "last_sent_at"),
                rs.getString("last_error"));
    }
}
