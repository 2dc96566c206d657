package com.acme.mailflow.persistence.jdbc.snooze;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.EmailSnooze;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.SnoozeRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcSnoozeRepository implements SnoozeRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSnoozeRepository.class);

    private final DataSource dataSource;

    public JdbcSnoozeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EmailSnooze> findById(String id) {
        String sql = "SELECT id, user_id, message_id, label_ids, snooze_until FROM email_snooze WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find snooze " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmailSnooze> findDue(Instant now, int limit) {
        String sql = """
                SELECT id, user_id, message_id, label_ids, snooze_until
                FROM email_snooze
                WHERE snooze_until <= ?
                ORDER BY snooze_until ASC
                LIMIT ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, now);
            ps.setInt(2, limit);
            List<EmailSnooze> due = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    due.add(map(rs));
                }
            }
            return due;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find due snoozes", LOG);
        }
    }

    @Override
    @Transactional
    public void delete(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM email_snooze WHERE id = ?")) {
            ps.setString(1, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete snooze " + id, LOG);
        }
    }

    private static EmailSnooze map(ResultSet rs) throws SQLException {
        return new EmailSnooze(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("message_id"),
                Jsons.toStringList(rs.getString("label_ids")),
                getInstant(rs, "snooze_until"));
    }
}
