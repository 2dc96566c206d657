package com.acme.mailflow.persistence.jdbc.calendar;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.getNullableInt;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.CalendarConnection;
import com.acme.mailflow.domain.OAuthCredential;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.CalendarConnectionRepository;
import com.acme.mailflow.spi.BusyBlock;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcCalendarConnectionRepository implements CalendarConnectionRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcCalendarConnectionRepository.class);

    private static final String SELECT = """
            SELECT c.id, c.user_id, c.provider, c.account_email, c.calendar_id, c.time_zone,
                   c.cadence_minutes, c.last_synced_at, c.calendars,
                   CASE WHEN o.user_id IS NULL THEN FALSE ELSE TRUE END AS has_credential
            FROM calendar_connection c
            LEFT JOIN oauth_credential o ON o.user_id = c.user_id
            """;

    private final DataSource dataSource;

    public JdbcCalendarConnectionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CalendarConnection> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT + " WHERE c.id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find calendar connection " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<CalendarConnection> findWithCredentials() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT + " WHERE o.user_id IS NOT NULL ORDER BY c.id");
             ResultSet rs = ps.executeQuery()) {
            List<CalendarConnection> result = new ArrayList<>();
            while (rs.next()) {
                result.add(map(rs));
            }
            return result;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find calendar connections with credentials", LOG);
        }
    }

    @Override
    @Transactional
    public int replaceBusyBlocks(String connectionId, Instant start, Instant end, List<BusyBlock> blocks) {
        String delete = """
                DELETE FROM calendar_busy_block
                WHERE connection_id = ? AND start_at < ? AND end_at > ?
                """;
        String insert = """
                INSERT INTO calendar_busy_block (connection_id, calendar_id, start_at, end_at)
                VALUES (?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(delete)) {
                ps.setString(1, connectionId);
                setInstant(ps, 2, end);
                setInstant(ps, 3, start);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                for (BusyBlock block : blocks) {
                    ps.setString(1, connectionId);
                    ps.setString(2, block.calendarId());
                    setInstant(ps, 3, block.start());
                    setInstant(ps, 4, block.end());
                    ps.addBatch();
                }
                if (!blocks.isEmpty()) {
                    ps.executeBatch();
                }
            }
            return blocks.size();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "replace busy blocks of " + connectionId, LOG);
        }
    }

    @Override
    @Transactional
    public void markSynced(String id, Instant syncedAt) {
        String sql = "UPDATE calendar_connection SET last_synced_at = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, syncedAt);
            setInstant(ps, 2, syncedAt);
            ps.setString(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark calendar connection synced " + id, LOG);
        }
    }

    @Override
    @Transactional
    public String upsert(CalendarConnection connection) {
        String find = """
                SELECT id FROM calendar_connection
                WHERE user_id = ? AND provider = ? AND account_email = ?
                """;
        String update = """
                UPDATE calendar_connection
                SET calendar_id = ?, time_zone = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ?
                """;
        String insert = """
                INSERT INTO calendar_connection
                (id, user_id, provider, account_email, calendar_id, time_zone, cadence_minutes, calendars)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection()) {
            String existingId = null;
            try (PreparedStatement ps = conn.prepareStatement(find)) {
                ps.setString(1, connection.userId());
                ps.setString(2, connection.provider());
                ps.setString(3, connection.accountEmail());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        existingId = rs.getString("id");
                    }
                }
            }

            if (existingId != null) {
                try (PreparedStatement ps = conn.prepareStatement(update)) {
                    ps.setString(1, connection.calendarId());
                    ps.setString(2, connection.timeZone());
                    ps.setString(3, existingId);
                    ps.executeUpdate();
                }
                LOG.debug("Updated calendar connection id={} user={}", existingId, connection.userId());
                return existingId;
            }

            String id = connection.id() != null ? connection.id() : UUID.randomUUID().toString();
            try (PreparedStatement ps = conn.prepareStatement(insert)) {
                ps.setString(1, id);
                ps.setString(2, connection.userId());
                ps.setString(3, connection.provider());
                ps.setString(4, connection.accountEmail());
                ps.setString(5, connection.calendarId());
                ps.setString(6, connection.timeZone());
                if (connection.cadenceMinutes() == null) {
                    ps.setNull(7, Types.INTEGER);
                } else {
                    ps.setInt(7, connection.cadenceMinutes());
                }
                ps.setString(8, Jsons.toJson(connection.calendars() == null ? List.of() : connection.calendars()));
                ps.executeUpdate();
            }
            LOG.debug("Created calendar connection id={} user={}", id, connection.userId());
            return id;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert calendar connection", LOG);
        }
    }

    @Override
    @Transactional
    public void saveCredential(OAuthCredential credential) {
        String update = """
                UPDATE oauth_credential
                SET provider = ?, access_token = ?, refresh_token = COALESCE(?, refresh_token),
                    scope = ?, token_type = ?, expires_at = ?, updated_at = CURRENT_TIMESTAMP
                WHERE user_id = ?
                """;
        String insert = """
                INSERT INTO oauth_credential
                (user_id, provider, access_token, refresh_token, scope, token_type, expires_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                ps.setString(1, credential.provider());
                ps.setString(2, credential.accessToken());
                ps.setString(3, credential.refreshToken());
                ps.setString(4, credential.scope());
                ps.setString(5, credential.tokenType());
                setInstant(ps, 6, credential.expiresAt());
                ps.setString(7, credential.userId());
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(insert)) {
                    ps.setString(1, credential.userId());
                    ps.setString(2, credential.provider());
                    ps.setString(3, credential.accessToken());
                    ps.setString(4, credential.refreshToken());
                    ps.setString(5, credential.scope());
                    ps.setString(6, credential.tokenType());
                    setInstant(ps, 7, credential.expiresAt());
                    ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "save credential for " + credential.userId(), LOG);
        }
    }

    private static CalendarConnection map(ResultSet rs) throws SQLException {
        return new CalendarConnection(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("provider"),
                rs.getString("account_email"),
                rs.getString("calendar_id"),
                rs.getString("time_zone"),
                getNullableInt(rs, "cadence_minutes"),
                getInstant(rs, "last_synced_at"),
                Jsons.toStringList(rs.getString("calendars")),
                rs.getBoolean("has_credential"));
    }
}
