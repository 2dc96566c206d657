package com.acme.mailflow.persistence.jdbc.reputation;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.WarmupRepository;
import com.acme.mailflow.reputation.WarmupDay;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class JdbcWarmupRepository implements WarmupRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcWarmupRepository.class);

    private final DataSource dataSource;

    public JdbcWarmupRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional
    public void insertDay(WarmupDay day) {
        String sql = """
                INSERT INTO email_warmup (domain_id, warmup_day, target_volume, actual_volume, completed_at)
                VALUES (?, ?, ?, ?, ?)
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, day.domainId());
            ps.setInt(2, day.day());
            ps.setInt(3, day.targetVolume());
            ps.setInt(4, day.actualVolume());
            setInstant(ps, 5, day.completedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(
                    e, "insert warm-up day " + day.day() + " for " + day.domainId(), LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<WarmupDay> findOpenDay(String domainId) {
        String sql = """
                SELECT domain_id, warmup_day, target_volume, actual_volume, completed_at
                FROM email_warmup
                WHERE domain_id = ? AND completed_at IS NULL
                ORDER BY warmup_day DESC
                LIMIT 1
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, domainId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new WarmupDay(
                        rs.getString("domain_id"),
                        rs.getInt("warmup_day"),
                        rs.getInt("target_volume"),
                        rs.getInt("actual_volume"),
                        getInstant(rs, "completed_at")));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find open warm-up day for " + domainId, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public int countDays(String domainId) {
        String sql = "SELECT COUNT(*) FROM email_warmup WHERE domain_id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, domainId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count warm-up days for " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void completeDay(String domainId, int day, int actualVolume, Instant completedAt) {
        String sql = """
                UPDATE email_warmup SET actual_volume = ?, completed_at = ?
                WHERE domain_id = ? AND warmup_day = ? AND completed_at IS NULL
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, actualVolume);
            setInstant(ps, 2, completedAt);
            ps.setString(3, domainId);
            ps.setInt(4, day);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "complete warm-up day " + day + " for " + domainId, LOG);
        }
    }

    @Override
    @Transactional
    public void incrementActual(String domainId, int day, int count) {
        String sql = """
                UPDATE email_warmup SET actual_volume = actual_volume + ?
                WHERE domain_id = ? AND warmup_day = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, count);
            ps.setString(2, domainId);
            ps.setInt(3, day);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "count warm-up volume for " + domainId, LOG);
        }
    }
}
