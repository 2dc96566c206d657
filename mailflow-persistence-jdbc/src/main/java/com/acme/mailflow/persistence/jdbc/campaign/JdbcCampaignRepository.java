package com.acme.mailflow.persistence.jdbc.campaign;

import static com.acme.mailflow.persistence.jdbc.JdbcValues.getInstant;
import static com.acme.mailflow.persistence.jdbc.JdbcValues.setInstant;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.domain.Campaign;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.CampaignStatus;
import com.acme.mailflow.domain.FollowUpStep;
import com.acme.mailflow.domain.RecipientStatus;
import com.acme.mailflow.persistence.jdbc.ExceptionTranslator;
import com.acme.mailflow.repository.CampaignRepository;
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
public class JdbcCampaignRepository implements CampaignRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcCampaignRepository.class);

    private final DataSource dataSource;

    public JdbcCampaignRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Campaign> findCampaign(String id) {
        String sql = """
                SELECT id, user_id, name, status, sending_domain_id, subject_template, html_template
                FROM campaign WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Campaign(
                        rs.getString("id"),
                        rs.getString("user_id"),
                        rs.getString("name"),
                        CampaignStatus.valueOf(rs.getString("status")),
                        rs.getString("sending_domain_id"),
                        rs.getString("subject_template"),
                        rs.getString("html_template")));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find campaign " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CampaignRecipient> findRecipient(String id) {
        String sql = """
                SELECT id, campaign_id, email, payload, status, last_sent_at, last_error
                FROM campaign_recipient WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CampaignRecipient(
                        rs.getString("id"),
                        rs.getString("campaign_id"),
                        rs.getString("email"),
                        Jsons.toMap(rs.getString("payload")),
                        RecipientStatus.valueOf(rs.getString("status")),
                        getInstant(rs, "last_sent_at"),
                        rs.getString("last_error")));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find recipient " + id, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FollowUpStep> findFollowUpStep(String id) {
        String sql = """
                SELECT id, sequence_id, campaign_id, subject_template, html_template, send_as_reply
                FROM follow_up_step WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new FollowUpStep(
                        rs.getString("id"),
                        rs.getString("sequence_id"),
                        rs.getString("campaign_id"),
                        rs.getString("subject_template"),
                        rs.getString("html_template"),
                        rs.getBoolean("send_as_reply")));
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find follow-up step " + id, LOG);
        }
    }

    @Override
    @Transactional
    public void markRecipientSent(String recipientId, Instant sentAt) {
        String sql = """
                UPDATE campaign_recipient SET status = 'SENT', last_sent_at = ?, last_error = NULL
                WHERE id = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            setInstant(ps, 1, sentAt);
            ps.setString(2, recipientId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "mark recipient sent " + recipientId, LOG);
        }
    }

    @Override
    @Transactional
    public void updateRecipientStatus(String recipientId, RecipientStatus status, String error) {
        String sql = "UPDATE campaign_recipient SET status = ?, last_error = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, error);
            ps.setString(3, recipientId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update recipient status " + recipientId, LOG);
        }
    }

    @Override
    @Transactional
    public void markCampaignRunning(String campaignId) {
        updateCampaignStatus(campaignId, CampaignStatus.SCHEDULED, CampaignStatus.RUNNING);
    }

    @Override
    @Transactional
    public void pauseCampaign(String campaignId) {
        updateCampaignStatus(campaignId, CampaignStatus.RUNNING, CampaignStatus.PAUSED);
        updateCampaignStatus(campaignId, CampaignStatus.SCHEDULED, CampaignStatus.PAUSED);
    }

    private void updateCampaignStatus(String campaignId, CampaignStatus from, CampaignStatus to) {
        String sql = """
                UPDATE campaign SET status = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND status = ?
                """;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, to.name());
            ps.setString(2, campaignId);
            ps.setString(3, from.name());
            if (ps.executeUpdate() == 1) {
                LOG.info("Campaign {} moved {} -> {}", campaignId, from, to);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update campaign status " + campaignId, LOG);
        }
    }
}
