package com.acme.mailflow.repository;

import com.acme.mailflow.domain.Campaign;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.FollowUpStep;
import com.acme.mailflow.domain.RecipientStatus;
import java.time.Instant;
import java.util.Optional;

public interface CampaignRepository {

  Optional<Campaign> findCampaign(String id);

  Optional<CampaignRecipient> findRecipient(String id);

  Optional<FollowUpStep> findFollowUpStep(String id);

  void markRecipientSent(String recipientId, Instant sentAt);

  void updateRecipientStatus(String recipientId, RecipientStatus status, String error);

  /** SCHEDULED to RUNNING; no-op in any other state. */
  void markCampaignRunning(String campaignId);

  void pauseCampaign(String campaignId);
}
