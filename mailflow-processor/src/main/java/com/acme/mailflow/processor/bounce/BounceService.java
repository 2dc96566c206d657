package com.acme.mailflow.processor.bounce;

import com.acme.mailflow.bounce.BounceClassification;
import com.acme.mailflow.bounce.BounceClassifier;
import com.acme.mailflow.bounce.BounceEvent;
import com.acme.mailflow.bounce.BounceType;
import com.acme.mailflow.bounce.ComplaintEvent;
import com.acme.mailflow.config.BounceConfig;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.RecipientStatus;
import com.acme.mailflow.processor.reputation.ReputationService;
import com.acme.mailflow.repository.BounceRepository;
import com.acme.mailflow.repository.CampaignRepository;
import com.acme.mailflow.repository.MessageLogRepository;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Records bounces and complaints, keeps domain reputation current and suppresses bad addresses. */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class BounceService {

  private final BounceRepository bounces;
  private final MessageLogRepository messageLogs;
  private final CampaignRepository campaigns;
  private final ReputationService reputation;
  private final BounceClassifier classifier;
  private final BounceConfig config;
  private final Clock clock;

  public BounceClassification parseBounceFromError(String rawError) {
    return classifier.classify(rawError);
  }

  /**
   * Appends the bounce and recalculates the sending domain. A hard bounce tied to a known message
   * suppresses that message's recipient.
   */
  @Transactional
  public void recordBounce(BounceEvent bounce) {
    bounces.insertBounce(bounce);
    log.info(
        "Recorded {} bounce ({}) for {} domain={}",
        bounce.type(),
        bounce.category(),
        bounce.recipientEmail(),
        bounce.domainId());

    if (bounce.domainId() != null) {
      reputation.recalculate(bounce.domainId());
    }
    if (bounce.type() == BounceType.HARD && bounce.messageLogId() != null) {
      suppressRecipientOf(bounce.messageLogId(), bounce.reason());
    }
  }

  /** Classifies a provider error and records it as a bounce. */
  @Transactional
  public BounceClassification recordBounceFromError(
      String recipientEmail, String messageLogId, String domainId, String rawError) {
    BounceClassification classification = classifier.classify(rawError);
    recordBounce(
        new BounceEvent(
            recipientEmail,
            messageLogId,
            domainId,
            classification.type(),
            classification.category(),
            classification.reason(),
            rawError,
            clock.instant()));
    return classification;
  }

  @Transactional
  public void recordComplaint(ComplaintEvent complaint) {
    bounces.insertComplaint(complaint);
    log.info("Recorded complaint ({}) for {} domain={}",
        complaint.feedbackType(), complaint.recipientEmail(), complaint.domainId());
    if (complaint.domainId() != null) {
      reputation.recalculate(complaint.domainId());
    }
  }

  /** True after one hard bounce or three soft bounces, optionally scoped to a sending domain. */
  @Transactional(readOnly = true)
  public boolean shouldSuppressEmail(String email, String domainId) {
    if (bounces.countBounces(email, domainId, BounceType.HARD) >= config.getHardBounceThreshold()) {
      return true;
    }
    return bounces.countBounces(email, domainId, BounceType.SOFT) >= config.getSoftBounceThreshold();
  }

  private void suppressRecipientOf(String messageLogId, String reason) {
    Optional<String> recipientId =
        messageLogs.findById(messageLogId).map(MessageLog::recipientId);
    if (recipientId.isEmpty()) {
      log.debug("Hard bounce for unknown message {}, nothing to suppress", messageLogId);
      return;
    }
    Optional<CampaignRecipient> recipient = campaigns.findRecipient(recipientId.get());
    if (recipient.map(r -> r.status() == RecipientStatus.SUPPRESSED).orElse(true)) {
      return;
    }
    campaigns.updateRecipientStatus(recipientId.get(), RecipientStatus.SUPPRESSED, reason);
    log.info("Suppressed recipient {} after hard bounce", recipientId.get());
  }
}
