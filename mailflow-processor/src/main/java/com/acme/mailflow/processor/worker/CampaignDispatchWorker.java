package com.acme.mailflow.processor.worker;

import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.domain.Campaign;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.MessageLogStatus;
import com.acme.mailflow.domain.RecipientStatus;
import com.acme.mailflow.jobs.CampaignDispatchJob;
import com.acme.mailflow.processor.bounce.BounceService;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.reputation.ReputationService;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.processor.support.TemplateRenderer;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CampaignRepository;
import com.acme.mailflow.repository.MessageLogRepository;
import com.acme.mailflow.spi.MailSender;
import com.acme.mailflow.spi.OutgoingMail;
import com.acme.mailflow.spi.SentMail;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one campaign email to one recipient. Sending stops for a campaign whose domain falls out
 * of good standing, and suppressed addresses are never mailed.
 */
@Singleton
public class CampaignDispatchWorker implements QueueJobHandler<CampaignDispatchJob> {
  private static final Logger LOG = LoggerFactory.getLogger(CampaignDispatchWorker.class);

  private final CampaignRepository campaigns;
  private final MessageLogRepository messageLogs;
  private final MailSender sender;
  private final ReputationService reputation;
  private final BounceService bounces;
  private final CollaboratorInvoker invoker;
  private final Clock clock;

  public CampaignDispatchWorker(
      CampaignRepository campaigns,
      MessageLogRepository messageLogs,
      MailSender sender,
      ReputationService reputation,
      BounceService bounces,
      CollaboratorInvoker invoker,
      Clock clock) {
    this.campaigns = campaigns;
    this.messageLogs = messageLogs;
    this.sender = sender;
    this.reputation = reputation;
    this.bounces = bounces;
    this.invoker = invoker;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.CAMPAIGN_DISPATCH;
  }

  @Override
  public Class<CampaignDispatchJob> payloadType() {
    return CampaignDispatchJob.class;
  }

  static String messageLogId(String recipientId) {
    return "campaign-" + recipientId;
  }

  @Override
  public JobResult process(Job<CampaignDispatchJob> job) throws Exception {
    CampaignDispatchJob p = job.payload();
    if (p.campaignId() == null || p.recipientId() == null) {
      throw new IllegalArgumentException("campaignId and recipientId are required");
    }

    Optional<CampaignRecipient> foundRecipient = campaigns.findRecipient(p.recipientId());
    Optional<Campaign> foundCampaign = campaigns.findCampaign(p.campaignId());
    if (foundRecipient.isEmpty() || foundCampaign.isEmpty()) {
      LOG.warn("Campaign {} or recipient {} not found, skipping", p.campaignId(), p.recipientId());
      return JobResult.completed();
    }
    CampaignRecipient recipient = foundRecipient.get();
    Campaign campaign = foundCampaign.get();

    if (recipient.status() != RecipientStatus.PENDING) {
      LOG.info("Recipient {} already {}, skipping", recipient.id(), recipient.status());
      return JobResult.completed();
    }
    if (campaign.status().isHalted()) {
      LOG.info("Campaign {} is {}, recipient {} not sent", campaign.id(), campaign.status(), recipient.id());
      return JobResult.completed();
    }

    String domainId = campaign.sendingDomainId();
    if (domainId != null && !reputation.isDomainInGoodStanding(domainId)) {
      campaigns.pauseCampaign(campaign.id());
      LOG.warn("Sending domain {} is not in good standing, paused campaign {}", domainId, campaign.id());
      return JobResult.completed();
    }
    if (bounces.shouldSuppressEmail(recipient.email(), domainId)) {
      campaigns.updateRecipientStatus(
          recipient.id(), RecipientStatus.SUPPRESSED, "Suppressed after previous bounces");
      LOG.info("Recipient {} suppressed, address has bounced before", recipient.id());
      return JobResult.completed();
    }

    Map<String, Object> data = new HashMap<>();
    if (recipient.payload() != null) {
      data.putAll(recipient.payload());
    }
    data.putIfAbsent("email", recipient.email());
    String subject = TemplateRenderer.render(campaign.subjectTemplate(), data).trim();
    String html = TemplateRenderer.render(campaign.htmlTemplate(), data);
    if (subject.isEmpty()) {
      throw new PermanentException("Email subject is empty after rendering campaign " + campaign.id());
    }

    String logId = messageLogId(recipient.id());
    Optional<MessageLog> existing = messageLogs.findById(logId);
    if (existing.map(l -> l.status() == MessageLogStatus.SENT).orElse(false)) {
      LOG.info("Recipient {} was already mailed as {}, completing bookkeeping", recipient.id(), logId);
      markDelivered(campaign, recipient);
      return JobResult.completed();
    }
    if (existing.isEmpty()) {
      messageLogs.create(
          MessageLog.processing(logId, campaign.id(), recipient.id(), null, campaign.userId(), subject));
    }

    LOG.info("Sending campaign email campaign={} recipient={}", campaign.id(), recipient.id());
    SentMail sent;
    try {
      OutgoingMail mail = OutgoingMail.simple(campaign.userId(), recipient.email(), subject, html);
      sent = invoker.call("send campaign email to " + recipient.id(), () -> sender.send(mail));
    } catch (PermanentException e) {
      failPermanently(campaign, recipient, logId, e.getMessage());
      return JobResult.completed();
    }

    messageLogs.markSent(logId, sent.messageId(), sent.threadId(), clock.instant());
    markDelivered(campaign, recipient);
    if (domainId != null) {
      reputation.recordEmailSent(domainId);
    }
    LOG.info("Campaign email sent campaign={} recipient={} messageId={}",
        campaign.id(), recipient.id(), sent.messageId());
    return JobResult.completed();
  }

  @Override
  public void onExhausted(Job<CampaignDispatchJob> job, Exception error) {
    String recipientId = job.payload().recipientId();
    if (recipientId == null) {
      return;
    }
    campaigns.updateRecipientStatus(recipientId, RecipientStatus.FAILED, error.getMessage());
    if (messageLogs.findById(messageLogId(recipientId)).isPresent()) {
      messageLogs.markFailed(messageLogId(recipientId), error.getMessage());
    }
  }

  private void markDelivered(Campaign campaign, CampaignRecipient recipient) {
    campaigns.markRecipientSent(recipient.id(), clock.instant());
    campaigns.markCampaignRunning(campaign.id());
  }

  private void failPermanently(
      Campaign campaign, CampaignRecipient recipient, String logId, String error) {
    LOG.warn("Campaign email rejected campaign={} recipient={}: {}", campaign.id(), recipient.id(), error);
    messageLogs.markFailed(logId, error);
    campaigns.updateRecipientStatus(recipient.id(), RecipientStatus.FAILED, error);
    bounces.recordBounceFromError(recipient.email(), logId, campaign.sendingDomainId(), error);
  }
}
