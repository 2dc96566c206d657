package com.acme.mailflow.processor.worker;

import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.domain.Campaign;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.FollowUpCondition;
import com.acme.mailflow.domain.FollowUpStep;
import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.MessageLogStatus;
import com.acme.mailflow.domain.RecipientStatus;
import com.acme.mailflow.domain.TrackingEventType;
import com.acme.mailflow.jobs.FollowUpDispatchJob;
import com.acme.mailflow.processor.bounce.BounceService;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.reputation.ReputationService;
import com.acme.mailflow.processor.support.CollaboratorInvoker;
import com.acme.mailflow.processor.support.ReplyThreading;
import com.acme.mailflow.processor.support.ReplyThreading.ReplyThread;
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
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a follow-up step to a recipient unless its send condition rules it out. Engagement is
 * judged over every message the recipient has received from the campaign. The same standing and
 * suppression gates as the first campaign email apply.
 */
@Singleton
public class FollowUpDispatchWorker implements QueueJobHandler<FollowUpDispatchJob> {
  private static final Logger LOG = LoggerFactory.getLogger(FollowUpDispatchWorker.class);

  static final String DEFAULT_SUBJECT = "Checking in";

  private static final Set<RecipientStatus> UNREACHABLE =
      EnumSet.of(RecipientStatus.UNSUBSCRIBED, RecipientStatus.BOUNCED, RecipientStatus.SUPPRESSED);

  private final CampaignRepository campaigns;
  private final MessageLogRepository messageLogs;
  private final MailSender sender;
  private final ReplyThreading threading;
  private final ReputationService reputation;
  private final BounceService bounces;
  private final CollaboratorInvoker invoker;
  private final Clock clock;

  public FollowUpDispatchWorker(
      CampaignRepository campaigns,
      MessageLogRepository messageLogs,
      MailSender sender,
      ReplyThreading threading,
      ReputationService reputation,
      BounceService bounces,
      CollaboratorInvoker invoker,
      Clock clock) {
    this.campaigns = campaigns;
    this.messageLogs = messageLogs;
    this.sender = sender;
    this.threading = threading;
    this.reputation = reputation;
    this.bounces = bounces;
    this.invoker = invoker;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.FOLLOW_UP_DISPATCH;
  }

  @Override
  public Class<FollowUpDispatchJob> payloadType() {
    return FollowUpDispatchJob.class;
  }

  static String messageLogId(String stepId, String recipientId) {
    return "follow-up-" + stepId + "-" + recipientId;
  }

  @Override
  public JobResult process(Job<FollowUpDispatchJob> job) throws Exception {
    FollowUpDispatchJob p = job.payload();
    if (p.followUpStepId() == null || p.recipientId() == null) {
      throw new IllegalArgumentException("followUpStepId and recipientId are required");
    }

    Optional<FollowUpStep> foundStep = campaigns.findFollowUpStep(p.followUpStepId());
    Optional<CampaignRecipient> foundRecipient = campaigns.findRecipient(p.recipientId());
    if (foundStep.isEmpty() || foundRecipient.isEmpty()) {
      LOG.warn("Follow-up step {} or recipient {} not found, skipping", p.followUpStepId(), p.recipientId());
      return JobResult.completed();
    }
    FollowUpStep step = foundStep.get();
    CampaignRecipient recipient = foundRecipient.get();
    Optional<Campaign> campaign = campaigns.findCampaign(step.campaignId());
    if (campaign.isEmpty() || campaign.get().status().isHalted()) {
      LOG.info("Campaign {} is not sending, follow-up {} skipped", step.campaignId(), step.id());
      return JobResult.completed();
    }
    if (UNREACHABLE.contains(recipient.status())) {
      LOG.info("Recipient {} is {}, follow-up {} skipped", recipient.id(), recipient.status(), step.id());
      return JobResult.completed();
    }

    Optional<String> skipReason = skipReason(p, recipient.id());
    if (skipReason.isPresent()) {
      LOG.info("Skipping follow-up {} for recipient {}: {}", step.id(), recipient.id(), skipReason.get());
      return JobResult.completed();
    }
    String domainId = campaign.get().sendingDomainId();
    if (domainId != null && !reputation.isDomainInGoodStanding(domainId)) {
      campaigns.pauseCampaign(step.campaignId());
      LOG.warn("Sending domain {} is not in good standing, paused campaign {}", domainId, step.campaignId());
      return JobResult.completed();
    }
    if (bounces.shouldSuppressEmail(recipient.email(), domainId)) {
      campaigns.updateRecipientStatus(
          recipient.id(), RecipientStatus.SUPPRESSED, "Suppressed after previous bounces");
      LOG.info("Recipient {} suppressed, follow-up {} not sent", recipient.id(), step.id());
      return JobResult.completed();
    }

    String logId = messageLogId(step.id(), recipient.id());
    Optional<MessageLog> existing = messageLogs.findById(logId);
    if (existing.map(l -> l.status() == MessageLogStatus.SENT).orElse(false)) {
      LOG.info("Follow-up {} already sent to recipient {}", step.id(), recipient.id());
      return JobResult.completed();
    }

    Map<String, Object> data = new HashMap<>();
    if (recipient.payload() != null) {
      data.putAll(recipient.payload());
    }
    data.putIfAbsent("email", recipient.email());
    String template =
        step.subjectTemplate() == null || step.subjectTemplate().isBlank()
            ? DEFAULT_SUBJECT
            : step.subjectTemplate();
    String subject = TemplateRenderer.render(template, data).trim();
    String html = TemplateRenderer.render(step.htmlTemplate(), data);
    String userId = campaign.get().userId();

    String threadId = null;
    Map<String, String> headers = Map.of();
    Optional<MessageLog> parent =
        step.sendAsReply() ? messageLogs.findLatestSent(recipient.id()) : Optional.empty();
    Optional<ReplyThread> thread = parent.flatMap(m -> replyThread(userId, m));
    if (thread.isPresent()) {
      threadId = thread.get().threadId();
      headers = thread.get().headers();
      String original = parent.get().subject();
      subject = ReplyThreading.replySubject(original == null || original.isBlank() ? subject : original);
    } else if (step.sendAsReply() && subject.regionMatches(true, 0, "Re: ", 0, 4)) {
      LOG.warn("Follow-up {} cannot be threaded for recipient {}, sending as new email", step.id(), recipient.id());
      subject = subject.substring(4);
    }

    if (existing.isEmpty()) {
      messageLogs.create(
          MessageLog.processing(logId, step.campaignId(), recipient.id(), step.id(), userId, subject));
    }
    OutgoingMail mail =
        new OutgoingMail(userId, recipient.email(), List.of(), List.of(), subject, html, headers, threadId);
    SentMail sent;
    try {
      sent = invoker.call("send follow-up to " + recipient.id(), () -> sender.send(mail));
    } catch (PermanentException e) {
      LOG.warn("Follow-up {} rejected for recipient {}: {}", step.id(), recipient.id(), e.getMessage());
      messageLogs.markFailed(logId, e.getMessage());
      campaigns.updateRecipientStatus(recipient.id(), RecipientStatus.FAILED, e.getMessage());
      bounces.recordBounceFromError(recipient.email(), logId, domainId, e.getMessage());
      return JobResult.completed();
    }
    messageLogs.markSent(logId, sent.messageId(), sent.threadId(), clock.instant());
    if (domainId != null) {
      reputation.recordEmailSent(domainId);
    }

    LOG.info("Follow-up {} sent to recipient {} messageId={} reply={}",
        step.id(), recipient.id(), sent.messageId(), thread.isPresent());
    return JobResult.completed();
  }

  @Override
  public void onExhausted(Job<FollowUpDispatchJob> job, Exception error) {
    FollowUpDispatchJob p = job.payload();
    if (p.followUpStepId() == null || p.recipientId() == null) {
      return;
    }
    campaigns.updateRecipientStatus(p.recipientId(), RecipientStatus.FAILED, error.getMessage());
    String logId = messageLogId(p.followUpStepId(), p.recipientId());
    if (messageLogs.findById(logId).isPresent()) {
      messageLogs.markFailed(logId, error.getMessage());
    }
  }

  private Optional<String> skipReason(FollowUpDispatchJob p, String recipientId) {
    FollowUpCondition condition = p.condition() == null ? FollowUpCondition.ALWAYS : p.condition();
    if ((p.stopOnReply() || condition == FollowUpCondition.IF_NOT_REPLIED)
        && messageLogs.hasTrackingEvent(recipientId, TrackingEventType.REPLY)) {
      return Optional.of("recipient replied");
    }
    if ((p.stopOnOpen() || condition == FollowUpCondition.IF_NOT_OPENED)
        && messageLogs.hasTrackingEvent(recipientId, TrackingEventType.OPEN)) {
      return Optional.of("recipient opened");
    }
    if (condition == FollowUpCondition.IF_NOT_CLICKED
        && messageLogs.hasTrackingEvent(recipientId, TrackingEventType.CLICK)) {
      return Optional.of("recipient clicked");
    }
    return Optional.empty();
  }

  private Optional<ReplyThread> replyThread(String userId, MessageLog parent) {
    if (parent.providerMessageId() == null) {
      return Optional.empty();
    }
    return threading.resolve(userId, parent.threadId(), parent.providerMessageId());
  }
}
