package com.acme.mailflow.processor.worker;

import com.acme.mailflow.domain.Campaign;
import com.acme.mailflow.domain.CampaignRecipient;
import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.RecipientStatus;
import com.acme.mailflow.jobs.TrackingEventJob;
import com.acme.mailflow.processor.bounce.BounceService;
import com.acme.mailflow.processor.queue.QueueJobHandler;
import com.acme.mailflow.processor.reputation.ReputationService;
import com.acme.mailflow.queue.Job;
import com.acme.mailflow.queue.JobResult;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.repository.CampaignRepository;
import com.acme.mailflow.repository.MessageLogRepository;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an open, click, reply, bounce or unsubscribe event to its message. Tracking is best
 * effort: a failing event is logged and dropped rather than retried.
 */
@Singleton
public class TrackingEventWorker implements QueueJobHandler<TrackingEventJob> {
  private static final Logger LOG = LoggerFactory.getLogger(TrackingEventWorker.class);

  private final MessageLogRepository messageLogs;
  private final CampaignRepository campaigns;
  private final ReputationService reputation;
  private final BounceService bounces;
  private final Clock clock;

  public TrackingEventWorker(
      MessageLogRepository messageLogs,
      CampaignRepository campaigns,
      ReputationService reputation,
      BounceService bounces,
      Clock clock) {
    this.messageLogs = messageLogs;
    this.campaigns = campaigns;
    this.reputation = reputation;
    this.bounces = bounces;
    this.clock = clock;
  }

  @Override
  public QueueName queue() {
    return QueueName.TRACKING_EVENTS;
  }

  @Override
  public Class<TrackingEventJob> payloadType() {
    return TrackingEventJob.class;
  }

  @Override
  public JobResult process(Job<TrackingEventJob> job) {
    TrackingEventJob p = job.payload();
    try {
      apply(p);
    } catch (Exception e) {
      LOG.error("Dropped tracking event type={} message={}: {}",
          p.eventType(), p.messageLogId(), e.getMessage(), e);
    }
    return JobResult.completed();
  }

  private void apply(TrackingEventJob p) {
    if (p.messageLogId() == null || p.eventType() == null) {
      throw new IllegalArgumentException("messageLogId and eventType are required");
    }
    Optional<MessageLog> found = messageLogs.findById(p.messageLogId());
    if (found.isEmpty()) {
      LOG.warn("Tracking event for unknown message {}", p.messageLogId());
      return;
    }
    MessageLog message = found.get();
    Map<String, Object> meta = p.meta() == null ? Map.of() : p.meta();
    Instant occurredAt = p.occurredAt() == null ? clock.instant() : p.occurredAt();
    messageLogs.insertTrackingEvent(message.id(), p.eventType(), meta, occurredAt);

    Optional<String> domainId =
        campaigns.findCampaign(message.campaignId()).map(Campaign::sendingDomainId);
    switch (p.eventType()) {
      case OPEN -> {
        messageLogs.incrementOpens(message.id());
        domainId.ifPresent(reputation::recordEmailOpened);
      }
      case CLICK -> {
        messageLogs.incrementClicks(message.id());
        domainId.ifPresent(reputation::recordEmailClicked);
      }
      case BOUNCE -> recordBounce(message, domainId.orElse(null), meta);
      case UNSUBSCRIBE -> {
        if (message.recipientId() != null) {
          campaigns.updateRecipientStatus(message.recipientId(), RecipientStatus.UNSUBSCRIBED, null);
        }
      }
      case REPLY -> LOG.debug("Reply recorded for message {}", message.id());
      default -> throw new IllegalArgumentException("Unsupported event type " + p.eventType());
    }
    LOG.info("Tracking event {} applied to message {}", p.eventType(), message.id());
  }

  private void recordBounce(MessageLog message, String domainId, Map<String, Object> meta) {
    Optional<String> email =
        Optional.ofNullable(message.recipientId())
            .flatMap(campaigns::findRecipient)
            .map(CampaignRecipient::email);
    if (email.isEmpty()) {
      LOG.warn("Bounce for message {} without a known recipient", message.id());
      return;
    }
    Object reason = meta.getOrDefault("reason", meta.getOrDefault("error", "bounce"));
    bounces.recordBounceFromError(email.get(), message.id(), domainId, String.valueOf(reason));
  }
}
