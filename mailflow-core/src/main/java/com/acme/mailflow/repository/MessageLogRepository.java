package com.acme.mailflow.repository;

import com.acme.mailflow.domain.MessageLog;
import com.acme.mailflow.domain.TrackingEventType;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public interface MessageLogRepository {

  void create(MessageLog log);

  Optional<MessageLog> findById(String id);

  /** Latest SENT log of a recipient, used to thread follow-ups. */
  Optional<MessageLog> findLatestSent(String recipientId);

  void markSent(String id, String providerMessageId, String threadId, Instant sentAt);

  void markFailed(String id, String error);

  void insertTrackingEvent(
      String messageLogId, TrackingEventType type, Map<String, Object> meta, Instant occurredAt);

  void incrementOpens(String messageLogId);

  void incrementClicks(String messageLogId);

  /** True when any message sent to the recipient has a tracking event of the given type. */
  boolean hasTrackingEvent(String recipientId, TrackingEventType type);
}
