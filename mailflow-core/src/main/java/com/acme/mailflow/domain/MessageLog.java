package com.acme.mailflow.domain;

import java.time.Instant;

public record MessageLog(
    String id,
    String campaignId,
    String recipientId,
    String followUpStepId,
    String userId,
    String subject,
    MessageLogStatus status,
    String providerMessageId,
    String threadId,
    int opens,
    int clicks,
    Instant sentAt,
    String error) {

  public static MessageLog processing(
      String id, String campaignId, String recipientId, String followUpStepId, String userId, String subject) {
    return new MessageLog(
        id, campaignId, recipientId, followUpStepId, userId, subject,
        MessageLogStatus.PROCESSING, null, null, 0, 0, null, null);
  }
}
