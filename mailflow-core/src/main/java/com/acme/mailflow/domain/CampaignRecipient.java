package com.acme.mailflow.domain;

import java.time.Instant;
import java.util.Map;

/** {@code payload} carries the merge fields rendered into the campaign templates. */
public record CampaignRecipient(
    String id,
    String campaignId,
    String email,
    Map<String, Object> payload,
    RecipientStatus status,
    Instant lastSentAt,
    String lastError) {}
