package com.acme.mailflow.bounce;

import java.time.Instant;

/** An appended bounce; {@code messageLogId} and {@code domainId} may be null. */
public record BounceEvent(
    String recipientEmail,
    String messageLogId,
    String domainId,
    BounceType type,
    BounceCategory category,
    String reason,
    String rawResponse,
    Instant occurredAt) {}
