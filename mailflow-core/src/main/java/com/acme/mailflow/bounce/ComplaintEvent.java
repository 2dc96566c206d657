package com.acme.mailflow.bounce;

import java.time.Instant;

public record ComplaintEvent(
    String recipientEmail,
    String messageLogId,
    String domainId,
    String feedbackType,
    String userAgent,
    Instant occurredAt) {}
