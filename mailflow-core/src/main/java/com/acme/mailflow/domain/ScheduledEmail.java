package com.acme.mailflow.domain;

import java.time.Instant;
import java.util.List;

public record ScheduledEmail(
    String id,
    String userId,
    String to,
    List<String> cc,
    List<String> bcc,
    String subject,
    String body,
    String html,
    ScheduledEmailStatus status,
    Instant scheduledAt,
    Instant sentAt,
    String error,
    ReplyMetadata metadata) {}
