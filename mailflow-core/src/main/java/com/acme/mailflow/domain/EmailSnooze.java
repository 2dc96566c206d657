package com.acme.mailflow.domain;

import java.time.Instant;
import java.util.List;

public record EmailSnooze(
    String id, String userId, String messageId, List<String> labelIds, Instant snoozeUntil) {}
