package com.acme.mailflow.jobs;

import com.acme.mailflow.domain.FollowUpCondition;
import java.time.Instant;

public record FollowUpDispatchJob(
    String followUpSequenceId,
    String followUpStepId,
    String recipientId,
    Instant scheduledAt,
    int attempt,
    FollowUpCondition condition,
    boolean stopOnReply,
    boolean stopOnOpen) {}
