package com.acme.mailflow.domain;

public record FollowUpStep(
    String id,
    String sequenceId,
    String campaignId,
    String subjectTemplate,
    String htmlTemplate,
    boolean sendAsReply) {}
