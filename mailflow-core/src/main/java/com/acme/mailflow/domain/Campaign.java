package com.acme.mailflow.domain;

public record Campaign(
    String id,
    String userId,
    String name,
    CampaignStatus status,
    String sendingDomainId,
    String subjectTemplate,
    String htmlTemplate) {}
