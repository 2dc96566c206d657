package com.acme.mailflow.jobs;

public record CampaignDispatchJob(String campaignId, String recipientId, int attempt) {}
