package com.acme.mailflow.jobs;

public record ScheduledEmailJob(String scheduledEmailId, String userId) {}
