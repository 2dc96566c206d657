package com.acme.mailflow.jobs;

public record SnoozeRestoreJob(String snoozeId, String messageId, String userId) {}
