package com.acme.mailflow.jobs;

public record MeetingReminderJob(String reminderId, int attempt) {}
