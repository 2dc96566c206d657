package com.acme.mailflow.jobs;

import java.time.Instant;
import java.util.List;

public record CalendarSyncJob(
    String userId, String connectionId, Instant start, Instant end, List<String> calendars) {}
