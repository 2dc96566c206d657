package com.acme.mailflow.jobs;

import com.acme.mailflow.domain.TrackingEventType;
import java.time.Instant;
import java.util.Map;

public record TrackingEventJob(
    String messageLogId, TrackingEventType eventType, Map<String, Object> meta, Instant occurredAt) {}
