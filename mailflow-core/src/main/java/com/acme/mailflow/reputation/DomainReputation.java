package com.acme.mailflow.reputation;

import java.time.Instant;

/** Deliverability counters and derived metrics of one sending domain. */
public record DomainReputation(
    String domainId,
    long totalSent,
    long totalDelivered,
    long totalBounced,
    long totalComplained,
    long totalOpened,
    long totalClicked,
    double bounceRate,
    double complaintRate,
    double openRate,
    double clickRate,
    int reputationScore,
    boolean inWarmup,
    Instant warmupStartedAt,
    Instant lastCalculatedAt) {}
