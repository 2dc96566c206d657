package com.acme.mailflow.reputation;

/** Rates are percentages (0-100); score is 0-100. */
public record ReputationMetrics(
    double bounceRate, double complaintRate, double openRate, double clickRate, int score) {}
