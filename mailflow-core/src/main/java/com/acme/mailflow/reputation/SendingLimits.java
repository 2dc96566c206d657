package com.acme.mailflow.reputation;

public record SendingLimits(int dailyLimit, int hourlyLimit, boolean warmup) {}
