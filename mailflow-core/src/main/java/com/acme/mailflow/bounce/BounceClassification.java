package com.acme.mailflow.bounce;

public record BounceClassification(BounceType type, BounceCategory category, String reason) {}
