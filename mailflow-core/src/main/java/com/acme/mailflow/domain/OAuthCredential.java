package com.acme.mailflow.domain;

import java.time.Instant;

public record OAuthCredential(
    String userId,
    String provider,
    String accessToken,
    String refreshToken,
    String scope,
    String tokenType,
    Instant expiresAt) {}
