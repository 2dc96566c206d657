package com.acme.mailflow.jobs;

import java.time.Instant;

/** Tokens and profile captured by the OAuth callback, handed off for connection setup. */
public record CalendarConnectionSetupJob(
    String userId,
    Profile profile,
    String accessToken,
    String refreshToken,
    String scope,
    String tokenType,
    Instant expiryDate) {

  public record Profile(String email, String id, String name, String picture) {}
}
