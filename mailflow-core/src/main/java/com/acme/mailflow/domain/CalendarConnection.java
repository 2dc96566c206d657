package com.acme.mailflow.domain;

import java.time.Instant;
import java.util.List;

/**
 * A connected calendar account. {@code cadenceMinutes} null or non-positive disables periodic
 * sync.
 */
public record CalendarConnection(
    String id,
    String userId,
    String provider,
    String accountEmail,
    String calendarId,
    String timeZone,
    Integer cadenceMinutes,
    Instant lastSyncedAt,
    List<String> calendars,
    boolean hasCredential) {}
