package com.acme.mailflow.domain;

import java.time.Instant;
import java.util.List;

/**
 * Follow-up nudges for an invitee who has not booked yet. Send {@code n} goes out {@code
 * schedulePlanMinutes[n]} minutes after {@code activationAt}. {@code bookingUrl} is null when the
 * meeting type has no booking link.
 */
public record MeetingReminder(
    String id,
    String userId,
    String meetingTypeId,
    String meetingName,
    String inviteeEmail,
    String inviteeName,
    String bookingUrl,
    ReminderStatus status,
    int sendCount,
    int maxSends,
    List<Integer> schedulePlanMinutes,
    Instant activationAt,
    Instant nextSendAt,
    Instant lastSentAt,
    String lastError) {}
