package com.acme.mailflow.repository;

import com.acme.mailflow.domain.MeetingReminder;
import com.acme.mailflow.domain.ReminderStatus;
import java.time.Instant;
import java.util.Optional;

public interface MeetingReminderRepository {

  Optional<MeetingReminder> findById(String id);

  boolean hasConfirmedBooking(String meetingTypeId, String inviteeEmail);

  void markCompleted(String id);

  void markFailed(String id, String error, Instant at);

  /** Keeps the reminder scheduled and stores the error of a failed attempt. */
  void recordError(String id, String error, Instant at);

  void recordSend(String id, int sendCount, Instant sentAt, Instant nextSendAt, ReminderStatus status);
}
