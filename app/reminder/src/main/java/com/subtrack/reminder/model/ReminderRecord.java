/*
 * Where: Reminder domain model
 * What: Snapshot of a reminders ledger row
 * Why: Shared by scheduling, delivery and the debug API
 */
package com.subtrack.reminder.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record ReminderRecord(
    UUID reminderId,
    UUID subscriptionId,
    String userId,
    LocalDate dueDateReferenced,
    int leadDays,
    Instant scheduledAt,
    ReminderChannel channel,
    String subject,
    String message,
    ReminderStatus status,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    int attemptCount,
    String lastError,
    String cancelReason,
    Instant createdAt,
    Instant sentAt,
    Instant canceledAt) {

  public ReminderKey key() {
    return new ReminderKey(subscriptionId, dueDateReferenced, leadDays);
  }
}
