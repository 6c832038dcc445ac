package com.subtrack.reminder.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.subtrack.reminder.model.ReminderChannel;
import com.subtrack.reminder.model.ReminderRecord;
import com.subtrack.reminder.model.ReminderStatus;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderSummary(
    UUID reminderId,
    LocalDate dueDateReferenced,
    int leadDays,
    Instant scheduledAt,
    ReminderChannel channel,
    ReminderStatus status,
    int attemptCount,
    String subject,
    String message,
    String lastError,
    String cancelReason,
    Instant createdAt,
    Instant sentAt,
    Instant canceledAt) {

  static ReminderSummary from(ReminderRecord record) {
    return new ReminderSummary(
        record.reminderId(),
        record.dueDateReferenced(),
        record.leadDays(),
        record.scheduledAt(),
        record.channel(),
        record.status(),
        record.attemptCount(),
        record.subject(),
        record.message(),
        record.lastError(),
        record.cancelReason(),
        record.createdAt(),
        record.sentAt(),
        record.canceledAt());
  }
}
