/*
 * Where: Reminder domain model
 * What: A reminder the policy requires, ready to be ensured in the ledger
 * Why: Carries the key together with the rendered content stored on creation
 */
package com.subtrack.reminder.model;

import java.time.Instant;
import java.time.LocalDate;

public record ReminderDraft(
    ReminderKey key,
    LocalDate scheduledOn,
    Instant scheduledAt,
    String userId,
    ReminderChannel channel,
    String subject,
    String message) {}
