/*
 * Where: Reminder domain model
 * What: Deduplication key of a reminder instance
 * Why: At most one non-canceled reminder exists per key
 */
package com.subtrack.reminder.model;

import java.time.LocalDate;
import java.util.UUID;

public record ReminderKey(UUID subscriptionId, LocalDate dueDateReferenced, int leadDays) {}
