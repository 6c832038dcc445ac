/*
 * Where: Reminder domain model
 * What: Summary of one scheduler run
 * Why: Returned to the worker and the debug API, and logged at the end of a run
 */
package com.subtrack.reminder.model;

import java.time.Instant;

public record SchedulerRunReport(
    String runId,
    SchedulerRunState state,
    int subscriptionsLoaded,
    int remindersCreated,
    int remindersExisting,
    int reconcileFailures,
    int remindersClaimed,
    int remindersSent,
    int deliveryFailures,
    Instant startedAt,
    Instant finishedAt,
    String error) {}
