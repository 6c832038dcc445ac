/*
 * Where: Reminder repository layer
 * What: Durable, idempotent record of reminders keyed by (subscription, due date, lead days)
 * Why: All cross-run and cross-process coordination goes through these atomic operations
 */
package com.subtrack.reminder.repository;

import com.subtrack.reminder.model.EnsureResult;
import com.subtrack.reminder.model.ReminderDraft;
import com.subtrack.reminder.model.ReminderRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface ReminderLedger {

  /**
   * Atomic upsert on the reminder key. Returns the existing non-canceled record unchanged, or
   * creates a PENDING one. Implemented as a single conditional insert, never check-then-insert.
   *
   * <p>A record is only created while the subscription is active and its next billing date still
   * equals the draft's due date. Otherwise {@link EnsureResult#stale()} is returned, so a caller
   * working from an old snapshot cannot revive reminders an advance has already canceled.
   */
  EnsureResult ensureExists(ReminderDraft draft, Instant now);

  /**
   * Claims PENDING reminders due at {@code now} (and SENDING ones whose lease expired) for {@code
   * lockedBy}. A record is returned to at most one concurrent caller.
   */
  List<ReminderRecord> claimDue(Instant now, int limit, Instant leaseUntil, String lockedBy);

  /** SENDING -> SENT for the lock holder. No-op (0) on any other state. */
  int markSent(UUID reminderId, Instant sentAt, String lockedBy);

  /** SENDING -> PENDING for the lock holder, counting the failed attempt. */
  int releaseClaim(UUID reminderId, String lockedBy, String error);

  /** PENDING/SENDING -> CANCELED. No-op (0) on terminal records. */
  int markCanceled(UUID reminderId, String reason, Instant canceledAt);

  int cancelPendingForDueDate(
      UUID subscriptionId, LocalDate dueDateReferenced, String reason, Instant canceledAt);

  int cancelAllPending(UUID subscriptionId, String reason, Instant canceledAt);

  List<ReminderRecord> findBySubscriptionId(UUID subscriptionId);

  int countPendingDue(Instant now);

  int countStaleActive(Instant threshold);

  int deleteTerminalOlderThan(Instant threshold);
}
