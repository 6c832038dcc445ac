package com.subtrack.reminder.model;

/**
 * Outcome of an idempotent ledger upsert: the surviving record and whether this call created it.
 * A stale result carries no record: the subscription was no longer on the draft's due date, so
 * nothing was created.
 */
public record EnsureResult(ReminderRecord record, boolean created) {

  private static final EnsureResult STALE = new EnsureResult(null, false);

  public static EnsureResult stale() {
    return STALE;
  }

  public boolean isStale() {
    return record == null;
  }
}
