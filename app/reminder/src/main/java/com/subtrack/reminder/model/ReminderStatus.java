/*
 * Where: Reminder domain model
 * What: Ledger states of a reminder
 * Why: Keeps the DB status column and the processing logic in sync
 */
package com.subtrack.reminder.model;

public enum ReminderStatus {
  PENDING,
  SENDING,
  SENT,
  CANCELED
}
