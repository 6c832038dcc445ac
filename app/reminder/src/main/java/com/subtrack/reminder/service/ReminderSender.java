/*
 * Where: Reminder service layer
 * What: Delivery channel abstraction for a single reminder
 * Why: Real channels and test doubles can be swapped without touching delivery control
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.model.ReminderRecord;

public interface ReminderSender {

  /** Delivers one reminder. Any exception means the delivery did not happen. */
  void send(ReminderRecord reminder);
}
