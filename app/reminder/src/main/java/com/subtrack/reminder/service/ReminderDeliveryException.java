/*
 * Where: Reminder service layer
 * What: Delivery of a claimed reminder failed or timed out
 * Why: Delivery failures are transient by contract and the reminder is retried on the next run
 */
package com.subtrack.reminder.service;

public class ReminderDeliveryException extends RuntimeException {

  public ReminderDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
