/*
 * Where: Reminder service layer
 * What: A payment event that can never be processed
 * Why: Used to TERM the JetStream message instead of redelivering it
 */
package com.subtrack.reminder.service;

public class PaymentEventPermanentException extends RuntimeException {

  public PaymentEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
