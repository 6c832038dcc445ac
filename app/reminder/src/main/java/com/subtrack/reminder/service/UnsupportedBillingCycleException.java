/*
 * Where: Reminder service layer
 * What: A subscription carries a billing cycle the engine cannot compute
 * Why: Configuration errors fail only the offending subscription
 */
package com.subtrack.reminder.service;

public class UnsupportedBillingCycleException extends RuntimeException {

  public UnsupportedBillingCycleException(String message) {
    super(message);
  }
}
