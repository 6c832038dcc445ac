/*
 * Where: Reminder service layer
 * What: Subscription data violates an engine invariant (negative lead days, due date before start...)
 * Why: Bad data is rejected at the boundary instead of being coerced
 */
package com.subtrack.reminder.service;

import java.util.UUID;

public class InvalidSubscriptionException extends RuntimeException {

  private final UUID subscriptionId;

  public InvalidSubscriptionException(UUID subscriptionId, String message) {
    super(message + " subscriptionId=" + subscriptionId);
    this.subscriptionId = subscriptionId;
  }

  public UUID subscriptionId() {
    return subscriptionId;
  }
}
