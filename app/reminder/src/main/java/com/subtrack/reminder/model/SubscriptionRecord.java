/*
 * Where: Reminder domain model
 * What: Snapshot of a subscriptions row as read by the reminder engine
 * Why: Scheduler and advancer work on one immutable view of the collaborator data
 */
package com.subtrack.reminder.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record SubscriptionRecord(
    UUID subscriptionId,
    String userId,
    String name,
    BigDecimal amount,
    String currency,
    String billingCycle,
    Integer billingDay,
    Integer customIntervalDays,
    LocalDate nextBillingDate,
    LocalDate startDate,
    LocalDate endDate,
    boolean autoRenew,
    List<Integer> reminderLeadDays,
    boolean active) {

  public SubscriptionRecord {
    reminderLeadDays = reminderLeadDays == null ? List.of() : List.copyOf(reminderLeadDays);
  }

  // raw text stays on the record so an unknown cycle only fails the subscription that carries it
  public BillingCycle cycle() {
    return BillingCycle.fromValue(billingCycle);
  }

  public boolean endedBy(LocalDate date) {
    return endDate != null && date.isAfter(endDate);
  }

  public SubscriptionRecord withNextBillingDate(LocalDate date) {
    return new SubscriptionRecord(
        subscriptionId,
        userId,
        name,
        amount,
        currency,
        billingCycle,
        billingDay,
        customIntervalDays,
        date,
        startDate,
        endDate,
        autoRenew,
        reminderLeadDays,
        active);
  }

  public SubscriptionRecord deactivated() {
    return new SubscriptionRecord(
        subscriptionId,
        userId,
        name,
        amount,
        currency,
        billingCycle,
        billingDay,
        customIntervalDays,
        nextBillingDate,
        startDate,
        endDate,
        autoRenew,
        reminderLeadDays,
        false);
  }
}
