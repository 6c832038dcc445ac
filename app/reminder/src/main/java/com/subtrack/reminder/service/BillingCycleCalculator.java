/*
 * Where: Reminder service layer
 * What: Computes the next due date of a subscription from an anchor date
 * Why: All due-date arithmetic lives in one pure component
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.model.BillingCycle;
import com.subtrack.reminder.model.SubscriptionRecord;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Calendar-date only billing arithmetic.
 *
 * <p>Month based cadences re-apply {@code billingDay} on every step and clamp it to the length of
 * the target month, so a day-31 subscription goes Jan 31, Feb 28 (29), Mar 31, Apr 30 and never
 * drifts to an earlier day. When {@code billingDay} is absent the anchor's day of month is used.
 */
@Component
public class BillingCycleCalculator {

  private static final int MAX_DAY_OF_MONTH = 31;

  public LocalDate nextDueDate(SubscriptionRecord subscription, LocalDate anchor) {
    return nextDueDate(
        subscription.subscriptionId(),
        anchor,
        subscription.cycle(),
        subscription.billingDay(),
        subscription.customIntervalDays());
  }

  public LocalDate nextDueDate(
      LocalDate anchor, BillingCycle cycle, Integer billingDay, Integer customIntervalDays) {
    return nextDueDate(null, anchor, cycle, billingDay, customIntervalDays);
  }

  private LocalDate nextDueDate(
      UUID subscriptionId,
      LocalDate anchor,
      BillingCycle cycle,
      Integer billingDay,
      Integer customIntervalDays) {
    if (anchor == null) {
      throw new InvalidSubscriptionException(subscriptionId, "anchor date is missing");
    }
    if (cycle == null) {
      throw new UnsupportedBillingCycleException("billing cycle is missing");
    }
    return switch (cycle) {
      case WEEKLY -> anchor.plusDays(7);
      case CUSTOM -> anchor.plusDays(requireInterval(subscriptionId, customIntervalDays));
      case MONTHLY, QUARTERLY, SEMIANNUAL, YEARLY ->
          plusMonthsClamped(anchor, cycle.months(), resolveDay(subscriptionId, anchor, billingDay));
    };
  }

  private LocalDate plusMonthsClamped(LocalDate anchor, int months, int dayOfMonth) {
    final YearMonth target = YearMonth.from(anchor).plusMonths(months);
    return target.atDay(Math.min(dayOfMonth, target.lengthOfMonth()));
  }

  private int resolveDay(UUID subscriptionId, LocalDate anchor, Integer billingDay) {
    if (billingDay == null) {
      return anchor.getDayOfMonth();
    }
    if (billingDay < 1 || billingDay > MAX_DAY_OF_MONTH) {
      throw new InvalidSubscriptionException(
          subscriptionId, "billing day must be within 1..31 billingDay=" + billingDay);
    }
    return billingDay;
  }

  private int requireInterval(UUID subscriptionId, Integer customIntervalDays) {
    if (customIntervalDays == null || customIntervalDays <= 0) {
      throw new InvalidSubscriptionException(
          subscriptionId,
          "custom cycle requires a positive interval customIntervalDays=" + customIntervalDays);
    }
    return customIntervalDays;
  }
}
