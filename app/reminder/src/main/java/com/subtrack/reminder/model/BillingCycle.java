/*
 * Where: Reminder domain model
 * What: Billing cadences a subscription can be charged on
 * Why: Keeps the stored cycle text and the date arithmetic on one enum
 */
package com.subtrack.reminder.model;

import com.subtrack.reminder.service.UnsupportedBillingCycleException;
import java.util.Locale;

public enum BillingCycle {
  WEEKLY("weekly"),
  MONTHLY("monthly"),
  QUARTERLY("quarterly"),
  SEMIANNUAL("semiannual"),
  YEARLY("yearly"),
  CUSTOM("custom");

  private final String value;

  BillingCycle(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Months added per cycle, or 0 for day-based cadences. */
  public int months() {
    return switch (this) {
      case MONTHLY -> 1;
      case QUARTERLY -> 3;
      case SEMIANNUAL -> 6;
      case YEARLY -> 12;
      case WEEKLY, CUSTOM -> 0;
    };
  }

  public static BillingCycle fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new UnsupportedBillingCycleException("billing cycle is missing");
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "weekly" -> WEEKLY;
      case "monthly" -> MONTHLY;
      case "quarterly" -> QUARTERLY;
      case "semiannual", "semi_annual", "semi-annual" -> SEMIANNUAL;
      case "yearly", "annual", "annually" -> YEARLY;
      case "custom" -> CUSTOM;
      default -> throw new UnsupportedBillingCycleException("unsupported billing cycle: " + raw);
    };
  }
}
