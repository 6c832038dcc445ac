/*
 * Where: Reminder domain model
 * What: Result of one cycle advancement attempt
 * Why: Callers log and count outcomes without inspecting exceptions
 */
package com.subtrack.reminder.model;

import java.util.Locale;

public enum AdvanceOutcome {
  ADVANCED,
  DEACTIVATED,
  SKIPPED,
  NOT_FOUND,
  CONFLICT;

  public String metricValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
