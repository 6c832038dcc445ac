/*
 * Where: Reminder API model
 * What: Reminder list of one subscription
 * Why: Fix the debug response shape
 */
package com.subtrack.reminder.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionRemindersResponse(UUID subscriptionId, List<ReminderSummary> reminders) {
  public SubscriptionRemindersResponse {
    reminders = reminders == null ? List.of() : List.copyOf(reminders);
  }
}
