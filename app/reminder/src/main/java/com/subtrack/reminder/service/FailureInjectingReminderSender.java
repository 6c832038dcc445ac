/*
 * Where: Reminder service layer
 * What: CI/test-only sender that fails deliveries for matching user ids
 * Why: Reproduce release-and-retry and the repeated failure alert end to end
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.model.ReminderRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "reminder.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingReminderSender implements ReminderSender {

  private final LocalReminderSender delegate;

  @Value("${reminder.delivery.failure-injection.user-id-prefix:}")
  private String userIdPrefix;

  @Override
  public void send(ReminderRecord reminder) {
    if (matches(reminder.userId())) {
      throw new ReminderDeliveryException(
          "reminder delivery failure injection matched userId=" + reminder.userId(), null);
    }
    delegate.send(reminder);
  }

  private boolean matches(String userId) {
    if (userIdPrefix == null || userIdPrefix.isBlank() || userId == null) {
      return false;
    }
    return userId.startsWith(userIdPrefix);
  }
}
