package com.subtrack.reminder.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reminder.retention.enabled", havingValue = "true")
public class ReminderRetentionWorker {

  private final ReminderRetentionService retentionService;

  @Scheduled(fixedDelayString = "${reminder.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
