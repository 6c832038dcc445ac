/*
 * Where: Reminder scheduler worker
 * What: Triggers a scheduler run on a fixed delay
 * Why: Runs never overlap within one process; other processes are handled by the ledger
 */
package com.subtrack.reminder.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "reminder.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReminderSchedulerWorker {

  private final SchedulerRunService schedulerRunService;

  @Scheduled(fixedDelayString = "${reminder.scheduler.poll-interval}")
  public void run() {
    schedulerRunService.run();
  }
}
