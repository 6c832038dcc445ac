/*
 * Where: Reminder cycle advance worker
 * What: Periodically catches up lapsed auto-renew subscriptions
 * Why: Auto-renewing subscriptions move on without a payment event
 */
package com.subtrack.reminder.service;

import java.time.Clock;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "reminder.advance.enabled", havingValue = "true", matchIfMissing = true)
public class CycleAdvanceWorker {

  private final CycleAdvancerService cycleAdvancerService;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${reminder.advance.poll-interval}")
  public void run() {
    cycleAdvancerService.advanceLapsedAutoRenewals(LocalDate.now(clock));
  }
}
