/*
 * Where: Reminder debug API
 * What: Lists a subscription's reminders and triggers a scheduler run on demand
 * Why: Verify reconciliation and delivery during development without waiting for the worker
 */
package com.subtrack.reminder.api;

import com.subtrack.reminder.model.AdvanceOutcome;
import com.subtrack.reminder.model.SchedulerRunReport;
import com.subtrack.reminder.repository.ReminderLedger;
import com.subtrack.reminder.service.CycleAdvancerService;
import com.subtrack.reminder.service.SchedulerRunService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/reminders")
@RequiredArgsConstructor
public class ReminderDebugController {

  private final ReminderLedger ledger;
  private final SchedulerRunService schedulerRunService;
  private final CycleAdvancerService cycleAdvancerService;

  @GetMapping("/subscriptions/{subscriptionId}")
  public SubscriptionRemindersResponse reminders(
      @PathVariable("subscriptionId") UUID subscriptionId) {
    final List<ReminderSummary> items =
        ledger.findBySubscriptionId(subscriptionId).stream().map(ReminderSummary::from).toList();
    return new SubscriptionRemindersResponse(subscriptionId, items);
  }

  @PostMapping("/run")
  public SchedulerRunReport run() {
    return schedulerRunService.run();
  }

  @PostMapping("/subscriptions/{subscriptionId}/advance")
  public AdvanceResponse advance(@PathVariable("subscriptionId") UUID subscriptionId) {
    final AdvanceOutcome outcome = cycleAdvancerService.advanceAfterPayment(subscriptionId);
    return new AdvanceResponse(subscriptionId, outcome);
  }
}
