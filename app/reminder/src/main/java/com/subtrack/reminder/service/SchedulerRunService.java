/*
 * Where: Reminder service layer
 * What: One scheduler pass: load due subscriptions, reconcile the ledger, deliver due reminders
 * Why: Every pass converges the ledger, so a missed or killed run is repaired by the next one
 */
package com.subtrack.reminder.service;

import com.subtrack.common.TraceIds;
import com.subtrack.reminder.config.ReminderSchedulerProperties;
import com.subtrack.reminder.model.DeliveryReport;
import com.subtrack.reminder.model.EnsureResult;
import com.subtrack.reminder.model.ReminderDraft;
import com.subtrack.reminder.model.SchedulerRunReport;
import com.subtrack.reminder.model.SchedulerRunState;
import com.subtrack.reminder.model.SubscriptionRecord;
import com.subtrack.reminder.repository.ReminderLedger;
import com.subtrack.reminder.repository.SubscriptionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SchedulerRunService {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerRunService.class);
  static final String MDC_RUN_ID = "run_id";

  private final SubscriptionStore subscriptionStore;
  private final ReminderLedger ledger;
  private final ReminderPolicy policy;
  private final ReminderDeliveryService deliveryService;
  private final ReminderSchedulerProperties properties;
  private final ReminderMetrics metrics;
  private final Clock clock;

  public SchedulerRunReport run() {
    final Run run = new Run(TraceIds.newTraceId(), Instant.now(clock));
    MDC.put(MDC_RUN_ID, run.runId);
    try {
      return execute(run);
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private SchedulerRunReport execute(Run run) {
    final LocalDate today = LocalDate.now(clock);
    final List<SubscriptionRecord> subscriptions;
    try {
      subscriptions =
          subscriptionStore.listDueWithin(today, today.plusDays(properties.lookaheadDays()));
    } catch (DataAccessException ex) {
      return fail(run, "subscription store unavailable while loading", ex);
    }
    run.subscriptionsLoaded = subscriptions.size();

    run.transitionTo(SchedulerRunState.RECONCILING);
    for (SubscriptionRecord subscription : subscriptions) {
      reconcile(run, subscription, today);
    }

    run.transitionTo(SchedulerRunState.DELIVERING);
    final DeliveryReport delivery;
    try {
      delivery = deliveryService.deliverDue();
    } catch (DataAccessException ex) {
      return fail(run, "reminder ledger unavailable while claiming", ex);
    }
    run.remindersClaimed = delivery.claimed();
    run.remindersSent = delivery.sent();
    run.deliveryFailures = delivery.failed();

    run.transitionTo(SchedulerRunState.DONE);
    metrics.recordSchedulerRun("done");
    final SchedulerRunReport report = run.report(Instant.now(clock), null);
    logger.info(
        "reminder scheduler run finished runId={} loaded={} created={} existing={}"
            + " reconcileFailures={} claimed={} sent={} deliveryFailures={}",
        report.runId(),
        report.subscriptionsLoaded(),
        report.remindersCreated(),
        report.remindersExisting(),
        report.reconcileFailures(),
        report.remindersClaimed(),
        report.remindersSent(),
        report.deliveryFailures());
    return report;
  }

  private void reconcile(Run run, SubscriptionRecord subscription, LocalDate today) {
    try {
      final List<ReminderDraft> drafts = policy.requiredReminders(subscription, today);
      for (ReminderDraft draft : drafts) {
        final EnsureResult result = ledger.ensureExists(draft, run.startedAt);
        if (result.isStale()) {
          // advanced or deactivated after this run loaded it; the next run sees the new date
          metrics.recordReconcileResult("stale");
          logger.info(
              "reminder reconcile skipped moved subscription subscriptionId={} dueDate={}",
              subscription.subscriptionId(),
              draft.key().dueDateReferenced());
          return;
        }
        if (result.created()) {
          run.remindersCreated++;
        } else {
          run.remindersExisting++;
        }
      }
      metrics.recordReconcileResult("ok");
    } catch (InvalidSubscriptionException | UnsupportedBillingCycleException ex) {
      run.reconcileFailures++;
      metrics.recordReconcileResult("invalid");
      logger.warn(
          "reminder reconcile rejected subscription subscriptionId={} reason={}",
          subscription.subscriptionId(),
          ex.getMessage());
    } catch (RuntimeException ex) {
      run.reconcileFailures++;
      metrics.recordReconcileResult("error");
      logger.warn(
          "reminder reconcile failed subscriptionId={}", subscription.subscriptionId(), ex);
    }
  }

  private SchedulerRunReport fail(Run run, String reason, DataAccessException ex) {
    run.transitionTo(SchedulerRunState.FAILED);
    metrics.recordSchedulerRun("failed");
    logger.error(
        "reminder scheduler run failed runId={} reason={}", run.runId, reason, ex);
    return run.report(Instant.now(clock), reason + ": " + ex.getMessage());
  }

  /** Mutable bookkeeping of a single pass. Confined to the calling thread. */
  private static final class Run {

    private final String runId;
    private final Instant startedAt;
    private SchedulerRunState state = SchedulerRunState.LOADING;
    private int subscriptionsLoaded;
    private int remindersCreated;
    private int remindersExisting;
    private int reconcileFailures;
    private int remindersClaimed;
    private int remindersSent;
    private int deliveryFailures;

    private Run(String runId, Instant startedAt) {
      this.runId = runId;
      this.startedAt = startedAt;
    }

    private void transitionTo(SchedulerRunState next) {
      if (!state.canTransitionTo(next)) {
        throw new IllegalStateException(
            "illegal scheduler run transition from=" + state + " to=" + next);
      }
      state = next;
    }

    private SchedulerRunReport report(Instant finishedAt, String error) {
      return new SchedulerRunReport(
          runId,
          state,
          subscriptionsLoaded,
          remindersCreated,
          remindersExisting,
          reconcileFailures,
          remindersClaimed,
          remindersSent,
          deliveryFailures,
          startedAt,
          finishedAt,
          error);
    }
  }
}
