/*
 * Where: Reminder service layer
 * What: Moves a subscription to its next due date and retires reminders of the old one
 * Why: A stale reminder must never be delivered once its due date is no longer current
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.model.AdvanceOutcome;
import com.subtrack.reminder.model.SubscriptionRecord;
import com.subtrack.reminder.repository.ReminderLedger;
import com.subtrack.reminder.repository.SubscriptionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Advances billing cycles after a recorded payment or when an auto-renewing subscription has
 * lapsed past its due date.
 *
 * <p>The date update is conditional on the previously read due date, so concurrent advancers of
 * one subscription serialize on the database row. A lost update is re-read and retried once.
 */
@Service
public class CycleAdvancerService {

  private static final Logger logger = LoggerFactory.getLogger(CycleAdvancerService.class);
  private static final int MAX_ATTEMPTS = 2;
  static final String REASON_CYCLE_ADVANCED = "cycle advanced";
  static final String REASON_SUBSCRIPTION_ENDED = "subscription ended";

  private final SubscriptionStore subscriptionStore;
  private final ReminderLedger ledger;
  private final BillingCycleCalculator calculator;
  private final ReminderMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  public CycleAdvancerService(
      SubscriptionStore subscriptionStore,
      ReminderLedger ledger,
      BillingCycleCalculator calculator,
      ReminderMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.subscriptionStore = subscriptionStore;
    this.ledger = ledger;
    this.calculator = calculator;
    this.metrics = metrics;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /** Advances exactly one cycle from the stored next billing date. */
  public AdvanceOutcome advanceAfterPayment(UUID subscriptionId) {
    final AdvanceOutcome outcome = advance(subscriptionId, null);
    metrics.recordCycleAdvance(outcome.metricValue());
    return outcome;
  }

  /**
   * Catches up every active auto-renew subscription whose due date lies before {@code today}.
   * Failures are isolated per subscription.
   */
  public Map<AdvanceOutcome, Integer> advanceLapsedAutoRenewals(LocalDate today) {
    final Map<AdvanceOutcome, Integer> outcomes = new EnumMap<>(AdvanceOutcome.class);
    for (SubscriptionRecord subscription : subscriptionStore.listLapsedAutoRenew(today)) {
      try {
        final AdvanceOutcome outcome = advance(subscription.subscriptionId(), today);
        metrics.recordCycleAdvance(outcome.metricValue());
        outcomes.merge(outcome, 1, Integer::sum);
      } catch (InvalidSubscriptionException | UnsupportedBillingCycleException ex) {
        metrics.recordCycleAdvance("invalid");
        logger.warn(
            "lapsed renewal rejected subscriptionId={} reason={}",
            subscription.subscriptionId(),
            ex.getMessage());
      } catch (RuntimeException ex) {
        metrics.recordCycleAdvance("error");
        logger.warn("lapsed renewal failed subscriptionId={}", subscription.subscriptionId(), ex);
      }
    }
    if (!outcomes.isEmpty()) {
      logger.info("lapsed renewals processed today={} outcomes={}", today, outcomes);
    }
    return outcomes;
  }

  private AdvanceOutcome advance(UUID subscriptionId, @Nullable LocalDate catchUpTo) {
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      final Optional<SubscriptionRecord> found = subscriptionStore.findById(subscriptionId);
      if (found.isEmpty()) {
        logger.warn("cycle advance target not found subscriptionId={}", subscriptionId);
        return AdvanceOutcome.NOT_FOUND;
      }
      final SubscriptionRecord subscription = found.get();
      if (!subscription.active()) {
        return AdvanceOutcome.SKIPPED;
      }
      if (catchUpTo != null && !subscription.nextBillingDate().isBefore(catchUpTo)) {
        // another writer already caught up
        return AdvanceOutcome.SKIPPED;
      }
      final Optional<AdvanceOutcome> applied = apply(subscription, catchUpTo);
      if (applied.isPresent()) {
        return applied.get();
      }
      logger.info(
          "cycle advance lost a concurrent update subscriptionId={} attempt={}",
          subscriptionId,
          attempt);
    }
    logger.warn("cycle advance gave up after conflicts subscriptionId={}", subscriptionId);
    return AdvanceOutcome.CONFLICT;
  }

  /** @return empty when the conditional write lost against another writer */
  private Optional<AdvanceOutcome> apply(
      SubscriptionRecord subscription, @Nullable LocalDate catchUpTo) {
    final UUID subscriptionId = subscription.subscriptionId();
    final LocalDate oldDate = subscription.nextBillingDate();
    final List<LocalDate> retired = new ArrayList<>();
    retired.add(oldDate);
    LocalDate newDate = calculator.nextDueDate(subscription, oldDate);
    while (catchUpTo != null && newDate.isBefore(catchUpTo) && !subscription.endedBy(newDate)) {
      retired.add(newDate);
      newDate = calculator.nextDueDate(subscription, newDate);
    }
    final Instant now = Instant.now(clock);

    if (subscription.endedBy(newDate)) {
      final boolean deactivated =
          Boolean.TRUE.equals(
              transactionTemplate.execute(
                  status -> {
                    if (!subscriptionStore.deactivate(subscriptionId)) {
                      return false;
                    }
                    ledger.cancelAllPending(subscriptionId, REASON_SUBSCRIPTION_ENDED, now);
                    return true;
                  }));
      if (!deactivated) {
        return Optional.empty();
      }
      logger.info(
          "subscription deactivated at end date subscriptionId={} endDate={} lastDueDate={}",
          subscriptionId,
          subscription.endDate(),
          oldDate);
      return Optional.of(AdvanceOutcome.DEACTIVATED);
    }

    final LocalDate target = newDate;
    // date move and stale reminder cancellation commit together
    final boolean advanced =
        Boolean.TRUE.equals(
            transactionTemplate.execute(
                status -> {
                  if (!subscriptionStore.updateNextBillingDate(subscriptionId, oldDate, target)) {
                    return false;
                  }
                  for (LocalDate dueDate : retired) {
                    ledger.cancelPendingForDueDate(
                        subscriptionId, dueDate, REASON_CYCLE_ADVANCED, now);
                  }
                  return true;
                }));
    if (!advanced) {
      return Optional.empty();
    }
    logger.info(
        "subscription cycle advanced subscriptionId={} from={} to={}",
        subscriptionId,
        oldDate,
        target);
    return Optional.of(AdvanceOutcome.ADVANCED);
  }
}
