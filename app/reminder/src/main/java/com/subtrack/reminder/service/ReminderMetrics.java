/*
 * Where: Reminder service layer
 * What: Records scheduler, delivery and cycle advancement metrics
 * Why: Run health, delivery latency and backlog are observable from Prometheus directly
 */
package com.subtrack.reminder.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class ReminderMetrics {

  static final String METRIC_SCHEDULER_RUN_TOTAL = "reminder.scheduler.run.total";
  static final String METRIC_RECONCILE_TOTAL = "reminder.reconcile.total";
  static final String METRIC_DELIVERY_TOTAL = "reminder.delivery.total";
  static final String METRIC_REPEATED_FAILURE_TOTAL = "reminder.delivery.repeated_failure.total";
  static final String METRIC_DELIVERY_LEAD_DELAY = "reminder.delivery.lead.delay";
  static final String METRIC_BACKLOG_CURRENT = "reminder.backlog.current";
  static final String METRIC_CYCLE_ADVANCE_TOTAL = "reminder.cycle.advance.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter repeatedFailureCounter;
  private final Timer deliveryLeadDelayTimer;

  public ReminderMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("PENDING reminders already due at the last delivery pass")
        .register(meterRegistry);
    this.repeatedFailureCounter =
        Counter.builder(METRIC_REPEATED_FAILURE_TOTAL)
            .description("Deliveries failing at or above the alert threshold")
            .register(meterRegistry);
    this.deliveryLeadDelayTimer =
        Timer.builder(METRIC_DELIVERY_LEAD_DELAY)
            .description("Delay between a reminder's scheduled_at and its sent_at")
            .register(meterRegistry);
  }

  public void recordSchedulerRun(String result) {
    increment(METRIC_SCHEDULER_RUN_TOTAL, "Scheduler run outcomes", "result", result);
  }

  public void recordReconcileResult(String result) {
    increment(METRIC_RECONCILE_TOTAL, "Per-subscription reconcile outcomes", "result", result);
  }

  public void recordDeliveryResult(String result) {
    increment(METRIC_DELIVERY_TOTAL, "Reminder delivery outcomes", "result", result);
  }

  public void recordCycleAdvance(String outcome) {
    increment(METRIC_CYCLE_ADVANCE_TOTAL, "Billing cycle advancement outcomes", "outcome", outcome);
  }

  public void recordRepeatedFailure() {
    repeatedFailureCounter.increment();
  }

  public void recordDeliveryLeadDelay(Instant scheduledAt, Instant sentAt) {
    if (scheduledAt == null || sentAt == null || sentAt.isBefore(scheduledAt)) {
      return;
    }
    deliveryLeadDelayTimer.record(Duration.between(scheduledAt, sentAt));
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + '|' + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
