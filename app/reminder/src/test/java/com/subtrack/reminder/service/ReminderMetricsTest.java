package com.subtrack.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ReminderMetricsTest {

  @Test
  void recordsRunDeliveryAdvanceAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderMetrics metrics = new ReminderMetrics(registry);

    metrics.recordSchedulerRun("done");
    metrics.recordSchedulerRun("done");
    metrics.recordReconcileResult("invalid");
    metrics.recordDeliveryResult("sent");
    metrics.recordDeliveryLeadDelay(
        Instant.parse("2026-03-10T02:00:00Z"), Instant.parse("2026-03-10T02:00:30Z"));
    metrics.recordRepeatedFailure();
    metrics.recordCycleAdvance("advanced");
    metrics.updateBacklogCurrent(7);

    assertThat(registry.get("reminder.scheduler.run.total").tag("result", "done").counter().count())
        .isEqualTo(2.0d);
    assertThat(registry.get("reminder.reconcile.total").tag("result", "invalid").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("reminder.delivery.total").tag("result", "sent").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("reminder.delivery.lead.delay").timer().count()).isEqualTo(1L);
    assertThat(registry.get("reminder.delivery.repeated_failure.total").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry.get("reminder.cycle.advance.total").tag("outcome", "advanced").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("reminder.backlog.current").gauge().value()).isEqualTo(7.0d);
  }

  @Test
  void ignoresDelayWhenSentBeforeScheduled() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderMetrics metrics = new ReminderMetrics(registry);

    metrics.recordDeliveryLeadDelay(
        Instant.parse("2026-03-10T02:00:00Z"), Instant.parse("2026-03-10T01:00:00Z"));
    metrics.updateBacklogCurrent(-3);

    assertThat(registry.get("reminder.delivery.lead.delay").timer().count()).isZero();
    assertThat(registry.get("reminder.backlog.current").gauge().value()).isZero();
  }
}
