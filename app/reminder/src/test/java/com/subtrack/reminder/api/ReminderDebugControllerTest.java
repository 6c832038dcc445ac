/*
 * Where: Reminder debug API unit test
 * What: Maps ledger rows and service results into the snake_case debug responses
 * Why: The debug API is the manual verification path for reconciliation and delivery
 */
package com.subtrack.reminder.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.subtrack.reminder.model.AdvanceOutcome;
import com.subtrack.reminder.model.ReminderChannel;
import com.subtrack.reminder.model.ReminderRecord;
import com.subtrack.reminder.model.ReminderStatus;
import com.subtrack.reminder.model.SchedulerRunReport;
import com.subtrack.reminder.model.SchedulerRunState;
import com.subtrack.reminder.repository.ReminderLedger;
import com.subtrack.reminder.service.CycleAdvancerService;
import com.subtrack.reminder.service.SchedulerRunService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReminderDebugControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-10T03:00:00Z");
  private static final UUID SUBSCRIPTION_ID =
      UUID.fromString("22222222-2222-2222-2222-222222222222");

  @Mock private ReminderLedger ledger;
  @Mock private SchedulerRunService schedulerRunService;
  @Mock private CycleAdvancerService cycleAdvancerService;

  @Test
  void remindersListsLedgerRowsForSubscription() throws Exception {
    final ReminderRecord record =
        new ReminderRecord(
            UUID.randomUUID(),
            SUBSCRIPTION_ID,
            "user-1",
            LocalDate.of(2026, 3, 13),
            3,
            Instant.parse("2026-03-10T02:00:00Z"),
            ReminderChannel.EMAIL,
            "Netflix subscription reminder",
            "Your Netflix subscription will be renewed in 3 days on 2026-03-13 for IDR 186,000.",
            ReminderStatus.SENT,
            null,
            null,
            null,
            1,
            null,
            null,
            FIXED_NOW,
            FIXED_NOW,
            null);
    when(ledger.findBySubscriptionId(SUBSCRIPTION_ID)).thenReturn(List.of(record));

    final SubscriptionRemindersResponse response = controller().reminders(SUBSCRIPTION_ID);

    assertThat(response.subscriptionId()).isEqualTo(SUBSCRIPTION_ID);
    assertThat(response.reminders()).hasSize(1);
    final ReminderSummary summary = response.reminders().get(0);
    assertThat(summary.reminderId()).isEqualTo(record.reminderId());
    assertThat(summary.status()).isEqualTo(ReminderStatus.SENT);
    assertThat(summary.leadDays()).isEqualTo(3);

    final ObjectMapper mapper =
        new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    final String json = mapper.writeValueAsString(response);
    assertThat(json).contains("\"subscription_id\"", "\"due_date_referenced\":\"2026-03-13\"");
    assertThat(json).contains("\"lead_days\":3", "\"attempt_count\":1");
  }

  @Test
  void runDelegatesToSchedulerAndReturnsReport() {
    final SchedulerRunReport report =
        new SchedulerRunReport(
            "run-1", SchedulerRunState.DONE, 2, 3, 1, 0, 1, 1, 0, FIXED_NOW, FIXED_NOW, null);
    when(schedulerRunService.run()).thenReturn(report);

    assertThat(controller().run()).isSameAs(report);
  }

  @Test
  void advanceReturnsOutcomeForSubscription() {
    when(cycleAdvancerService.advanceAfterPayment(SUBSCRIPTION_ID))
        .thenReturn(AdvanceOutcome.ADVANCED);

    final AdvanceResponse response = controller().advance(SUBSCRIPTION_ID);

    assertThat(response.subscriptionId()).isEqualTo(SUBSCRIPTION_ID);
    assertThat(response.outcome()).isEqualTo(AdvanceOutcome.ADVANCED);
  }

  private ReminderDebugController controller() {
    return new ReminderDebugController(ledger, schedulerRunService, cycleAdvancerService);
  }
}
