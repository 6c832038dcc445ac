/*
 * Where: Reminder service layer
 * What: Deletes old terminal reminders and processed payment ids
 * Why: Bound table growth while keeping PENDING/SENDING rows for investigation
 */
package com.subtrack.reminder.service;

import com.subtrack.reminder.config.ReminderRetentionProperties;
import com.subtrack.reminder.repository.ProcessedPaymentRepository;
import com.subtrack.reminder.repository.ReminderLedger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderRetentionService.class);

  private final ReminderLedger ledger;
  private final ProcessedPaymentRepository processedPaymentRepository;
  private final ReminderRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleActive = ledger.countStaleActive(threshold);
    if (staleActive > 0) {
      logger.error(
          "reminder retention found stale active reminders count={} threshold={}",
          staleActive,
          threshold);
    }
    final int deletedReminders = ledger.deleteTerminalOlderThan(threshold);
    final int deletedPayments = processedPaymentRepository.deleteOlderThan(threshold);
    logger.info(
        "reminder retention cleanup deleted reminders={} processedPayments={} threshold={}",
        deletedReminders,
        deletedPayments,
        threshold);
  }
}
