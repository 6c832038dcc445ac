/*
 * Where: Reminder service layer
 * What: Claims due reminders and hands each one to the delivery channel under a timeout
 * Why: Only the ledger claim decides who sends, so overlapping runs never deliver twice
 */
package com.subtrack.reminder.service;

import com.google.common.annotations.VisibleForTesting;
import com.subtrack.reminder.config.DeliveryExecutorConfig;
import com.subtrack.reminder.config.ReminderDeliveryProperties;
import com.subtrack.reminder.model.DeliveryReport;
import com.subtrack.reminder.model.ReminderRecord;
import com.subtrack.reminder.repository.ReminderLedger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class ReminderDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(ReminderDeliveryService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final ReminderLedger ledger;
  private final ReminderSender sender;
  private final ReminderDeliveryProperties properties;
  private final ReminderMetrics metrics;
  private final Clock clock;
  private final ExecutorService executor;

  public ReminderDeliveryService(
      ReminderLedger ledger,
      ReminderSender sender,
      ReminderDeliveryProperties properties,
      ReminderMetrics metrics,
      Clock clock,
      @Qualifier(DeliveryExecutorConfig.DELIVERY_EXECUTOR) ExecutorService executor) {
    this.ledger = ledger;
    this.sender = sender;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.executor = executor;
  }

  /**
   * Claims one batch of due reminders and delivers them.
   *
   * <p>A {@link DataAccessException} from the claim propagates: without a claim nothing can be
   * delivered and the caller treats it as a systemic failure. Failures of individual sends are
   * released back to PENDING and retried by a later run.
   */
  public DeliveryReport deliverDue() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    // the claim is a single statement so slow sends never hold a database transaction
    final List<ReminderRecord> claimed =
        ledger.claimDue(now, properties.batchSize(), now.plus(properties.lease()), lockedBy);
    int sent = 0;
    int failed = 0;
    for (ReminderRecord reminder : claimed) {
      if (deliver(reminder, lockedBy)) {
        sent++;
      } else {
        failed++;
      }
    }
    refreshBacklog(now);
    return new DeliveryReport(claimed.size(), sent, failed);
  }

  @VisibleForTesting
  boolean deliver(ReminderRecord reminder, String lockedBy) {
    final Future<?> future;
    try {
      future = executor.submit(() -> sender.send(reminder));
    } catch (RejectedExecutionException ex) {
      handleFailure(reminder, lockedBy, "delivery executor rejected the send", ex);
      return false;
    }
    try {
      future.get(properties.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      handleFailure(
          reminder, lockedBy, "delivery timed out after " + properties.timeout(), ex);
      return false;
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      handleFailure(reminder, lockedBy, describe(cause), cause);
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      handleFailure(reminder, lockedBy, "delivery interrupted", ex);
      return false;
    }
    return markSent(reminder, lockedBy);
  }

  private boolean markSent(ReminderRecord reminder, String lockedBy) {
    final Instant sentAt = Instant.now(clock);
    final int updated;
    try {
      updated = ledger.markSent(reminder.reminderId(), sentAt, lockedBy);
    } catch (DataAccessException ex) {
      // the claim stays SENDING and is reclaimed after the lease, so this send may repeat
      logger.warn(
          "reminder sent but could not be recorded id={} subscriptionId={}",
          reminder.reminderId(),
          reminder.subscriptionId(),
          ex);
      metrics.recordDeliveryResult("unrecorded");
      return true;
    }
    if (updated == 0) {
      logger.warn(
          "reminder sent but claim was lost id={} subscriptionId={} dueDate={}",
          reminder.reminderId(),
          reminder.subscriptionId(),
          reminder.dueDateReferenced());
      metrics.recordDeliveryResult("claim_lost");
      return true;
    }
    metrics.recordDeliveryResult("sent");
    metrics.recordDeliveryLeadDelay(reminder.scheduledAt(), sentAt);
    logger.info(
        "reminder sent id={} subscriptionId={} dueDate={} leadDays={}",
        reminder.reminderId(),
        reminder.subscriptionId(),
        reminder.dueDateReferenced(),
        reminder.leadDays());
    return true;
  }

  @VisibleForTesting
  void handleFailure(ReminderRecord reminder, String lockedBy, String error, Throwable ex) {
    final int attempts = reminder.attemptCount() + 1;
    metrics.recordDeliveryResult("failed");
    int updated = 0;
    try {
      updated = ledger.releaseClaim(reminder.reminderId(), lockedBy, truncateError(error));
    } catch (DataAccessException releaseEx) {
      logger.warn(
          "reminder release failed, lease expiry will reclaim it id={}",
          reminder.reminderId(),
          releaseEx);
    }
    if (updated == 0) {
      logger.warn(
          "reminder release skipped because claim was lost id={} attempts={}",
          reminder.reminderId(),
          attempts);
    }
    if (attempts >= properties.failureAlertThreshold()) {
      metrics.recordRepeatedFailure();
      logger.error(
          "reminder delivery failing repeatedly id={} subscriptionId={} attempts={} error={}",
          reminder.reminderId(),
          reminder.subscriptionId(),
          attempts,
          error,
          ex);
      return;
    }
    logger.warn(
        "reminder delivery failed, will retry id={} subscriptionId={} attempts={} error={}",
        reminder.reminderId(),
        reminder.subscriptionId(),
        attempts,
        error,
        ex);
  }

  private void refreshBacklog(Instant now) {
    try {
      metrics.updateBacklogCurrent(ledger.countPendingDue(now));
    } catch (DataAccessException ex) {
      logger.warn("failed to refresh reminder backlog gauge", ex);
    }
  }

  private String describe(Throwable cause) {
    final String message = cause.getMessage();
    return message == null ? cause.getClass().getName() : message;
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
