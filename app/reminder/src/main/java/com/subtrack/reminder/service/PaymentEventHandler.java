/*
 * Where: Reminder service layer
 * What: Applies a paid payment.recorded event: dedupe by payment id, then advance the paid cycle
 * Why: JetStream delivers at least once; the dedupe row and the advance commit together
 */
package com.subtrack.reminder.service;

import com.subtrack.common.event.PaymentRecordedPayload;
import com.subtrack.reminder.model.AdvanceOutcome;
import com.subtrack.reminder.repository.ProcessedPaymentRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PaymentEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(PaymentEventHandler.class);

  private final ProcessedPaymentRepository processedPaymentRepository;
  private final CycleAdvancerService cycleAdvancerService;
  private final Clock clock;

  /** @return empty when the payment was already processed or is not in paid status */
  @Transactional
  public Optional<AdvanceOutcome> handlePaymentRecorded(PaymentRecordedPayload payload) {
    final UUID paymentId = parseId(payload.paymentId(), "payment_id");
    final UUID subscriptionId = parseId(payload.subscriptionId(), "subscription_id");
    if (!payload.isPaid()) {
      // not recorded, so the same payment id still advances once it arrives as paid
      logger.info(
          "payment event without paid status ignored paymentId={} status={}",
          paymentId,
          payload.status());
      return Optional.empty();
    }
    if (!processedPaymentRepository.insertIfAbsent(paymentId, Instant.now(clock))) {
      logger.info("duplicate payment event ignored paymentId={}", paymentId);
      return Optional.empty();
    }
    try {
      final AdvanceOutcome outcome = cycleAdvancerService.advanceAfterPayment(subscriptionId);
      logger.info(
          "payment applied paymentId={} subscriptionId={} outcome={}",
          paymentId,
          subscriptionId,
          outcome);
      return Optional.of(outcome);
    } catch (InvalidSubscriptionException | UnsupportedBillingCycleException ex) {
      // the subscription row is broken; redelivery cannot fix it
      throw new PaymentEventPermanentException(
          "payment cannot advance subscription subscriptionId=" + subscriptionId, ex);
    }
  }

  private UUID parseId(String raw, String field) {
    try {
      return UUID.fromString(raw);
    } catch (RuntimeException ex) {
      throw new PaymentEventPermanentException("invalid payment event " + field, ex);
    }
  }
}
