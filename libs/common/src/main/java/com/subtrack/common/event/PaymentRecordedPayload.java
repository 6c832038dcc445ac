/*
 * Where: common event payload definitions
 * What: JSON shape of the payment.recorded event published by the payment collaborator
 * Why: Publisher and reminder service share one payload contract
 */
package com.subtrack.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PaymentRecordedPayload(
    String paymentId,
    String subscriptionId,
    String paymentDate,
    BigDecimal amount,
    String currency,
    String status) {

  public static final String STATUS_PAID = "paid";

  public boolean isPaid() {
    return STATUS_PAID.equalsIgnoreCase(status);
  }
}
