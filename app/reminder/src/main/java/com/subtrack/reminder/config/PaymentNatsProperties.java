/*
 * Where: Reminder application configuration binding
 * What: JetStream settings for the payment.recorded subscription
 * (subject/stream/durable/duplicate-window/ack-wait/max-deliver)
 * Why: Redelivery windows are tuned per environment and validated at startup
 */
package com.subtrack.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reminder.payment-nats")
@Validated
public record PaymentNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "reminder.payment-nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "reminder.payment-nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // @Positive does not apply to Duration, so zero and negative values are rejected here
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
