/*
 * Where: Reminder application configuration binding
 * What: Delivery settings (claim batch, lease, per-send timeout, alerting threshold)
 * Why: Operational parameters are externalized per environment
 */
package com.subtrack.reminder.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reminder.delivery")
@Validated
public record ReminderDeliveryProperties(
    @Positive int batchSize,
    @NotNull Duration lease,
    @NotNull Duration timeout,
    @Positive int failureAlertThreshold,
    @Positive int errorMessageMaxLength,
    @Positive int executorThreads) {}
