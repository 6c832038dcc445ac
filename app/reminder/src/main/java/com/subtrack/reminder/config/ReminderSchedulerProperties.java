/*
 * Where: Reminder application configuration binding
 * What: Scheduler run settings: poll interval, lookahead window, lead-day bound, send time, channel
 * Why: The lookahead window must cover the largest lead time, checked at startup
 */
package com.subtrack.reminder.config;

import com.subtrack.reminder.model.ReminderChannel;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reminder.scheduler")
@Validated
public record ReminderSchedulerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int lookaheadDays,
    @PositiveOrZero int maxLeadDays,
    @NotNull Duration sendTimeOffset,
    @DefaultValue("EMAIL") @NotNull ReminderChannel channel) {

  private static final Duration ONE_DAY = Duration.ofDays(1);

  @AssertTrue(message = "reminder.scheduler.lookahead-days must be >= max-lead-days")
  public boolean isLookaheadCoveringLeadDays() {
    // a shorter window would load a subscription only after its earliest reminder was due
    return lookaheadDays >= maxLeadDays;
  }

  @AssertTrue(message = "reminder.scheduler.send-time-offset must be within [0, 24h)")
  public boolean isSendTimeOffsetWithinDay() {
    // null is reported by @NotNull
    return sendTimeOffset == null
        || (!sendTimeOffset.isNegative() && sendTimeOffset.compareTo(ONE_DAY) < 0);
  }
}
