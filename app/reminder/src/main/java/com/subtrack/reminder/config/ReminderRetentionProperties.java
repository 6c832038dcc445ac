/*
 * Where: Reminder application configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.subtrack.reminder.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.retention")
public record ReminderRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
