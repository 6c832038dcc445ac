package com.subtrack.reminder.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.advance")
public record ReminderAdvanceProperties(boolean enabled, Duration pollInterval) {}
