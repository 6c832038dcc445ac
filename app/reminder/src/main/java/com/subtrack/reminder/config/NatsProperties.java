/*
 * Where: Reminder application configuration binding
 * What: NATS connection settings
 * Why: Switch the broker endpoint per environment
 */
package com.subtrack.reminder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
