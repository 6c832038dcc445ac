/*
 * Where: common configuration
 * What: Exposes a Clock bean zoned to the configured application time zone
 * Why: Due dates are calendar dates, so "today" must be resolved in one well-known zone
 */
package com.subtrack.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  static final String DEFAULT_TIME_ZONE = "Asia/Jakarta";

  @Bean
  public Clock clock(@Value("${subtrack.time-zone:" + DEFAULT_TIME_ZONE + "}") String timeZone) {
    // ZoneId.of fails fast on an unknown zone id so a typo never silently falls back to UTC
    return Clock.system(ZoneId.of(timeZone));
  }
}
