/*
 * Where: Digest dispatch configuration binding
 * What: Holds worker activity retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.dispatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "digest.activity.retention")
public record ActivityRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {

  public ActivityRetentionProperties {
    retentionDays = retentionDays <= 0 ? 7 : retentionDays;
    cleanupInterval = cleanupInterval == null ? Duration.ofHours(6) : cleanupInterval;
  }
}
