/*
 * Where: Digest dispatch cleanup worker
 * What: Triggers activity retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.example.dispatch.activity;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "digest.activity.retention.enabled", havingValue = "true")
public class ActivityRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(ActivityRetentionWorker.class);

  private final ActivityRetentionService retentionService;

  @Scheduled(fixedDelayString = "${digest.activity.retention.cleanup-interval:PT6H}")
  public void run() {
    try {
      retentionService.cleanup();
    } catch (RuntimeException ex) {
      logger.warn("worker activity retention cleanup failed", ex);
    }
  }
}
