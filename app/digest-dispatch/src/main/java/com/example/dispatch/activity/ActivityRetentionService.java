/*
 * Where: Digest dispatch activity layer
 * What: Applies retention policy for worker_activity_log
 * Why: Prevent unbounded growth of run history
 */
package com.example.dispatch.activity;

import com.example.dispatch.config.ActivityRetentionProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(ActivityRetentionService.class);

  private final WorkerActivityRepository repository;
  private final ActivityRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = repository.deleteOlderThan(threshold);
    logger.info("worker activity retention cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }
}
