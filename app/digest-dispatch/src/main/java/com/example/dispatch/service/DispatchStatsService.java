/*
 * どこで: Digest Dispatch サービス層
 * 何を: 直近の稼働履歴・7 日間の配信集計・依存先の疎通状況をまとめる
 * なぜ: 運用者が /stats 1 回で配信の健全性を判断できるようにするため
 */
package com.example.dispatch.service;

import com.example.dispatch.activity.WorkerActivityRepository;
import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.ledger.DeliveryAttemptRepository;
import com.example.dispatch.ledger.DeliveryLedger;
import com.example.dispatch.ledger.DeliverySummary;
import com.example.dispatch.recipient.RecipientDirectory;
import com.example.dispatch.service.DispatchStats.ComponentHealth;
import com.example.dispatch.service.DispatchStats.DeliveryAnalytics;
import com.example.dispatch.service.DispatchStats.RecentActivity;
import com.example.dispatch.service.DispatchStats.SystemHealth;
import com.example.dispatch.transport.NotificationTransport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
public class DispatchStatsService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchStatsService.class);
  private static final Duration ACTIVITY_LOOKBACK = Duration.ofHours(24);
  private static final Duration ANALYTICS_LOOKBACK = Duration.ofDays(7);
  private static final Duration CACHE_PROBE_TTL = Duration.ofSeconds(60);
  private static final String CACHE_PROBE_PREFIX = "digest:health:";

  private final WorkerActivityRepository activityRepository;
  private final DeliveryAttemptRepository attemptRepository;
  private final RecipientDirectory recipientDirectory;
  private final NotificationTransport transport;
  private final DeliveryLedger ledger;
  private final DispatchProperties properties;
  private final StatsAlertEvaluator alertEvaluator;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public DispatchStatsService(
      WorkerActivityRepository activityRepository,
      DeliveryAttemptRepository attemptRepository,
      RecipientDirectory recipientDirectory,
      NotificationTransport transport,
      DeliveryLedger ledger,
      DispatchProperties properties,
      StatsAlertEvaluator alertEvaluator,
      Clock clock,
      StringRedisTemplate redisTemplate) {
    this.activityRepository = activityRepository;
    this.attemptRepository = attemptRepository;
    this.recipientDirectory = recipientDirectory;
    this.transport = transport;
    this.ledger = ledger;
    this.properties = properties;
    this.alertEvaluator = alertEvaluator;
    this.clock = clock;
    this.redisTemplate = redisTemplate;
  }

  public DispatchStats collect() {
    final Instant now = Instant.now(clock);
    final DeliveryAnalytics analytics = deliveryAnalytics(now);
    final SystemHealth health = systemHealth();
    return new DispatchStats(
        properties.workerName(),
        recentActivity(now),
        analytics,
        health,
        ledger.writeFailures(),
        alertEvaluator.evaluate(analytics, health));
  }

  private RecentActivity recentActivity(Instant now) {
    try {
      return new RecentActivity(
          activityRepository.countByTypeSince(now.minus(ACTIVITY_LOOKBACK)), null);
    } catch (RuntimeException ex) {
      logger.warn("stats recent activity query failed", ex);
      return new RecentActivity(null, ex.getMessage());
    }
  }

  private DeliveryAnalytics deliveryAnalytics(Instant now) {
    try {
      final DeliverySummary summary = attemptRepository.summarizeSince(now.minus(ANALYTICS_LOOKBACK));
      return new DeliveryAnalytics(
          summary.total(), summary.sent(), summary.failed(), successRate(summary), null);
    } catch (RuntimeException ex) {
      logger.warn("stats delivery analytics query failed", ex);
      return new DeliveryAnalytics(0, 0, 0, 0.0d, ex.getMessage());
    }
  }

  private SystemHealth systemHealth() {
    final ComponentHealth dataStore = checkDataStore();
    final ComponentHealth transportHealth =
        ComponentHealth.of(transport.configured() ? "configured" : "not_configured");
    final ComponentHealth cache = checkCache();
    final boolean healthy = dataStore.healthy() && transportHealth.healthy() && cache.healthy();
    return new SystemHealth(dataStore, transportHealth, cache, healthy ? "healthy" : "degraded");
  }

  private ComponentHealth checkDataStore() {
    try {
      recipientDirectory.ping();
      return ComponentHealth.of("healthy");
    } catch (RuntimeException ex) {
      logger.warn("stats data store check failed", ex);
      return new ComponentHealth("unhealthy", ex.getMessage());
    }
  }

  private ComponentHealth checkCache() {
    final String key = CACHE_PROBE_PREFIX + UUID.randomUUID();
    final String value = Long.toString(Instant.now(clock).toEpochMilli());
    try {
      redisTemplate.opsForValue().set(key, value, CACHE_PROBE_TTL);
      final String read = redisTemplate.opsForValue().get(key);
      redisTemplate.delete(key);
      if (!value.equals(read)) {
        return new ComponentHealth("unhealthy", "cache read back a different value");
      }
      return ComponentHealth.of("healthy");
    } catch (RuntimeException ex) {
      logger.warn("stats cache self-test failed", ex);
      return new ComponentHealth("unhealthy", ex.getMessage());
    }
  }

  static double successRate(DeliverySummary summary) {
    if (summary.total() == 0) {
      return 0.0d;
    }
    // 小数第 1 位で丸めたパーセンテージ
    return Math.round(summary.sent() * 1000.0d / summary.total()) / 10.0d;
  }
}
