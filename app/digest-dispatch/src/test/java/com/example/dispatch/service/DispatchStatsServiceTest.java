/*
 * どこで: 統計収集のユニットテスト
 * 何を: 集計値・成功率の丸め・依存先の疎通結果と部分失敗時の縮退を検証する
 * なぜ: 一部の依存先が落ちていても /stats が応答を返すことを担保するため
 */
package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.example.dispatch.activity.WorkerActivityRepository;
import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.config.StatsAlertProperties;
import com.example.dispatch.ledger.DeliveryAttemptRepository;
import com.example.dispatch.ledger.DeliveryLedger;
import com.example.dispatch.ledger.DeliverySummary;
import com.example.dispatch.recipient.RecipientDirectory;
import com.example.dispatch.transport.NotificationTransport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class DispatchStatsServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private WorkerActivityRepository activityRepository;
  @Mock private DeliveryAttemptRepository attemptRepository;
  @Mock private RecipientDirectory recipientDirectory;
  @Mock private NotificationTransport transport;
  @Mock private DeliveryLedger ledger;
  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ValueOperations<String, String> valueOperations;

  private DispatchStatsService service;

  @BeforeEach
  void setUp() {
    service =
        new DispatchStatsService(
            activityRepository,
            attemptRepository,
            recipientDirectory,
            transport,
            ledger,
            new DispatchProperties(false, null, null, null, null, null, 0, 0, null, 0, 0),
            new StatsAlertEvaluator(new StatsAlertProperties(null, null)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC),
            redisTemplate);
  }

  @Test
  void collectsCountsAnalyticsAndHealth() {
    when(activityRepository.countByTypeSince(FIXED_NOW.minus(Duration.ofHours(24))))
        .thenReturn(Map.of("processing_completed", 3L));
    when(attemptRepository.summarizeSince(FIXED_NOW.minus(Duration.ofDays(7))))
        .thenReturn(new DeliverySummary(3, 2, 1));
    when(transport.configured()).thenReturn(true);
    when(ledger.writeFailures()).thenReturn(4L);
    stubWorkingCache();

    final DispatchStats stats = service.collect();

    assertThat(stats.worker()).isEqualTo("digest-dispatch");
    assertThat(stats.recentActivity().counts()).containsEntry("processing_completed", 3L);
    assertThat(stats.deliveryAnalytics().successRate()).isEqualTo(66.7d);
    assertThat(stats.systemHealth().dataStore().status()).isEqualTo("healthy");
    assertThat(stats.systemHealth().transport().status()).isEqualTo("configured");
    assertThat(stats.systemHealth().cache().status()).isEqualTo("healthy");
    assertThat(stats.systemHealth().overallStatus()).isEqualTo("healthy");
    assertThat(stats.ledgerWriteFailures()).isEqualTo(4L);
    assertThat(stats.alerts())
        .extracting(StatsAlert::type, StatsAlert::severity)
        .containsExactly(
            tuple("delivery_failure_rate", "warning"),
            tuple("delivery_critical_failure", "critical"));
  }

  @Test
  void failingDependenciesDegradeWithoutThrowing() {
    when(activityRepository.countByTypeSince(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    when(attemptRepository.summarizeSince(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    doThrow(new DataAccessResourceFailureException("db down")).when(recipientDirectory).ping();
    when(transport.configured()).thenReturn(false);
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    doThrow(new RedisConnectionFailureException("redis down"))
        .when(valueOperations)
        .set(anyString(), anyString(), any(Duration.class));

    final DispatchStats stats = service.collect();

    assertThat(stats.recentActivity().error()).isEqualTo("db down");
    assertThat(stats.deliveryAnalytics().error()).isEqualTo("db down");
    assertThat(stats.systemHealth().dataStore().status()).isEqualTo("unhealthy");
    assertThat(stats.systemHealth().transport().status()).isEqualTo("not_configured");
    assertThat(stats.systemHealth().cache().error()).isEqualTo("redis down");
    assertThat(stats.systemHealth().overallStatus()).isEqualTo("degraded");
    assertThat(stats.alerts())
        .containsExactly(new StatsAlert("system_health", "System health is degraded", "warning"));
  }

  @Test
  void successRateIsZeroWithoutAttempts() {
    assertThat(DispatchStatsService.successRate(DeliverySummary.empty())).isZero();
    assertThat(DispatchStatsService.successRate(new DeliverySummary(8, 8, 0))).isEqualTo(100.0d);
  }

  private void stubWorkingCache() {
    final Map<String, String> store = new HashMap<>();
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    doAnswer(
            invocation -> {
              store.put(invocation.getArgument(0), invocation.getArgument(1));
              return null;
            })
        .when(valueOperations)
        .set(anyString(), anyString(), eq(Duration.ofSeconds(60)));
    when(valueOperations.get(anyString()))
        .thenAnswer(invocation -> store.get(invocation.getArgument(0)));
  }
}
