package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.config.StatsAlertProperties;
import com.example.dispatch.ledger.DeliverySummary;
import com.example.dispatch.service.DispatchStats.ComponentHealth;
import com.example.dispatch.service.DispatchStats.DeliveryAnalytics;
import com.example.dispatch.service.DispatchStats.SystemHealth;
import org.junit.jupiter.api.Test;

class StatsAlertEvaluatorTest {

  private final StatsAlertEvaluator evaluator =
      new StatsAlertEvaluator(new StatsAlertProperties(null, null));

  @Test
  void healthySystemAboveThresholdHasNoAlerts() {
    assertThat(evaluator.evaluate(analytics(100, 90), health("healthy"))).isEmpty();
  }

  @Test
  void rateBelowWarningRaisesWarningOnly() {
    assertThat(evaluator.evaluate(analytics(100, 80), health("healthy")))
        .containsExactly(
            new StatsAlert(
                "delivery_failure_rate",
                "Delivery success rate is 80% (below 90% threshold)",
                StatsAlert.WARNING));
  }

  @Test
  void rateBelowCriticalRaisesBoth() {
    assertThat(evaluator.evaluate(analytics(1000, 705), health("healthy")))
        .extracting(StatsAlert::severity)
        .containsExactly(StatsAlert.WARNING, StatsAlert.CRITICAL);
    assertThat(evaluator.evaluate(analytics(1000, 705), health("healthy")).get(1).message())
        .isEqualTo("Delivery success rate is critically low at 70.5%");
  }

  @Test
  void noAttemptsOrFailedAnalyticsSkipRateAlerts() {
    assertThat(evaluator.evaluate(new DeliveryAnalytics(0, 0, 0, 0.0d, null), health("healthy")))
        .isEmpty();
    assertThat(
            evaluator.evaluate(new DeliveryAnalytics(0, 0, 0, 0.0d, "db down"), health("healthy")))
        .isEmpty();
  }

  @Test
  void unhealthySystemIsCriticalAndDegradedIsWarning() {
    assertThat(evaluator.evaluate(analytics(10, 10), health("unhealthy")))
        .containsExactly(
            new StatsAlert("system_health", "System health is unhealthy", StatsAlert.CRITICAL));
    assertThat(evaluator.evaluate(analytics(10, 10), health("degraded")))
        .containsExactly(
            new StatsAlert("system_health", "System health is degraded", StatsAlert.WARNING));
  }

  @Test
  void thresholdsFollowConfiguration() {
    final StatsAlertEvaluator strict =
        new StatsAlertEvaluator(new StatsAlertProperties(99.0d, 95.0d));

    assertThat(strict.evaluate(analytics(100, 97), health("healthy")))
        .extracting(StatsAlert::type)
        .containsExactly("delivery_failure_rate");
  }

  private static DeliveryAnalytics analytics(long total, long sent) {
    final DeliverySummary summary = new DeliverySummary(total, sent, total - sent);
    return new DeliveryAnalytics(
        total, sent, total - sent, DispatchStatsService.successRate(summary), null);
  }

  private static SystemHealth health(String overall) {
    return new SystemHealth(
        ComponentHealth.of("healthy"),
        ComponentHealth.of("configured"),
        ComponentHealth.of("healthy"),
        overall);
  }
}
