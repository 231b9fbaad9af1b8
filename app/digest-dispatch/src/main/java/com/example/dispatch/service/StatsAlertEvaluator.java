/*
 * どこで: Digest Dispatch サービス層
 * 何を: 配信成功率と依存先の健全性から運用アラートを組み立てる
 * なぜ: /stats を監視する側がしきい値判定を持たずに済むようにするため
 */
package com.example.dispatch.service;

import com.example.dispatch.config.StatsAlertProperties;
import com.example.dispatch.service.DispatchStats.DeliveryAnalytics;
import com.example.dispatch.service.DispatchStats.SystemHealth;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class StatsAlertEvaluator {

  private final StatsAlertProperties properties;

  public List<StatsAlert> evaluate(DeliveryAnalytics analytics, SystemHealth health) {
    final List<StatsAlert> alerts = new ArrayList<>();
    // 試行がない、または集計に失敗した期間は成功率で判定しない
    if (analytics != null && analytics.error() == null && analytics.total() > 0) {
      final double rate = analytics.successRate();
      if (rate < properties.warningSuccessRate()) {
        alerts.add(
            new StatsAlert(
                "delivery_failure_rate",
                String.format(
                    "Delivery success rate is %s%% (below %s%% threshold)",
                    format(rate),
                    format(properties.warningSuccessRate())),
                StatsAlert.WARNING));
      }
      if (rate < properties.criticalSuccessRate()) {
        alerts.add(
            new StatsAlert(
                "delivery_critical_failure",
                String.format("Delivery success rate is critically low at %s%%", format(rate)),
                StatsAlert.CRITICAL));
      }
    }
    if (health != null && !"healthy".equals(health.overallStatus())) {
      alerts.add(
          new StatsAlert(
              "system_health",
              "System health is " + health.overallStatus(),
              "unhealthy".equals(health.overallStatus())
                  ? StatsAlert.CRITICAL
                  : StatsAlert.WARNING));
    }
    return List.copyOf(alerts);
  }

  private static String format(double value) {
    return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
  }
}
