/*
 * どこで: Digest Dispatch アプリの設定バインド
 * 何を: /stats のアラート判定に使う成功率のしきい値を保持する
 * なぜ: 運用環境ごとに警告と重大の境界を調整するため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "digest.stats.alerts")
@Validated
public record StatsAlertProperties(Double warningSuccessRate, Double criticalSuccessRate) {

  public StatsAlertProperties {
    warningSuccessRate = warningSuccessRate == null ? 90.0d : warningSuccessRate;
    criticalSuccessRate = criticalSuccessRate == null ? 75.0d : criticalSuccessRate;
  }

  @AssertTrue(
      message = "digest.stats.alerts.critical-success-rate must not exceed warning-success-rate")
  public boolean isCriticalNotAboveWarning() {
    return criticalSuccessRate <= warningSuccessRate;
  }
}
