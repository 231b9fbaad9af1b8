/*
 * どこで: Digest Dispatch アプリの設定バインド
 * 何を: 送信リトライの回数と指数バックオフ設定を保持する
 * なぜ: 下流の一時障害に対する再送強度を環境ごとに調整するため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "digest.retry")
@Validated
public record RetryProperties(Integer maxRetries, Duration baseDelay, Duration maxDelay, Boolean jitter) {

  public RetryProperties {
    maxRetries = maxRetries == null || maxRetries < 0 ? 3 : maxRetries;
    baseDelay = baseDelay == null ? Duration.ofSeconds(1) : baseDelay;
    maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
    jitter = jitter == null ? Boolean.TRUE : jitter;
  }

  @AssertTrue(message = "digest.retry.base-delay must be positive")
  public boolean isBaseDelayPositive() {
    return !baseDelay.isZero() && !baseDelay.isNegative();
  }

  @AssertTrue(message = "digest.retry.max-delay must not be shorter than base-delay")
  public boolean isMaxDelayNotShorterThanBaseDelay() {
    return maxDelay.compareTo(baseDelay) >= 0;
  }
}
