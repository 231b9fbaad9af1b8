/*
 * どこで: Digest Dispatch アプリの設定バインド
 * 何を: 制御 API のエンドポイント別レート上限とウィンドウ幅を保持する
 * なぜ: 手動トリガーの連打で下流へ負荷をかけないようにするため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "digest.rate-limit")
@Validated
public record RateLimitProperties(
    Boolean enabled,
    Duration window,
    Duration minRetryAfter,
    Integer defaultLimit,
    Map<String, Integer> limits,
    String keyPrefix) {

  public RateLimitProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    window = window == null ? Duration.ofHours(1) : window;
    minRetryAfter = minRetryAfter == null ? Duration.ofSeconds(60) : minRetryAfter;
    defaultLimit = defaultLimit == null || defaultLimit <= 0 ? 60 : defaultLimit;
    limits =
        limits == null || limits.isEmpty()
            ? Map.of("trigger-emails", 10, "test-email", 20, "stats", 100)
            : Map.copyOf(limits);
    keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "digest:ratelimit:" : keyPrefix;
  }

  @AssertTrue(message = "digest.rate-limit.window must be positive")
  public boolean isWindowPositive() {
    // Duration には @Positive が使えないため明示的に弾く
    return !window.isZero() && !window.isNegative();
  }

  public int limitFor(String endpoint) {
    return limits.getOrDefault(endpoint, defaultLimit);
  }
}
