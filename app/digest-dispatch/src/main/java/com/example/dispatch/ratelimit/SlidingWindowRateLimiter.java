/*
 * どこで: Digest Dispatch レート制限
 * 何を: 直近ウィンドウ内のリクエスト数で制御 API の呼び出しを許可/拒否する
 * なぜ: 手動トリガーの連打で送信 API とデータストアに負荷をかけないため
 */
package com.example.dispatch.ratelimit;

import com.example.dispatch.config.RateLimitProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * スライディングウィンドウ方式のレート制限。
 *
 * <p>読み取りと書き込みは原子的ではないため、同時リクエストでは上限をわずかに超えることがある。
 * ストアの障害時は許可側に倒す。
 */
@Component
@RequiredArgsConstructor
public class SlidingWindowRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

  private final RateLimitWindowStore store;
  private final RateLimitProperties properties;

  public RateLimitDecision check(String endpoint, String clientKey, Instant now) {
    if (!properties.enabled()) {
      return RateLimitDecision.allow();
    }
    try {
      return evaluate(endpoint, clientKey, now);
    } catch (RuntimeException ex) {
      logger.warn(
          "rate limit check failed; allowing request endpoint={} client={}",
          endpoint,
          clientKey,
          ex);
      return RateLimitDecision.allow();
    }
  }

  private RateLimitDecision evaluate(String endpoint, String clientKey, Instant now) {
    final long nowSeconds = now.getEpochSecond();
    final long windowSeconds = properties.window().toSeconds();
    final int limit = properties.limitFor(endpoint);
    final Optional<RateLimitWindow> stored = store.load(endpoint, clientKey);
    final List<Long> recent = new ArrayList<>();
    if (stored.isPresent()) {
      for (Long timestamp : stored.get().requests()) {
        if (timestamp != null && nowSeconds - timestamp < windowSeconds) {
          recent.add(timestamp);
        }
      }
    }
    if (recent.size() >= limit) {
      final long oldest = recent.stream().mapToLong(Long::longValue).min().orElse(nowSeconds);
      final long retryAfter =
          Math.max(properties.minRetryAfter().toSeconds(), windowSeconds - (nowSeconds - oldest));
      logger.info(
          "rate limit exceeded endpoint={} client={} count={} limit={} retryAfter={}",
          endpoint,
          clientKey,
          recent.size(),
          limit,
          retryAfter);
      return RateLimitDecision.reject(retryAfter);
    }
    recent.add(nowSeconds);
    store.save(endpoint, clientKey, new RateLimitWindow(recent, nowSeconds), properties.window());
    return RateLimitDecision.allow();
  }
}
