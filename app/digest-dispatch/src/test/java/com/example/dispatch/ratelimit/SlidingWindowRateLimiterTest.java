/*
 * どこで: レート制限のユニットテスト
 * 何を: ウィンドウ内の上限到達・Retry-After 算出・ウィンドウ経過後の解放・障害時の許可を検証する
 * なぜ: 制御 API の連打を抑止しつつ、ストア障害で API を止めないことを担保するため
 */
package com.example.dispatch.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.config.RateLimitProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  private final InMemoryWindowStore store = new InMemoryWindowStore();

  @Test
  void rejectsOnceLimitIsReachedWithinWindow() {
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(store, properties(true, Map.of("trigger-emails", 3)));

    for (int i = 0; i < 3; i++) {
      assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW.plusSeconds(i)).allowed())
          .isTrue();
    }
    final RateLimitDecision fourth =
        limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW.plusSeconds(10));

    assertThat(fourth.allowed()).isFalse();
    assertThat(fourth.retryAfterSeconds()).isPositive().isLessThanOrEqualTo(3600);
    // 最古のリクエストが抜けるまで 3600 - 10 秒
    assertThat(fourth.retryAfterSeconds()).isEqualTo(3590);
  }

  @Test
  void retryAfterHasAFloor() {
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(store, properties(true, Map.of("trigger-emails", 1)));

    limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW);
    final RateLimitDecision rejected =
        limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW.plusSeconds(3590));

    assertThat(rejected.allowed()).isFalse();
    assertThat(rejected.retryAfterSeconds()).isEqualTo(60);
  }

  @Test
  void requestsOutsideWindowNoLongerCount() {
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(store, properties(true, Map.of("trigger-emails", 1)));

    assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW).allowed()).isTrue();
    assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW.plusSeconds(3600)).allowed())
        .isTrue();
  }

  @Test
  void limitsAreTrackedPerEndpointAndClient() {
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(
            store, properties(true, Map.of("trigger-emails", 1, "stats", 1)));

    assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW).allowed()).isTrue();
    assertThat(limiter.check("trigger-emails", "10.0.0.2", FIXED_NOW).allowed()).isTrue();
    assertThat(limiter.check("stats", "10.0.0.1", FIXED_NOW).allowed()).isTrue();
    assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW).allowed()).isFalse();
  }

  @Test
  void storeFailureAllowsRequest() {
    final RateLimitWindowStore broken =
        new RateLimitWindowStore() {
          @Override
          public Optional<RateLimitWindow> load(String endpoint, String clientKey) {
            throw new IllegalStateException("redis down");
          }

          @Override
          public void save(
              String endpoint, String clientKey, RateLimitWindow window, Duration ttl) {
            throw new IllegalStateException("redis down");
          }
        };
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(broken, properties(true, Map.of("trigger-emails", 1)));

    assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW).allowed()).isTrue();
  }

  @Test
  void disabledLimiterAlwaysAllows() {
    final SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter(store, properties(false, Map.of("trigger-emails", 1)));

    for (int i = 0; i < 5; i++) {
      assertThat(limiter.check("trigger-emails", "10.0.0.1", FIXED_NOW).allowed()).isTrue();
    }
    assertThat(store.windows).isEmpty();
  }

  private static RateLimitProperties properties(boolean enabled, Map<String, Integer> limits) {
    return new RateLimitProperties(
        enabled, Duration.ofHours(1), Duration.ofSeconds(60), 60, limits, "digest:ratelimit:");
  }

  private static final class InMemoryWindowStore implements RateLimitWindowStore {

    private final Map<String, RateLimitWindow> windows = new HashMap<>();

    @Override
    public Optional<RateLimitWindow> load(String endpoint, String clientKey) {
      return Optional.ofNullable(windows.get(endpoint + ":" + clientKey));
    }

    @Override
    public void save(String endpoint, String clientKey, RateLimitWindow window, Duration ttl) {
      windows.put(endpoint + ":" + clientKey, new RateLimitWindow(List.copyOf(window.requests()), window.lastUpdated()));
    }
  }
}
