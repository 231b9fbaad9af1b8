/*
 * どこで: Digest Dispatch リトライ
 * 何を: 1 回の execute に適用する試行回数・遅延・判定条件をまとめる
 * なぜ: 呼び出し箇所ごとに再送条件を切り替えられるようにするため
 */
package com.example.dispatch.retry;

import com.example.dispatch.config.RetryProperties;
import java.time.Duration;
import java.util.function.Predicate;

public record RetryOptions(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    boolean jitter,
    Predicate<Throwable> retryPredicate) {

  public RetryOptions {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
    maxDelay = maxDelay == null ? baseDelay : maxDelay;
    retryPredicate = retryPredicate == null ? ignored -> true : retryPredicate;
  }

  public static RetryOptions from(RetryProperties properties, Predicate<Throwable> retryPredicate) {
    return new RetryOptions(
        properties.maxRetries(),
        properties.baseDelay(),
        properties.maxDelay(),
        properties.jitter(),
        retryPredicate);
  }
}
