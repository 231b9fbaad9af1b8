/*
 * どこで: Digest Dispatch リトライ
 * 何を: 指数バックオフ + ジッターで呼び出しを再試行する
 * なぜ: 送信 API の一時障害で配信を取りこぼさないようにするため
 */
package com.example.dispatch.retry;

import com.example.common.Sleeper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RetryPolicy {

  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);
  private static final double JITTER_MIN = 0.5d;
  private static final double JITTER_MAX = 1.0d;

  private final Sleeper sleeper;
  private final DoubleSupplier random;

  @Autowired
  public RetryPolicy(Sleeper sleeper) {
    this(sleeper, () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  RetryPolicy(Sleeper sleeper, DoubleSupplier random) {
    this.sleeper = sleeper;
    this.random = random;
  }

  public <T> RetryOutcome<T> execute(RetryableCall<T> call, RetryOptions options) {
    int attempt = 0;
    while (true) {
      try {
        return RetryOutcome.succeeded(call.call(attempt), attempt);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return RetryOutcome.failed(ex, attempt);
      } catch (Exception ex) {
        if (attempt >= options.maxRetries() || !options.retryPredicate().test(ex)) {
          logger.debug(
              "retry gave up attempt={} maxRetries={} error={}",
              attempt,
              options.maxRetries(),
              ex.toString());
          return RetryOutcome.failed(ex, attempt);
        }
        final Duration delay = computeDelay(attempt, options);
        logger.info(
            "retrying after transient failure attempt={} delayMs={} error={}",
            attempt,
            delay.toMillis(),
            ex.toString());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return RetryOutcome.failed(ex, attempt);
        }
        attempt++;
      }
    }
  }

  @VisibleForTesting
  Duration computeDelay(int attempt, RetryOptions options) {
    final double baseMillis = options.baseDelay().toMillis();
    final double exp = baseMillis * Math.pow(2.0d, attempt);
    final double capped = Math.min(exp, options.maxDelay().toMillis());
    if (!options.jitter()) {
      return Duration.ofMillis((long) Math.ceil(capped));
    }
    final double jitter = JITTER_MIN + random.getAsDouble() * (JITTER_MAX - JITTER_MIN);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }
}
