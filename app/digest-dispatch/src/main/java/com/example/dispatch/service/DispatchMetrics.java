/*
 * どこで: Digest Dispatch サービス層
 * 何を: 配信結果/ラン所要時間/台帳書き込み失敗/制御 API の拒否を記録する
 * なぜ: 配信の成否と制御面の異常を Prometheus から直接観測できるようにするため
 */
package com.example.dispatch.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DispatchMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "digest.delivery.total";
  private static final String METRIC_DISPATCH_DURATION = "digest.dispatch.duration";
  private static final String METRIC_LEDGER_WRITE_FAILURE = "digest.ledger.write.failure.total";
  private static final String METRIC_RATE_LIMIT_REJECTED = "digest.ratelimit.rejected.total";
  private static final String METRIC_AUTH_FAILURE = "digest.auth.failure.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rateLimitCounters = new ConcurrentHashMap<>();
  private final Counter ledgerWriteFailureCounter;
  private final Counter authFailureCounter;
  private final Timer dispatchDurationTimer;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.ledgerWriteFailureCounter =
        Counter.builder(METRIC_LEDGER_WRITE_FAILURE)
            .description("Delivery ledger or marker cache writes that failed")
            .register(meterRegistry);
    this.authFailureCounter =
        Counter.builder(METRIC_AUTH_FAILURE)
            .description("Control API requests rejected by authentication")
            .register(meterRegistry);
    this.dispatchDurationTimer =
        Timer.builder(METRIC_DISPATCH_DURATION)
            .description("Wall-clock duration of a dispatch run")
            .register(meterRegistry);
  }

  /** result は sent / skipped / failed のいずれか。 */
  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Digest delivery outcomes per recipient")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatchDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    dispatchDurationTimer.record(duration);
  }

  public void recordLedgerWriteFailure() {
    ledgerWriteFailureCounter.increment();
  }

  public void recordRateLimitRejected(String endpoint) {
    rateLimitCounters
        .computeIfAbsent(
            endpoint,
            ignored ->
                Counter.builder(METRIC_RATE_LIMIT_REJECTED)
                    .description("Control API requests rejected by the rate limiter")
                    .tags(Tags.of("endpoint", endpoint))
                    .register(meterRegistry))
        .increment();
  }

  public void recordAuthFailure() {
    authFailureCounter.increment();
  }
}
