/*
 * どこで: Digest Dispatch アプリの設定バインド
 * 何を: 配信バッチ・並列度・タイムゾーン・スケジュール設定を保持する
 * なぜ: 下流負荷に合わせて運用パラメータを外部化するため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneOffset;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "digest.dispatch")
@Validated
public record DispatchProperties(
    boolean schedulerEnabled,
    String cron,
    String workerName,
    String notificationType,
    String timeZone,
    String fallbackOffset,
    int batchSize,
    int concurrency,
    Duration interBatchDelay,
    int resultSampleSize,
    int errorMessageMaxLength) {

  public DispatchProperties {
    cron = cron == null || cron.isBlank() ? "0 0 * * * *" : cron;
    workerName = workerName == null || workerName.isBlank() ? "digest-dispatch" : workerName;
    notificationType =
        notificationType == null || notificationType.isBlank() ? "daily_digest" : notificationType;
    timeZone = timeZone == null || timeZone.isBlank() ? "Africa/Johannesburg" : timeZone;
    fallbackOffset =
        fallbackOffset == null || fallbackOffset.isBlank() ? "+02:00" : fallbackOffset;
    batchSize = batchSize <= 0 ? 8 : batchSize;
    concurrency = concurrency <= 0 ? 3 : concurrency;
    interBatchDelay = interBatchDelay == null ? Duration.ofSeconds(2) : interBatchDelay;
    resultSampleSize = resultSampleSize <= 0 ? 10 : resultSampleSize;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
  }

  @AssertTrue(message = "digest.dispatch.fallback-offset must be a UTC offset such as +02:00")
  public boolean isFallbackOffsetValid() {
    // ZoneOffset.of が受け付ける形式だけを許可する
    try {
      ZoneOffset.of(fallbackOffset);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }
}
