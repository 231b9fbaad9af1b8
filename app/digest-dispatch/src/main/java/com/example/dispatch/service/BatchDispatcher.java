/*
 * どこで: Digest Dispatch サービス層
 * 何を: 対象スロットの受信者を抽出し、バッチ単位・並列上限付きで配信して集計する
 * なぜ: 下流への同時負荷を抑えつつ、1 人の失敗で他の受信者の配信を止めないため
 */
package com.example.dispatch.service;

import com.example.common.Sleeper;
import com.example.dispatch.activity.ActivityType;
import com.example.dispatch.activity.WorkerActivityRecorder;
import com.example.dispatch.concurrent.ConcurrencyLimiter;
import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.ledger.DeliveryLedger;
import com.example.dispatch.recipient.EligibleRecipients;
import com.example.dispatch.recipient.Recipient;
import com.example.dispatch.recipient.RecipientDirectory;
import com.example.dispatch.recipient.RejectedRecipient;
import com.example.dispatch.schedule.DeliveryWindow;
import com.example.dispatch.schedule.TimeWindowResolver;
import com.google.common.collect.Lists;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * 配信ランの実行者。
 *
 * <p>状態は Idle → ResolvingWindow → FetchingEligible → (NoneEligible | Batching →
 * DispatchingBatch* → Aggregating) → Done の順に進む。バッチは逐次、バッチ内は {@link
 * ConcurrencyLimiter} で並列上限を守る。
 */
@Service
public class BatchDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(BatchDispatcher.class);
  private static final String RUN_ID_KEY = "run_id";

  private final RecipientDirectory recipientDirectory;
  private final RecipientDeliveryService deliveryService;
  private final TimeWindowResolver timeWindowResolver;
  private final DeliveryLedger ledger;
  private final WorkerActivityRecorder activityRecorder;
  private final DispatchMetrics metrics;
  private final DispatchProperties properties;
  private final Executor executor;
  private final Sleeper sleeper;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Executor は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public BatchDispatcher(
      RecipientDirectory recipientDirectory,
      RecipientDeliveryService deliveryService,
      TimeWindowResolver timeWindowResolver,
      DeliveryLedger ledger,
      WorkerActivityRecorder activityRecorder,
      DispatchMetrics metrics,
      DispatchProperties properties,
      @Qualifier("dispatchExecutor") Executor executor,
      Sleeper sleeper,
      Clock clock) {
    this.recipientDirectory = recipientDirectory;
    this.deliveryService = deliveryService;
    this.timeWindowResolver = timeWindowResolver;
    this.ledger = ledger;
    this.activityRecorder = activityRecorder;
    this.metrics = metrics;
    this.properties = properties;
    this.executor = executor;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public DispatchReport dispatchScheduled() {
    final String runId = UUID.randomUUID().toString();
    MDC.put(RUN_ID_KEY, runId);
    try {
      return runScheduled(runId);
    } finally {
      MDC.remove(RUN_ID_KEY);
    }
  }

  private DispatchReport runScheduled(String runId) {
    final Instant startedAt = Instant.now(clock);
    final long ledgerFailuresBefore = ledger.writeFailures();
    activityRecorder.record(ActivityType.PROCESSING_STARTED, Map.of(RUN_ID_KEY, runId));

    final DeliveryWindow window = timeWindowResolver.resolve(startedAt, properties.timeZone());
    logger.info(
        "dispatch window resolved slots={} localDate={} degraded={}",
        window.slots(),
        window.localDate(),
        window.degraded());

    final EligibleRecipients eligible;
    try {
      eligible = recipientDirectory.fetchEligible(window.slots());
    } catch (RuntimeException ex) {
      final long durationMillis = elapsedMillis(startedAt);
      logger.error("dispatch aborted; eligible recipients could not be fetched", ex);
      activityRecorder.record(
          ActivityType.CRITICAL_ERROR,
          Map.of(RUN_ID_KEY, runId, "error", String.valueOf(ex.getMessage())));
      metrics.recordDispatchDuration(Duration.ofMillis(durationMillis));
      return DispatchReport.aborted(
          runId, ex.getMessage(), window.slots(), window.degraded(), durationMillis);
    }
    for (RejectedRecipient rejected : eligible.rejected()) {
      logger.warn(
          "digest recipient rejected by configuration recipientId={} reason={}",
          rejected.recipientId(),
          rejected.reason());
    }

    final List<Recipient> recipients = eligible.accepted();
    if (recipients.isEmpty()) {
      logger.info(
          "no recipients due slots={} configurationErrors={}",
          window.slots(),
          eligible.rejected().size());
      activityRecorder.record(
          ActivityType.NO_RECIPIENTS, Map.of(RUN_ID_KEY, runId, "time_slots", window.slots()));
      final long durationMillis = elapsedMillis(startedAt);
      metrics.recordDispatchDuration(Duration.ofMillis(durationMillis));
      return new DispatchReport(
          runId,
          true,
          null,
          0,
          0,
          0,
          eligible.rejected().size(),
          0,
          window.slots(),
          window.degraded(),
          durationMillis,
          ledger.writeFailures() - ledgerFailuresBefore,
          List.of());
    }

    final List<RecipientDeliveryResult> results =
        dispatchInBatches(recipients, window.localDate());
    final DispatchReport report =
        aggregate(
            runId,
            results,
            eligible.rejected().size(),
            window,
            elapsedMillis(startedAt),
            ledger.writeFailures() - ledgerFailuresBefore);
    metrics.recordDispatchDuration(Duration.ofMillis(report.durationMillis()));
    activityRecorder.record(ActivityType.PROCESSING_COMPLETED, completionDetails(report));
    logger.info(
        "dispatch completed sent={} skipped={} errors={} configurationErrors={} durationMs={}",
        report.sent(),
        report.skipped(),
        report.errors(),
        report.configurationErrors(),
        report.durationMillis());
    return report;
  }

  public SingleDispatchResult dispatchSingle(String recipientId) {
    activityRecorder.record(ActivityType.TEST_EMAIL, Map.of("recipient_id", recipientId));
    final Optional<Recipient> recipient;
    try {
      recipient = recipientDirectory.findEnabled(recipientId);
    } catch (RuntimeException ex) {
      logger.error("test dispatch lookup failed recipientId={}", recipientId, ex);
      activityRecorder.record(
          ActivityType.TEST_EMAIL_ERROR,
          Map.of("recipient_id", recipientId, "error", String.valueOf(ex.getMessage())));
      return new SingleDispatchResult(false, ex.getMessage(), recipientId, null);
    }
    if (recipient.isEmpty()) {
      return new SingleDispatchResult(
          false, "User not found or not configured for emails", recipientId, null);
    }
    final DeliveryWindow window =
        timeWindowResolver.resolve(Instant.now(clock), properties.timeZone());
    final RecipientDeliveryResult result =
        deliveryService.deliver(recipient.get(), window.localDate());
    switch (result.outcome()) {
      case SENT -> {
        activityRecorder.record(
            ActivityType.TEST_EMAIL_SENT,
            Map.of("recipient_id", recipientId, "message_id", String.valueOf(result.messageId())));
        return new SingleDispatchResult(
            true, "Test email sent successfully", recipientId, result.messageId());
      }
      case SKIPPED -> {
        return new SingleDispatchResult(
            false, "Test email skipped: " + result.reason(), recipientId, null);
      }
      default -> {
        activityRecorder.record(
            ActivityType.TEST_EMAIL_ERROR,
            Map.of("recipient_id", recipientId, "error", String.valueOf(result.error())));
        return new SingleDispatchResult(false, result.error(), recipientId, null);
      }
    }
  }

  private List<RecipientDeliveryResult> dispatchInBatches(
      List<Recipient> recipients, LocalDate deliveryDay) {
    final List<List<Recipient>> batches = Lists.partition(recipients, properties.batchSize());
    final ConcurrencyLimiter limiter = new ConcurrencyLimiter(properties.concurrency(), executor);
    final List<RecipientDeliveryResult> results = new ArrayList<>(recipients.size());
    for (int index = 0; index < batches.size(); index++) {
      final List<Recipient> batch = batches.get(index);
      logger.debug(
          "dispatching batch index={} of={} size={}", index + 1, batches.size(), batch.size());
      results.addAll(dispatchBatch(batch, deliveryDay, limiter));
      if (index < batches.size() - 1) {
        pauseBetweenBatches();
      }
    }
    return results;
  }

  private List<RecipientDeliveryResult> dispatchBatch(
      List<Recipient> batch, LocalDate deliveryDay, ConcurrencyLimiter limiter) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final List<CompletableFuture<RecipientDeliveryResult>> futures = new ArrayList<>(batch.size());
    for (Recipient recipient : batch) {
      final CompletableFuture<RecipientDeliveryResult> future =
          limiter
              .submit(() -> deliverWithMdc(recipient, deliveryDay, mdc))
              .exceptionally(ex -> unexpectedFailure(recipient, ex));
      futures.add(future);
    }
    // バッチ内の全件が終わるまで次のバッチへ進まない
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    final List<RecipientDeliveryResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<RecipientDeliveryResult> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private RecipientDeliveryResult deliverWithMdc(
      Recipient recipient, LocalDate deliveryDay, Map<String, String> mdc) {
    final Map<String, String> previous = MDC.getCopyOfContextMap();
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try {
      return deliveryService.deliver(recipient, deliveryDay);
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  private RecipientDeliveryResult unexpectedFailure(Recipient recipient, Throwable ex) {
    logger.error("digest delivery task failed recipientId={}", recipient.recipientId(), ex);
    metrics.recordDeliveryResult(DeliveryOutcome.FAILED.value());
    return RecipientDeliveryResult.failed(
        recipient.recipientId(),
        DeliveryFailureReason.UNEXPECTED_ERROR,
        String.valueOf(ex.getMessage()),
        null);
  }

  private void pauseBetweenBatches() {
    try {
      sleeper.sleep(properties.interBatchDelay());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("inter-batch delay interrupted; continuing with next batch");
    }
  }

  private DispatchReport aggregate(
      String runId,
      List<RecipientDeliveryResult> results,
      int configurationErrors,
      DeliveryWindow window,
      long durationMillis,
      long ledgerWriteFailures) {
    int sent = 0;
    int skipped = 0;
    int errors = 0;
    for (RecipientDeliveryResult result : results) {
      switch (result.outcome()) {
        case SENT -> sent++;
        case SKIPPED -> skipped++;
        default -> errors++;
      }
    }
    final List<RecipientDeliveryResult> sample =
        results.subList(0, Math.min(results.size(), properties.resultSampleSize()));
    return new DispatchReport(
        runId,
        true,
        null,
        sent,
        skipped,
        errors,
        configurationErrors,
        results.size(),
        window.slots(),
        window.degraded(),
        durationMillis,
        ledgerWriteFailures,
        sample);
  }

  private Map<String, Object> completionDetails(DispatchReport report) {
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put(RUN_ID_KEY, report.runId());
    details.put("sent", report.sent());
    details.put("skipped", report.skipped());
    details.put("errors", report.errors());
    details.put("configuration_errors", report.configurationErrors());
    details.put("time_slots", report.timeSlots());
    details.put("duration_ms", report.durationMillis());
    return details;
  }

  private long elapsedMillis(Instant startedAt) {
    return Math.max(0L, Duration.between(startedAt, Instant.now(clock)).toMillis());
  }
}
