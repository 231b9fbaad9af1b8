/*
 * どこで: Digest Dispatch 配信台帳
 * 何を: キャッシュ→DB の 2 段で送信済みを判定し、試行結果を記録する
 * なぜ: トリガーの重複やずれがあっても 1 日 1 通に抑えるため
 */
package com.example.dispatch.ledger;

import com.example.dispatch.config.LedgerProperties;
import com.example.dispatch.service.DispatchMetrics;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryLedger {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryLedger.class);

  private final DeliveryMarkerCache markerCache;
  private final DeliveryAttemptRepository attemptRepository;
  private final LedgerProperties properties;
  private final DispatchMetrics metrics;
  private final Clock clock;
  private final AtomicLong writeFailures = new AtomicLong();

  public LedgerCheck wasDelivered(String recipientId, String notificationType, LocalDate day) {
    boolean degraded = false;
    try {
      if (markerCache.isMarked(recipientId, notificationType, day)) {
        return new LedgerCheck(true, LedgerSource.CACHE, false);
      }
    } catch (RuntimeException ex) {
      // キャッシュ障害時は未送信扱いで台帳へフォールバックする
      degraded = true;
      logger.warn(
          "delivery marker read failed; falling back to ledger recipientId={} day={}",
          recipientId,
          day,
          ex);
    }
    final boolean sent;
    try {
      sent = attemptRepository.existsSent(recipientId, notificationType, day);
    } catch (RuntimeException ex) {
      logger.warn(
          "delivery ledger read failed; assuming not sent recipientId={} day={}",
          recipientId,
          day,
          ex);
      return new LedgerCheck(false, LedgerSource.NONE, true);
    }
    if (!sent) {
      return new LedgerCheck(false, LedgerSource.NONE, degraded);
    }
    backfillMarker(recipientId, notificationType, day);
    return new LedgerCheck(true, LedgerSource.LEDGER, degraded);
  }

  public LedgerWrite recordAttempt(
      String recipientId,
      String notificationType,
      LocalDate day,
      boolean success,
      String messageId,
      String error) {
    final DeliveryAttemptRecord record =
        new DeliveryAttemptRecord(
            UUID.randomUUID(),
            recipientId,
            notificationType,
            Instant.now(clock),
            day,
            success ? DeliveryAttemptStatus.SENT : DeliveryAttemptStatus.FAILED,
            messageId,
            error);
    LedgerWrite result;
    try {
      result = attemptRepository.insert(record) ? LedgerWrite.RECORDED : LedgerWrite.DUPLICATE_IGNORED;
      if (result == LedgerWrite.DUPLICATE_IGNORED) {
        logger.warn(
            "duplicate sent attempt ignored recipientId={} type={} day={}",
            recipientId,
            notificationType,
            day);
      }
    } catch (RuntimeException ex) {
      recordWriteFailure();
      logger.warn(
          "delivery attempt write failed recipientId={} success={} day={}",
          recipientId,
          success,
          day,
          ex);
      result = LedgerWrite.FAILED;
    }
    if (success) {
      try {
        markerCache.mark(recipientId, notificationType, day, properties.cacheTtl());
      } catch (RuntimeException ex) {
        recordWriteFailure();
        logger.warn(
            "delivery marker write failed recipientId={} day={}", recipientId, day, ex);
      }
    }
    return result;
  }

  public long writeFailures() {
    return writeFailures.get();
  }

  private void backfillMarker(String recipientId, String notificationType, LocalDate day) {
    try {
      markerCache.mark(recipientId, notificationType, day, properties.cacheTtl());
    } catch (RuntimeException ex) {
      logger.debug("delivery marker backfill failed recipientId={} day={}", recipientId, day, ex);
    }
  }

  private void recordWriteFailure() {
    writeFailures.incrementAndGet();
    metrics.recordLedgerWriteFailure();
  }
}
