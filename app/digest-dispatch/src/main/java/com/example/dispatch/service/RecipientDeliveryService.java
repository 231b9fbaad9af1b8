/*
 * どこで: Digest Dispatch サービス層
 * 何を: 受信者 1 人分の「検証→送信済み確認→本文生成→送信→記録」を実行する
 * なぜ: 受信者単位の失敗を結果値に閉じ込め、バッチ全体へ波及させないため
 */
package com.example.dispatch.service;

import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.config.RetryProperties;
import com.example.dispatch.content.DigestContent;
import com.example.dispatch.content.DigestContentProducer;
import com.example.dispatch.ledger.DeliveryLedger;
import com.example.dispatch.ledger.LedgerCheck;
import com.example.dispatch.recipient.Recipient;
import com.example.dispatch.retry.RetryOptions;
import com.example.dispatch.retry.RetryOutcome;
import com.example.dispatch.retry.RetryPolicy;
import com.example.dispatch.retry.TransientFailureClassifier;
import com.example.dispatch.transport.DeliveryReceipt;
import com.example.dispatch.transport.NotificationTransport;
import com.google.common.annotations.VisibleForTesting;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecipientDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(RecipientDeliveryService.class);

  private final DeliveryLedger ledger;
  private final DigestContentProducer contentProducer;
  private final NotificationTransport transport;
  private final RetryPolicy retryPolicy;
  private final TransientFailureClassifier failureClassifier;
  private final RetryProperties retryProperties;
  private final DispatchProperties dispatchProperties;
  private final DispatchMetrics metrics;

  public RecipientDeliveryResult deliver(Recipient recipient, LocalDate deliveryDay) {
    final RecipientDeliveryResult result;
    try {
      result = deliverInternal(recipient, deliveryDay);
    } catch (RuntimeException ex) {
      logger.error(
          "digest delivery failed unexpectedly recipientId={}", recipientId(recipient), ex);
      final RecipientDeliveryResult failed =
          RecipientDeliveryResult.failed(
              recipientId(recipient),
              DeliveryFailureReason.UNEXPECTED_ERROR,
              truncateError(ex.getMessage()),
              null);
      metrics.recordDeliveryResult(failed.outcome().value());
      return failed;
    }
    metrics.recordDeliveryResult(result.outcome().value());
    return result;
  }

  private RecipientDeliveryResult deliverInternal(Recipient recipient, LocalDate deliveryDay) {
    if (recipient == null || !recipient.hasContact()) {
      logger.warn("digest recipient has no contact address recipientId={}", recipientId(recipient));
      return RecipientDeliveryResult.failed(
          recipientId(recipient),
          DeliveryFailureReason.MISSING_CONTACT,
          "recipient has no contact address",
          null);
    }
    final String recipientId = recipient.recipientId();
    final String type = dispatchProperties.notificationType();

    final LedgerCheck check = ledger.wasDelivered(recipientId, type, deliveryDay);
    if (check.delivered()) {
      final SkipReason reason = SkipReason.from(check.source());
      logger.info("digest already sent recipientId={} reason={}", recipientId, reason.value());
      return RecipientDeliveryResult.skipped(recipientId, reason);
    }

    final DigestContent content;
    try {
      content = contentProducer.produce(recipient, deliveryDay);
    } catch (RuntimeException ex) {
      final String error = truncateError(ex.getMessage());
      logger.warn("digest content production failed recipientId={}", recipientId, ex);
      ledger.recordAttempt(recipientId, type, deliveryDay, false, null, error);
      return RecipientDeliveryResult.failed(
          recipientId, DeliveryFailureReason.CONTENT_UNAVAILABLE, error, null);
    }

    final RetryOutcome<DeliveryReceipt> outcome =
        retryPolicy.execute(
            attempt -> transport.send(content, recipient.contactAddress()),
            RetryOptions.from(retryProperties, failureClassifier));
    if (outcome.success()) {
      final String messageId = outcome.value() == null ? null : outcome.value().messageId();
      ledger.recordAttempt(recipientId, type, deliveryDay, true, messageId, null);
      logger.info(
          "digest sent recipientId={} messageId={} attempts={}",
          recipientId,
          messageId,
          outcome.attempts());
      return RecipientDeliveryResult.sent(recipientId, messageId, outcome.attempts());
    }
    final String error = truncateError(describe(outcome.error()));
    ledger.recordAttempt(recipientId, type, deliveryDay, false, null, error);
    logger.warn(
        "digest send failed recipientId={} attempts={} error={}",
        recipientId,
        outcome.attempts(),
        error);
    return RecipientDeliveryResult.failed(
        recipientId, DeliveryFailureReason.SEND_FAILED, error, outcome.attempts());
  }

  private String describe(Throwable error) {
    if (error == null) {
      return null;
    }
    return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = dispatchProperties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String recipientId(Recipient recipient) {
    return recipient == null ? null : recipient.recipientId();
  }
}
