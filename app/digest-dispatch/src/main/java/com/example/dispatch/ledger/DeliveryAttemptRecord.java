/*
 * どこで: Digest Dispatch 配信台帳
 * 何を: delivery_attempts テーブルの 1 行を表す
 * なぜ: 送信試行を追記専用で残し、日単位の重複送信を防ぐため
 */
package com.example.dispatch.ledger;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record DeliveryAttemptRecord(
    UUID attemptId,
    String recipientId,
    String notificationType,
    Instant attemptedAt,
    LocalDate deliveryDay,
    DeliveryAttemptStatus status,
    String externalMessageId,
    String errorDetail) {}
