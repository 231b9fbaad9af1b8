package com.example.dispatch.ledger;

import java.time.Duration;
import java.time.LocalDate;

/** 送信済みマーカーの一時キャッシュ。欠落は「未送信」を意味しない。 */
public interface DeliveryMarkerCache {

  boolean isMarked(String recipientId, String notificationType, LocalDate deliveryDay);

  void mark(String recipientId, String notificationType, LocalDate deliveryDay, Duration ttl);
}
