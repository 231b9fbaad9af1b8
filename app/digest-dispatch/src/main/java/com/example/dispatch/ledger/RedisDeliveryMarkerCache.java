/*
 * どこで: Digest Dispatch キャッシュ
 * 何を: 送信済みマーカーを Redis に TTL 付きで保持する
 * なぜ: 再トリガー時に DB を引かずに送信済みを判定するため
 */
package com.example.dispatch.ledger;

import com.example.dispatch.config.LedgerProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.LocalDate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisDeliveryMarkerCache implements DeliveryMarkerCache {

  private static final String MARKER_VALUE = "sent";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final LedgerProperties properties;

  public RedisDeliveryMarkerCache(StringRedisTemplate redisTemplate, LedgerProperties properties) {
    this.redisTemplate = redisTemplate;
    this.properties = properties;
  }

  @Override
  public boolean isMarked(String recipientId, String notificationType, LocalDate deliveryDay) {
    final String value =
        redisTemplate.opsForValue().get(markerKey(recipientId, notificationType, deliveryDay));
    return value != null;
  }

  @Override
  public void mark(
      String recipientId, String notificationType, LocalDate deliveryDay, Duration ttl) {
    redisTemplate
        .opsForValue()
        .set(markerKey(recipientId, notificationType, deliveryDay), MARKER_VALUE, ttl);
  }

  String markerKey(String recipientId, String notificationType, LocalDate deliveryDay) {
    return properties.cacheKeyPrefix() + recipientId + ":" + notificationType + ":" + deliveryDay;
  }
}
