/*
 * どこで: Digest Dispatch スケジュール
 * 何を: 現在時刻から「現在の時間帯」と「直前の時間帯」のスロットを算出する
 * なぜ: 毎時トリガーが数分ずれても、どちらかの実行で必ず対象スロットを拾うため
 */
package com.example.dispatch.schedule;

import com.example.dispatch.config.DispatchProperties;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TimeWindowResolver {

  private static final Logger logger = LoggerFactory.getLogger(TimeWindowResolver.class);

  private final DispatchProperties properties;

  /**
   * 指定ゾーンのローカル時刻でスロットを解決する。
   *
   * <p>ゾーン ID が解決できない場合は固定オフセットにフォールバックし、{@code degraded} を立てる。
   * フォールバック中は夏時間を考慮しない。
   */
  public DeliveryWindow resolve(Instant now, String zoneId) {
    boolean degraded = false;
    ZonedDateTime local;
    try {
      local = now.atZone(ZoneId.of(zoneId));
    } catch (DateTimeException | NullPointerException ex) {
      logger.warn(
          "time zone resolution failed; fallback offset applied zone={} fallbackOffset={}",
          zoneId,
          properties.fallbackOffset(),
          ex);
      local = now.atZone(ZoneOffset.of(properties.fallbackOffset()));
      degraded = true;
    }
    final ZonedDateTime currentHour = local.truncatedTo(ChronoUnit.HOURS);
    final String currentSlot = slotLabel(currentHour.getHour());
    // 00 時台の直前は 23 時台
    final String previousSlot = slotLabel(Math.floorMod(currentHour.getHour() - 1, 24));
    return new DeliveryWindow(
        currentSlot,
        previousSlot,
        List.of(currentSlot, previousSlot),
        local.toLocalDate(),
        local.toLocalTime(),
        degraded);
  }

  static String slotLabel(int hour) {
    return String.format("%02d:00", hour);
  }
}
