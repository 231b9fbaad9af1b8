/*
 * どこで: Digest Dispatch スケジュール
 * 何を: 今回のトリガーで対象とする配信スロットとローカル暦日を表す
 * なぜ: トリガーの揺れで直前の時間帯が取りこぼされないようにするため
 */
package com.example.dispatch.schedule;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record DeliveryWindow(
    String currentSlot,
    String previousSlot,
    List<String> slots,
    LocalDate localDate,
    LocalTime localTime,
    boolean degraded) {

  public DeliveryWindow {
    slots = slots == null ? List.of() : List.copyOf(slots);
  }
}
