/*
 * どこで: Digest Dispatch サービス層
 * 何を: 1 回の配信ランの集計結果を表す
 * なぜ: 手動トリガーの応答と運用ログで同じ集計を使うため
 */
package com.example.dispatch.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * 配信ランの結果。
 *
 * <p>{@code sent + skipped + errors} は処理した受信者数と一致する。{@code results} は先頭から
 * 設定件数までの抜粋で、合計値は抜粋に関係なく全件で数える。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DispatchReport(
    String runId,
    boolean success,
    String error,
    int sent,
    int skipped,
    int errors,
    int configurationErrors,
    int recipientsProcessed,
    List<String> timeSlots,
    boolean degradedWindow,
    long durationMillis,
    long ledgerWriteFailures,
    List<RecipientDeliveryResult> results) {

  public DispatchReport {
    timeSlots = timeSlots == null ? List.of() : List.copyOf(timeSlots);
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static DispatchReport aborted(
      String runId,
      String error,
      List<String> timeSlots,
      boolean degradedWindow,
      long durationMillis) {
    return new DispatchReport(
        runId,
        false,
        error,
        0,
        0,
        0,
        0,
        0,
        timeSlots,
        degradedWindow,
        durationMillis,
        0,
        List.of());
  }
}
