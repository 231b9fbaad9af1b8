/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate を java.sql 型と相互変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避するため
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  // トレードオフ: DB 側のタイムゾーン設定が UTC 以外でも、アプリは UTC で統一する
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 配信日は受信者ローカルの暦日。タイムゾーン変換をかけずに DATE 列へ渡す
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }
}
