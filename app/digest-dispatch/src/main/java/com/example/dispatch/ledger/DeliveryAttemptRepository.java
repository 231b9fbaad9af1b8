/*
 * どこで: Digest Dispatch データアクセス
 * 何を: delivery_attempts の追記/送信済み確認/集計を行う
 * なぜ: 同一受信者・同一種別・同一日の SENT を一意インデックスで 1 件に抑えるため
 */
package com.example.dispatch.ledger;

import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAttemptRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 試行を追記する。
   *
   * @return 追記できた場合 true。同日の SENT が既にあり無視された場合 false
   */
  public boolean insert(DeliveryAttemptRecord record) {
    final String sql =
        """
        INSERT INTO delivery_attempts (
          attempt_id, recipient_id, notification_type, attempted_at, delivery_day,
          status, external_message_id, error_detail
        )
        VALUES (
          :attemptId, :recipientId, :notificationType, :attemptedAt, :deliveryDay,
          :status, :externalMessageId, :errorDetail
        )
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptId", record.attemptId())
            .addValue("recipientId", record.recipientId())
            .addValue("notificationType", record.notificationType())
            .addValue("attemptedAt", toTimestamp(record.attemptedAt()))
            .addValue("deliveryDay", toSqlDate(record.deliveryDay()))
            .addValue("status", record.status().name())
            .addValue("externalMessageId", record.externalMessageId())
            .addValue("errorDetail", record.errorDetail());
    try {
      return jdbcTemplate.update(sql, params) > 0;
    } catch (DuplicateKeyException ex) {
      return false;
    }
  }

  public boolean existsSent(String recipientId, String notificationType, LocalDate deliveryDay) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM delivery_attempts
          WHERE recipient_id = :recipientId
            AND notification_type = :notificationType
            AND delivery_day = :deliveryDay
            AND status = 'SENT'
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("notificationType", notificationType)
            .addValue("deliveryDay", toSqlDate(deliveryDay));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public DeliverySummary summarizeSince(Instant since) {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE status = 'SENT') AS sent,
               COUNT(*) FILTER (WHERE status = 'FAILED') AS failed
        FROM delivery_attempts
        WHERE attempted_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final DeliverySummary summary =
        jdbcTemplate.queryForObject(
            sql,
            params,
            (rs, rowNum) ->
                new DeliverySummary(rs.getLong("total"), rs.getLong("sent"), rs.getLong("failed")));
    return summary == null ? DeliverySummary.empty() : summary;
  }
}
