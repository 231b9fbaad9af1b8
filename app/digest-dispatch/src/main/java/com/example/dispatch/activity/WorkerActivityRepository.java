/*
 * どこで: Digest Dispatch データアクセス
 * 何を: worker_activity_log の登録/種別集計/期限切れ削除を行う
 * なぜ: 配信ランの履歴を stats で参照できるようにするため
 */
package com.example.dispatch.activity;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class WorkerActivityRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UUID activityId, String activityType, String detailsJson, Instant occurredAt) {
    final String sql =
        """
        INSERT INTO worker_activity_log (activity_id, activity_type, details, occurred_at)
        VALUES (:activityId, :activityType, CAST(:details AS jsonb), :occurredAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("activityId", activityId)
            .addValue("activityType", activityType)
            .addValue("details", detailsJson)
            .addValue("occurredAt", toTimestamp(occurredAt));
    jdbcTemplate.update(sql, params);
  }

  public Map<String, Long> countByTypeSince(Instant since) {
    final String sql =
        """
        SELECT activity_type, COUNT(*) AS activity_count
        FROM worker_activity_log
        WHERE occurred_at >= :since
        GROUP BY activity_type
        ORDER BY activity_type
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        params,
        rs -> {
          counts.put(rs.getString("activity_type"), rs.getLong("activity_count"));
        });
    return counts;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM worker_activity_log
        WHERE occurred_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
