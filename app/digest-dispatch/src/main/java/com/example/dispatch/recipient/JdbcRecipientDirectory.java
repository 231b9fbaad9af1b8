/*
 * どこで: Digest Dispatch データアクセス
 * 何を: digest_settings と recipient_profiles から配信対象を読み取る
 * なぜ: 配信対象の抽出条件を SQL 1 本に閉じ込めるため
 */
package com.example.dispatch.recipient;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcRecipientDirectory implements RecipientDirectory {

  private static final String SELECT_COLUMNS =
      """
      SELECT s.recipient_id, s.scheduled_slot, s.content_preferences,
             p.contact_address, p.display_name, p.business_name
      FROM digest_settings s
      LEFT JOIN recipient_profiles p ON p.recipient_id = s.recipient_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public EligibleRecipients fetchEligible(List<String> slots) {
    if (slots == null || slots.isEmpty()) {
      return EligibleRecipients.empty();
    }
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE s.enabled = true
              AND s.scheduled_slot IN (:slots)
            ORDER BY s.recipient_id
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("slots", slots);
    try {
      return RecipientRowValidator.classify(jdbcTemplate.query(sql, params, this::mapRow));
    } catch (DataAccessException ex) {
      throw new RecipientDirectoryException("failed to fetch eligible recipients", ex);
    }
  }

  @Override
  public Optional<Recipient> findEnabled(String recipientId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE s.enabled = true
              AND s.recipient_id = :recipientId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("recipientId", recipientId);
    try {
      return jdbcTemplate.query(sql, params, this::mapRow).stream()
          .findFirst()
          .map(RecipientRowValidator::toRecipient);
    } catch (DataAccessException ex) {
      throw new RecipientDirectoryException("failed to look up recipient", ex);
    }
  }

  @Override
  public void ping() {
    jdbcTemplate.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
  }

  private RecipientRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RecipientRow(
        rs.getString("recipient_id"),
        rs.getString("scheduled_slot"),
        rs.getString("content_preferences"),
        rs.getString("contact_address"),
        rs.getString("display_name"),
        rs.getString("business_name"));
  }
}
