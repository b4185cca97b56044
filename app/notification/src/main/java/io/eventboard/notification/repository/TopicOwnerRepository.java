/*
 * どこで: Notification データアクセス
 * 何を: トピック (イベント) ごとの常時通知先ユーザを保存/取得する
 * なぜ: updated/deleted に created_by が含まれなくても作成者へ通知を届けるため
 *       (更新が続くトピックは保持期間で消さない)
 */
package io.eventboard.notification.repository;

import static io.eventboard.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TopicOwnerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Registers the owner, or refreshes its last activity when already registered. */
  public void register(String topic, String userId, Instant at) {
    final String sql =
        """
        INSERT INTO notification_topic_owners (
          topic,
          user_id,
          created_at,
          last_activity_at
        ) VALUES (
          :topic,
          :userId,
          :at,
          :at
        )
        ON CONFLICT (topic, user_id) DO UPDATE
        SET last_activity_at = GREATEST(
          notification_topic_owners.last_activity_at, EXCLUDED.last_activity_at)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("topic", topic)
            .addValue("userId", userId)
            .addValue("at", toTimestamp(at));
    jdbcTemplate.update(sql, params);
  }

  public int touch(String topic, Instant at) {
    final String sql =
        """
        UPDATE notification_topic_owners
        SET last_activity_at = :at
        WHERE topic = :topic
          AND last_activity_at < :at
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource().addValue("topic", topic).addValue("at", toTimestamp(at)));
  }

  public Set<String> findOwners(String topic) {
    final String sql =
        """
        SELECT user_id
        FROM notification_topic_owners
        WHERE topic = :topic
        ORDER BY user_id
        """;
    return new LinkedHashSet<>(
        jdbcTemplate.queryForList(
            sql, new MapSqlParameterSource().addValue("topic", topic), String.class));
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_topic_owners
        WHERE last_activity_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }
}
