/*
 * どこで: Notification データアクセス
 * 何を: 宛先ユーザごとの配信時刻/既読時刻を冪等に更新し、未読件数を数える
 * なぜ: 「IS NULL の行だけ更新」で二重計上と並行更新の競合を DB の行ロックに任せるため
 */
package io.eventboard.notification.repository;

import static io.eventboard.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRecipientRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertAll(UUID notificationId, Collection<String> userIds) {
    if (userIds.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO notification_recipients (
          notification_id,
          user_id
        ) VALUES (
          :notificationId,
          :userId
        )
        ON CONFLICT (notification_id, user_id) DO NOTHING
        """;
    final SqlParameterSource[] batch =
        userIds.stream()
            .map(
                userId ->
                    new MapSqlParameterSource()
                        .addValue("notificationId", notificationId)
                        .addValue("userId", userId))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  /** Returns 1 when the delivery was newly recorded, 0 when already present or not addressed. */
  public int recordDelivery(UUID notificationId, String userId, Instant deliveredAt) {
    final String sql =
        """
        UPDATE notification_recipients
        SET delivered_at = :deliveredAt
        WHERE notification_id = :notificationId
          AND user_id = :userId
          AND delivered_at IS NULL
        """;
    final MapSqlParameterSource params =
        keyParams(notificationId, userId).addValue("deliveredAt", toTimestamp(deliveredAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markRead(UUID notificationId, String userId, Instant readAt) {
    final String sql =
        """
        UPDATE notification_recipients
        SET read_at = :readAt
        WHERE notification_id = :notificationId
          AND user_id = :userId
          AND read_at IS NULL
        """;
    final MapSqlParameterSource params =
        keyParams(notificationId, userId).addValue("readAt", toTimestamp(readAt));
    return jdbcTemplate.update(sql, params);
  }

  public boolean isAddressed(UUID notificationId, String userId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notification_recipients
          WHERE notification_id = :notificationId
            AND user_id = :userId
        )
        """;
    return Boolean.TRUE.equals(
        jdbcTemplate.queryForObject(sql, keyParams(notificationId, userId), Boolean.class));
  }

  public int markAllRead(String userId, Instant readAt) {
    final String sql =
        """
        UPDATE notification_recipients
        SET read_at = :readAt
        WHERE user_id = :userId
          AND read_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("readAt", toTimestamp(readAt));
    return jdbcTemplate.update(sql, params);
  }

  public long countUnread(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_recipients
        WHERE user_id = :userId
          AND read_at IS NULL
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
    return count == null ? 0L : count;
  }

  private MapSqlParameterSource keyParams(UUID notificationId, String userId) {
    return new MapSqlParameterSource()
        .addValue("notificationId", notificationId)
        .addValue("userId", userId);
  }
}
