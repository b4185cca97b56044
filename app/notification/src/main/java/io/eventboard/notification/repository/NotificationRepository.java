/*
 * どこで: Notification データアクセス
 * 何を: notifications テーブルの登録と、宛先ユーザ単位の一覧/単体取得/件数を担う
 * なぜ: delivered_to / read_by を宛先テーブルから集約し、読み取り API とフレームに同じ形で渡すため
 */
package io.eventboard.notification.repository;

import static io.eventboard.common.JdbcTimestampUtils.toInstant;
import static io.eventboard.common.JdbcTimestampUtils.toTimestamp;

import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationType;
import io.eventboard.notification.model.NotificationView;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String VIEW_COLUMNS =
      """
      n.notification_id, n.type, n.owner_topic, n.actor_user_id,
      n.content_json::text AS content_json_text, n.message_id, n.created_at,
      ARRAY(
        SELECT r.user_id FROM notification_recipients r
        WHERE r.notification_id = n.notification_id AND r.delivered_at IS NOT NULL
        ORDER BY r.user_id
      ) AS delivered_to,
      ARRAY(
        SELECT r.user_id FROM notification_recipients r
        WHERE r.notification_id = n.notification_id AND r.read_at IS NOT NULL
        ORDER BY r.user_id
      ) AS read_by
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Plain insert; a repeated id or message id surfaces as {@code DuplicateKeyException}. */
  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          message_id,
          type,
          owner_topic,
          actor_user_id,
          content_json,
          created_at
        ) VALUES (
          :notificationId,
          :messageId,
          :type,
          :ownerTopic,
          :actorUserId,
          :contentJson::jsonb,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("messageId", record.messageId())
            .addValue("type", record.type().wireName())
            .addValue("ownerTopic", record.ownerTopic())
            .addValue("actorUserId", record.actorUserId())
            .addValue("contentJson", record.contentJson())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<NotificationView> findPageForUser(String userId, int limit, long offset) {
    // 同時刻の行でもページ境界が揺れないよう notification_id を第二キーにする
    final String sql =
        "SELECT "
            + VIEW_COLUMNS
            + """
            FROM notifications n
            JOIN notification_recipients me
              ON me.notification_id = n.notification_id AND me.user_id = :userId
            ORDER BY n.created_at DESC, n.notification_id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapView);
  }

  public Optional<NotificationView> findForUser(UUID notificationId, String userId) {
    final String sql =
        "SELECT "
            + VIEW_COLUMNS
            + """
            FROM notifications n
            JOIN notification_recipients me
              ON me.notification_id = n.notification_id AND me.user_id = :userId
            WHERE n.notification_id = :notificationId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapView).stream().findFirst();
  }

  public long countForUser(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_recipients
        WHERE user_id = :userId
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
    return count == null ? 0L : count;
  }

  public int deleteOlderThan(Instant threshold) {
    // 宛先行は ON DELETE CASCADE で一緒に消える
    final String sql =
        """
        DELETE FROM notifications
        WHERE created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private NotificationView mapView(ResultSet rs, int rowNum) throws SQLException {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.fromString(rs.getString("notification_id")),
            NotificationType.fromWire(rs.getString("type")),
            rs.getString("owner_topic"),
            rs.getString("actor_user_id"),
            rs.getString("content_json_text"),
            rs.getString("message_id"),
            toInstant(rs.getTimestamp("created_at")));
    return new NotificationView(
        record, toUserSet(rs.getArray("delivered_to")), toUserSet(rs.getArray("read_by")));
  }

  private Set<String> toUserSet(Array array) throws SQLException {
    if (array == null) {
      return Set.of();
    }
    try {
      return new LinkedHashSet<>(Arrays.asList((String[]) array.getArray()));
    } finally {
      array.free();
    }
  }
}
