/*
 * どこで: Notification データアクセス
 * 何を: デコード失敗メッセージと JetStream advisory (MaxDeliver/TERM) を DLQ テーブルへ保存する
 * なぜ: 再処理できないメッセージを黙って捨てず、stream_seq から再取得できるようにするため
 */
package io.eventboard.notification.repository;

import static io.eventboard.common.JdbcTimestampUtils.toTimestamp;

import io.eventboard.notification.model.DeadLetterRecord;
import java.sql.Types;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationDeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Stores the dead letter unless one already exists for the same stream sequence; the decode
   * path and the terminated advisory both report the same message.
   */
  public boolean insert(DeadLetterRecord record) {
    final String sql =
        """
        INSERT INTO notification_dead_letters (
          stream_seq,
          reason,
          subject,
          payload,
          error,
          deliveries,
          created_at
        ) VALUES (
          :streamSeq,
          :reason,
          :subject,
          :payload,
          :error,
          :deliveries,
          :createdAt
        )
        ON CONFLICT (stream_seq) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("streamSeq", record.streamSeq(), Types.BIGINT)
            .addValue("reason", record.reason().name())
            .addValue("subject", record.subject())
            .addValue("payload", record.payload())
            .addValue("error", record.error())
            .addValue("deliveries", record.deliveries(), Types.INTEGER)
            .addValue("createdAt", toTimestamp(record.createdAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_dead_letters
        WHERE created_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }
}
