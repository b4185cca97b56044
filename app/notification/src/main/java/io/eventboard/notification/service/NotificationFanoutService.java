/*
 * どこで: Notification サービス層
 * 何を: 変更メッセージ 1 件を ビルド -> 保存 -> 配信 -> 配信記録 の順で処理する
 * なぜ: 保存が確定する前に通知を送らず、配信済み集合が実際に届けたユーザだけを指すようにするため
 */
package io.eventboard.notification.service;

import io.eventboard.notification.model.BuiltNotification;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationView;
import io.eventboard.notification.websocket.ConnectionManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class NotificationFanoutService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationFanoutService.class);

  private final NotificationBuilder builder;
  private final NotificationStore store;
  private final RecipientPolicy recipientPolicy;
  private final ConnectionManager connectionManager;
  private final NotificationMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public NotificationFanoutService(
      NotificationBuilder builder,
      NotificationStore store,
      RecipientPolicy recipientPolicy,
      ConnectionManager connectionManager,
      NotificationMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.builder = builder;
    this.store = store;
    this.recipientPolicy = recipientPolicy;
    this.connectionManager = connectionManager;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Handles one decoded change message.
   *
   * @throws DuplicateNotificationException when the message was already turned into a notification
   * @throws NotificationEventPermanentException when the message can never be processed
   * @throws DataAccessException when persistence failed; the message should be redelivered
   */
  public FanoutResult handle(ChangeEnvelope envelope) {
    final Instant receivedAt = Instant.now(clock);
    final BuiltNotification built = builder.build(envelope);
    final NotificationRecord record = built.notification();

    transactionTemplate.executeWithoutResult(
        status -> {
          store.insert(built);
          recipientPolicy.remember(envelope);
        });

    final Set<String> reached =
        connectionManager.dispatch(NotificationView.undelivered(record), built.recipients());
    int delivered = 0;
    for (String userId : reached) {
      try {
        if (store.recordDelivery(record.notificationId(), userId)) {
          delivered++;
        }
      } catch (DataAccessException ex) {
        // 送信は完了しているため再配信させない。delivered_to が欠けるだけに留める
        logger.warn(
            "delivery record failed notificationId={} userId={}",
            record.notificationId(),
            userId,
            ex);
      }
    }

    metrics.recordDispatched(delivered, Duration.between(receivedAt, Instant.now(clock)));
    logger.info(
        "notification fanned out notificationId={} type={} topic={} recipients={} delivered={}",
        record.notificationId(),
        record.type().wireName(),
        record.ownerTopic(),
        built.recipients().size(),
        delivered);
    return new FanoutResult(record.notificationId(), built.recipients().size(), delivered);
  }
}
