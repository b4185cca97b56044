/*
 * どこで: Notification サービス層
 * 何を: ChangeEnvelope から通知レコードと宛先集合 (購読者 ∪ 関係者) を組み立てる
 * なぜ: 保存と配信が同じビルド結果を独立に使えるようにするため
 */
package io.eventboard.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventboard.notification.model.BuiltNotification;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationType;
import io.eventboard.notification.websocket.ConnectionDirectory;
import io.eventboard.notification.websocket.SubscriptionRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationBuilder {

  static final String ACTOR_FIELD = "actor_user_id";

  private final SubscriptionRegistry subscriptionRegistry;
  private final ConnectionDirectory connectionDirectory;
  private final RecipientPolicy recipientPolicy;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public BuiltNotification build(ChangeEnvelope envelope) {
    final NotificationRecord record =
        new NotificationRecord(
            notificationIdFor(envelope.messageId()),
            NotificationType.from(envelope.action()),
            envelope.topic(),
            envelope.dataText(ACTOR_FIELD),
            writeContent(envelope),
            envelope.messageId(),
            Instant.now(clock));
    final Set<String> recipients =
        new LinkedHashSet<>(
            connectionDirectory.userIdsOf(subscriptionRegistry.subscribersOf(envelope.topic())));
    recipients.addAll(recipientPolicy.interestedParties(envelope));
    return new BuiltNotification(record, recipients);
  }

  /** Same broker message, same id: a redelivery collides on insert instead of duplicating. */
  static UUID notificationIdFor(String messageId) {
    return UUID.nameUUIDFromBytes(("notification:" + messageId).getBytes(StandardCharsets.UTF_8));
  }

  private String writeContent(ChangeEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope.data());
    } catch (JsonProcessingException ex) {
      throw new NotificationEventPermanentException(
          "notification content serialization failure topic=" + envelope.topic(), ex);
    }
  }
}
