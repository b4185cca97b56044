/*
 * どこで: Notification サービス層
 * 何を: イベント作成者を常に通知先に含め、任意で created を接続中の全ユーザへ広げる
 * なぜ: 購読していない作成者にもライフサイクル通知を届けるため
 */
package io.eventboard.notification.service;

import io.eventboard.notification.config.NotificationRecipientProperties;
import io.eventboard.notification.model.ChangeAction;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.repository.TopicOwnerRepository;
import io.eventboard.notification.websocket.ConnectionDirectory;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EventCreatorRecipientPolicy implements RecipientPolicy {

  static final String CREATED_BY_FIELD = "created_by";

  private final TopicOwnerRepository topicOwnerRepository;
  private final ConnectionDirectory connectionDirectory;
  private final NotificationRecipientProperties properties;
  private final Clock clock;

  @Override
  public Set<String> interestedParties(ChangeEnvelope envelope) {
    final Set<String> parties = new LinkedHashSet<>();
    final String createdBy = envelope.dataText(CREATED_BY_FIELD);
    if (createdBy != null) {
      parties.add(createdBy);
    }
    // updated/deleted は created_by を含まないことがあるため、保存済みの作成者も加える
    parties.addAll(topicOwnerRepository.findOwners(envelope.topic()));
    if (properties.broadcastCreated() && envelope.action() == ChangeAction.CREATED) {
      parties.addAll(connectionDirectory.onlineUserIds());
    }
    return parties;
  }

  @Override
  public void remember(ChangeEnvelope envelope) {
    final Instant now = Instant.now(clock);
    final String createdBy = envelope.dataText(CREATED_BY_FIELD);
    if (createdBy == null) {
      // 作成者が分からない更新でも、既存の作成者の保持期間は延ばす
      topicOwnerRepository.touch(envelope.topic(), now);
      return;
    }
    topicOwnerRepository.register(envelope.topic(), createdBy, now);
  }
}
