/*
 * どこで: Notification サービス層
 * 何を: 通知の保存と、配信記録/既読/全件既読/未読件数/一覧の冪等な操作を提供する
 * なぜ: 読み取り API とファンアウト処理が同じ不変条件 (delivered_to/read_by は増えるだけ) に従うため
 */
package io.eventboard.notification.service;

import io.eventboard.notification.model.BuiltNotification;
import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationView;
import io.eventboard.notification.repository.NotificationRecipientRepository;
import io.eventboard.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationStore {

  private static final Logger logger = LoggerFactory.getLogger(NotificationStore.class);

  private final NotificationRepository notificationRepository;
  private final NotificationRecipientRepository recipientRepository;
  private final Clock clock;

  /**
   * Persists the notification together with its addressed users.
   *
   * @throws DuplicateNotificationException when the id or source message was stored before
   */
  @Transactional
  public void insert(BuiltNotification built) {
    final NotificationRecord record = built.notification();
    try {
      notificationRepository.insert(record);
    } catch (DuplicateKeyException ex) {
      throw new DuplicateNotificationException(record.notificationId(), ex);
    }
    recipientRepository.insertAll(record.notificationId(), built.recipients());
  }

  /** Returns true only when this call added the user to delivered_to. */
  @Transactional
  public boolean recordDelivery(UUID notificationId, String userId) {
    return recipientRepository.recordDelivery(notificationId, userId, Instant.now(clock)) > 0;
  }

  @Transactional
  public void markRead(UUID notificationId, String userId) {
    final int updated = recipientRepository.markRead(notificationId, userId, Instant.now(clock));
    if (updated > 0) {
      logger.debug("notification marked read notificationId={} userId={}", notificationId, userId);
      return;
    }
    // 0 件更新は「既読済み」か「宛先でない/存在しない」のどちらか
    if (!recipientRepository.isAddressed(notificationId, userId)) {
      throw new NotificationNotFoundException(notificationId);
    }
  }

  @Transactional
  public int markAllRead(String userId) {
    final int updated = recipientRepository.markAllRead(userId, Instant.now(clock));
    logger.info("notifications marked read userId={} count={}", userId, updated);
    return updated;
  }

  @Transactional(readOnly = true)
  public long unreadCount(String userId) {
    return recipientRepository.countUnread(userId);
  }

  @Transactional(readOnly = true)
  public NotificationPage list(String userId, int page, int pageSize) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("page_size must be at least 1");
    }
    final long offset = (long) (page - 1) * pageSize;
    final List<NotificationView> items =
        notificationRepository.findPageForUser(userId, pageSize, offset);
    return new NotificationPage(items, notificationRepository.countForUser(userId), page, pageSize);
  }

  @Transactional(readOnly = true)
  public Optional<NotificationView> find(UUID notificationId, String userId) {
    return notificationRepository.findForUser(notificationId, userId);
  }

  public NotificationView get(UUID notificationId, String userId) {
    return find(notificationId, userId)
        .orElseThrow(() -> new NotificationNotFoundException(notificationId));
  }
}
