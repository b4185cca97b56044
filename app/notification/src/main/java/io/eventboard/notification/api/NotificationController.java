/*
 * どこで: Notification API
 * 何を: 本人宛て通知の一覧/件数/単体取得と既読化のエンドポイントを提供する
 * なぜ: WebSocket を使わないクライアントや再接続後の取りこぼし確認に使うため
 */
package io.eventboard.notification.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventboard.notification.service.NotificationPage;
import io.eventboard.notification.service.NotificationStore;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
@RequiredArgsConstructor
public class NotificationController {

  static final int MAX_PAGE_SIZE = 100;

  private final NotificationStore notificationStore;
  private final ObjectMapper objectMapper;

  @GetMapping
  public NotificationListResponse list(
      Authentication authentication,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
    if (pageSize > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("page_size must be at most " + MAX_PAGE_SIZE);
    }
    final String userId = authentication.getName();
    final NotificationPage result = notificationStore.list(userId, page, pageSize);
    return new NotificationListResponse(
        result.notifications().stream()
            .map(view -> NotificationResponse.of(view, userId, objectMapper))
            .toList(),
        result.total(),
        result.page(),
        result.pageSize());
  }

  @GetMapping("/count")
  public UnreadCountResponse count(Authentication authentication) {
    return new UnreadCountResponse(notificationStore.unreadCount(authentication.getName()));
  }

  @GetMapping("/{notificationId}")
  public NotificationResponse get(
      Authentication authentication, @PathVariable("notificationId") UUID notificationId) {
    final String userId = authentication.getName();
    return NotificationResponse.of(
        notificationStore.get(notificationId, userId), userId, objectMapper);
  }

  @PostMapping("/mark-read/{notificationId}")
  public MarkReadResponse markRead(
      Authentication authentication, @PathVariable("notificationId") UUID notificationId) {
    notificationStore.markRead(notificationId, authentication.getName());
    return MarkReadResponse.success("Notification " + notificationId + " marked as read");
  }

  @PostMapping("/mark-all-read")
  public MarkReadResponse markAllRead(Authentication authentication) {
    final int updated = notificationStore.markAllRead(authentication.getName());
    return MarkReadResponse.success("Marked " + updated + " notifications as read");
  }
}
