package io.eventboard.notification.service;

import io.eventboard.notification.model.NotificationView;
import java.util.List;

public record NotificationPage(
    List<NotificationView> notifications, long total, int page, int pageSize) {

  public NotificationPage {
    notifications = List.copyOf(notifications);
  }
}
