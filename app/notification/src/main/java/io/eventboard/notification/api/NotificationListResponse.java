package io.eventboard.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    List<NotificationResponse> notifications, long total, int page, int pageSize) {

  public NotificationListResponse {
    notifications = List.copyOf(notifications);
  }
}
