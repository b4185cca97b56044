package io.eventboard.notification.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationType;
import io.eventboard.notification.model.NotificationView;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persisted notification as seen by one recipient. Shared by the HTTP read API and the WebSocket
 * notification frame.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID id,
    NotificationType type,
    String ownerTopic,
    String actorUserId,
    JsonNode content,
    List<String> deliveredTo,
    List<String> readBy,
    @JsonProperty("is_read") boolean isRead,
    Instant createdAt) {

  public NotificationResponse {
    deliveredTo = List.copyOf(deliveredTo);
    readBy = List.copyOf(readBy);
  }

  public static NotificationResponse of(
      NotificationView view, String userId, ObjectMapper objectMapper) {
    final NotificationRecord record = view.notification();
    return new NotificationResponse(
        record.notificationId(),
        record.type(),
        record.ownerTopic(),
        record.actorUserId(),
        readContent(record, objectMapper),
        List.copyOf(view.deliveredTo()),
        List.copyOf(view.readBy()),
        view.isReadBy(userId),
        record.createdAt());
  }

  private static JsonNode readContent(NotificationRecord record, ObjectMapper objectMapper) {
    try {
      return objectMapper.readTree(record.contentJson());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "notification content is not valid json notificationId=" + record.notificationId(), ex);
    }
  }
}
