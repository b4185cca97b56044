/*
 * どこで: Notification WebSocket 層
 * 何を: サーバ -> クライアントのフレーム JSON を組み立て、クライアントの制御フレームを解釈する
 * なぜ: フレーム形式を一箇所に閉じ込め、接続管理からシリアライズの詳細を外すため
 */
package io.eventboard.notification.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.eventboard.notification.api.NotificationResponse;
import io.eventboard.notification.model.NotificationView;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationFrames {

  public static final String STATUS_SUBSCRIBED = "subscribed";
  public static final String STATUS_UNSUBSCRIBED = "unsubscribed";

  private final ObjectMapper objectMapper;

  public String connectionStatus(String userId, Instant timestamp) {
    return write(new ConnectionStatusFrame("connection_status", "connected", userId, timestamp));
  }

  public String subscriptionUpdate(String eventId, String status) {
    return write(new SubscriptionUpdateFrame("subscription_update", eventId, status));
  }

  public String pong(Instant timestamp) {
    return write(new PongFrame("pong", timestamp));
  }

  /** The notification as its recipient sees it; {@code is_read} is computed for {@code userId}. */
  public String notification(NotificationView view, String userId) {
    return write(NotificationResponse.of(view, userId, objectMapper));
  }

  /** Returns empty for anything that is not a well-formed control frame. */
  public Optional<ControlFrame> parseControl(String payload) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }
    final JsonNode action = root.get("action");
    if (action == null || !action.isTextual()) {
      return Optional.empty();
    }
    final String eventId = eventId(root);
    switch (action.asText().trim().toLowerCase(Locale.ROOT)) {
      case "ping":
        return Optional.of(new ControlFrame(ControlFrame.Action.PING, null));
      case "subscribe":
        return eventId == null
            ? Optional.empty()
            : Optional.of(new ControlFrame(ControlFrame.Action.SUBSCRIBE, eventId));
      case "unsubscribe":
        return eventId == null
            ? Optional.empty()
            : Optional.of(new ControlFrame(ControlFrame.Action.UNSUBSCRIBE, eventId));
      default:
        return Optional.empty();
    }
  }

  private String eventId(JsonNode root) {
    final JsonNode value = root.get("event_id");
    if (value == null || !(value.isTextual() || value.isNumber())) {
      return null;
    }
    final String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }

  private String write(Object frame) {
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("websocket frame serialization failure", ex);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ConnectionStatusFrame(
      String type, String status, String userId, Instant timestamp) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SubscriptionUpdateFrame(String type, String eventId, String status) {}

  public record PongFrame(String type, Instant timestamp) {}
}
