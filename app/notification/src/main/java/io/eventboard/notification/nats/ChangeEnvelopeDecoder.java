/*
 * どこで: Notification NATS 受信境界
 * 何を: 生の JSON ペイロードを ChangeEnvelope に変換し、不正な入力を失敗結果として返す
 * なぜ: 壊れたメッセージで購読ループを止めず、TERM と DLQ 記録に振り分けるため
 */
package io.eventboard.notification.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventboard.notification.model.ChangeAction;
import io.eventboard.notification.model.ChangeEnvelope;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChangeEnvelopeDecoder {

  private static final Set<String> ACCEPTED_TYPES = Set.of("event", "notification");
  private static final String LEGACY_TYPE_PREFIX = "event.";
  private static final String CREATED_BY_FIELD = "created_by";

  private final ObjectMapper objectMapper;

  /** Never throws; every problem with the payload becomes a failure result. */
  public DecodeResult decode(byte[] payload, String messageId) {
    if (payload == null || payload.length == 0) {
      return DecodeResult.failure("payload is empty");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      return DecodeResult.failure("payload is not valid json: " + ex.getOriginalMessage());
    } catch (IOException ex) {
      return DecodeResult.failure("payload could not be read: " + ex.getMessage());
    }
    if (root == null || !root.isObject()) {
      return DecodeResult.failure("payload must be a json object");
    }
    final String type = text(root, "type");
    if (type != null && !ACCEPTED_TYPES.contains(type)) {
      return DecodeResult.failure("unsupported envelope type: " + type);
    }
    if (root.has("action") || root.has("data")) {
      return decodeCanonical((ObjectNode) root, messageId);
    }
    if (root.has("notification_type")) {
      return decodeLegacy((ObjectNode) root, messageId);
    }
    return DecodeResult.failure("action is required");
  }

  // { "type": "event", "action": "...", "data": {...}, "topic": "..." }
  private DecodeResult decodeCanonical(ObjectNode root, String messageId) {
    final Optional<ChangeAction> action = ChangeAction.fromWire(text(root, "action"));
    if (action.isEmpty()) {
      return DecodeResult.failure("action is missing or unknown: " + text(root, "action"));
    }
    final JsonNode data = root.get("data");
    if (data == null || !data.isObject()) {
      return DecodeResult.failure("data must be a json object");
    }
    final ObjectNode dataObject = (ObjectNode) data;
    String topic = text(root, "topic");
    if (topic == null) {
      topic = firstText(dataObject, "event_id", "id");
    }
    return complete(topic, action.get(), dataObject, messageId);
  }

  // 旧形式: { "notification_type": "event.updated", "event": {...}, "user": "..." }
  private DecodeResult decodeLegacy(ObjectNode root, String messageId) {
    final String notificationType = text(root, "notification_type");
    if (notificationType == null || !notificationType.startsWith(LEGACY_TYPE_PREFIX)) {
      return DecodeResult.failure("notification_type is unknown: " + notificationType);
    }
    final Optional<ChangeAction> action =
        ChangeAction.fromWire(notificationType.substring(LEGACY_TYPE_PREFIX.length()));
    if (action.isEmpty()) {
      return DecodeResult.failure("notification_type is unknown: " + notificationType);
    }
    final JsonNode event = root.get("event");
    if (event == null || !event.isObject()) {
      return DecodeResult.failure("event must be a json object");
    }
    final ObjectNode data = ((ObjectNode) event).deepCopy();
    final String actor = text(root, "user");
    if (actor != null && !data.has("actor_user_id")) {
      data.put("actor_user_id", actor);
    }
    // 旧形式の created では user が作成者を表す
    if (actor != null && action.get() == ChangeAction.CREATED && !data.has(CREATED_BY_FIELD)) {
      data.put(CREATED_BY_FIELD, actor);
    }
    return complete(firstText(data, "event_id", "id"), action.get(), data, messageId);
  }

  private DecodeResult complete(
      String topic, ChangeAction action, ObjectNode data, String messageId) {
    if (topic == null) {
      return DecodeResult.failure("topic could not be resolved from envelope");
    }
    if (messageId == null || messageId.isBlank()) {
      return DecodeResult.failure("message id is required");
    }
    return DecodeResult.success(new ChangeEnvelope(topic, action, data, messageId));
  }

  private String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      final String value = text(node, field);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) {
      return null;
    }
    final String text = value.asText();
    return text.isBlank() ? null : text.trim();
  }
}
