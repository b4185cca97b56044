/*
 * どこで: Notification ドメインモデル
 * 何を: デコード済みのブローカーメッセージ (topic/action/data/message_id) を保持する
 * なぜ: 受信からビルドまでの間だけ使う型付きの受け渡し単位にするため
 */
package io.eventboard.notification.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Decoded broker message. Lives only between decode and build, never persisted as-is.
 *
 * <p>{@code data} is kept as a private deep copy, so later mutation by the caller does not leak
 * into the notification content.
 */
public record ChangeEnvelope(String topic, ChangeAction action, ObjectNode data, String messageId) {

  public ChangeEnvelope {
    data = data == null ? null : data.deepCopy();
  }

  @Override
  public ObjectNode data() {
    return data == null ? null : data.deepCopy();
  }

  /** Reads a top-level text field of {@code data}, ignoring blank values. */
  public String dataText(String field) {
    if (data == null || !data.hasNonNull(field)) {
      return null;
    }
    final String value = data.get(field).asText();
    return value.isBlank() ? null : value;
  }
}
