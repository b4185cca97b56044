/*
 * どこで: Notification ドメインモデル
 * 何を: 通知種別と ChangeAction からの固定写像を定義する
 * なぜ: DB とフレームに保存される種別名を一箇所で管理するため
 */
package io.eventboard.notification.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
  EVENT_CREATED("EventCreated"),
  EVENT_UPDATED("EventUpdated"),
  EVENT_DELETED("EventDeleted");

  private final String wireName;

  NotificationType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static NotificationType from(ChangeAction action) {
    return switch (action) {
      case CREATED -> EVENT_CREATED;
      case UPDATED -> EVENT_UPDATED;
      case DELETED -> EVENT_DELETED;
    };
  }

  public static NotificationType fromWire(String value) {
    for (NotificationType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown notification type: " + value);
  }
}
