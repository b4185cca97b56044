/*
 * どこで: Notification ドメインモデル
 * 何を: ブローカーから届く変更種別 (created/updated/deleted) を閉じた列挙で表す
 * なぜ: 未知の action をデコード境界で弾き、後段で分岐漏れを起こさないため
 */
package io.eventboard.notification.model;

import java.util.Locale;
import java.util.Optional;

public enum ChangeAction {
  CREATED("created"),
  UPDATED("updated"),
  DELETED("deleted");

  private final String wireName;

  ChangeAction(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<ChangeAction> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ChangeAction action : values()) {
      if (action.wireName.equals(normalized)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
