/*
 * どこで: Notification ドメインモデル
 * 何を: 通知本体と delivered_to / read_by 集合をまとめた読み取りビュー
 * なぜ: is_read を受信者ごとに導出し、共有フラグとして保存しないため
 */
package io.eventboard.notification.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public record NotificationView(
    NotificationRecord notification, Set<String> deliveredTo, Set<String> readBy) {

  public NotificationView {
    // SpotBugs の EI_EXPOSE_REP 対応: 集合は順序付きで防御的コピーする
    deliveredTo = copyOf(deliveredTo);
    readBy = copyOf(readBy);
  }

  private static Set<String> copyOf(Set<String> users) {
    return Collections.unmodifiableSet(users == null ? new TreeSet<>() : new TreeSet<>(users));
  }

  public boolean isReadBy(String userId) {
    return userId != null && readBy.contains(userId);
  }

  public static NotificationView undelivered(NotificationRecord notification) {
    return new NotificationView(notification, Set.of(), Set.of());
  }
}
