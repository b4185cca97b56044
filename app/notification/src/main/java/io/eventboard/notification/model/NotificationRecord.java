/*
 * どこで: Notification ドメインモデル
 * 何を: notifications テーブルの 1 行 (生成後は不変の部分) を表す
 * なぜ: 配信/既読の可変状態と分け、ビルダー出力を保存と配信で共有するため
 */
package io.eventboard.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    NotificationType type,
    String ownerTopic,
    String actorUserId,
    String contentJson,
    String messageId,
    Instant createdAt) {}
