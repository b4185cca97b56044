/*
 * どこで: Notification API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package io.eventboard.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  AUTH_UNAVAILABLE,
  NOTIFICATION_NOT_FOUND,
  INTERNAL_ERROR
}
