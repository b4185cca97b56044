/*
 * どこで: Notification サービス層
 * 何を: 再配信しても回復しない変更メッセージの処理失敗を表す
 * なぜ: Subscriber が nak ではなく TERM を選べるよう、恒久的失敗を型で区別するため
 */
package io.eventboard.notification.service;

public class NotificationEventPermanentException extends RuntimeException {

  public NotificationEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
