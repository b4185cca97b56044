package io.eventboard.notification.service;

import java.util.UUID;

/** Insert of a notification whose id or source message id is already stored. Never retried. */
public class DuplicateNotificationException extends RuntimeException {

  private final UUID notificationId;

  public DuplicateNotificationException(UUID notificationId, Throwable cause) {
    super("notification already exists: " + notificationId, cause);
    this.notificationId = notificationId;
  }

  public UUID notificationId() {
    return notificationId;
  }
}
