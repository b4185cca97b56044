package io.eventboard.notification.service;

import java.util.UUID;

/** The notification does not exist, or it is not addressed to the requesting user. */
public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID notificationId) {
    super("Notification " + notificationId + " not found");
  }
}
