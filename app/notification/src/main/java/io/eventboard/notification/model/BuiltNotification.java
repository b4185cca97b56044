package io.eventboard.notification.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Builder output: the new notification and the users it is addressed to. */
public record BuiltNotification(NotificationRecord notification, Set<String> recipients) {

  public BuiltNotification {
    recipients = Collections.unmodifiableSet(new LinkedHashSet<>(recipients));
  }
}
