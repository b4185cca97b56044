package io.eventboard.notification.websocket;

import java.util.Collection;
import java.util.Set;

/** Read-only view of who is online, used when computing recipients. */
public interface ConnectionDirectory {

  /** User ids behind the given connections; unknown or closed connections are skipped. */
  Set<String> userIdsOf(Collection<String> connectionIds);

  Set<String> onlineUserIds();
}
