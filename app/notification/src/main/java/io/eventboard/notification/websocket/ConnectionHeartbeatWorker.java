package io.eventboard.notification.websocket;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConnectionHeartbeatWorker {

  private final ConnectionManager connectionManager;

  @Scheduled(fixedDelayString = "${notification.websocket.ping-interval}")
  public void run() {
    connectionManager.heartbeat();
  }
}
