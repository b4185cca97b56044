/*
 * どこで: Notification API
 * 何を: ルートで broker 状態と接続数を返す
 * なぜ: 認証なしで疎通と購読状況を確認できるようにするため
 */
package io.eventboard.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.eventboard.notification.nats.BrokerConnectionMonitor;
import io.eventboard.notification.websocket.ConnectionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  static final String BROKER_DISABLED = "DISABLED";

  private final ObjectProvider<BrokerConnectionMonitor> brokerMonitor;
  private final ConnectionManager connectionManager;

  @GetMapping("/")
  public StatusResponse home() {
    final BrokerConnectionMonitor monitor = brokerMonitor.getIfAvailable();
    return new StatusResponse(
        "notification",
        "ok",
        monitor == null ? BROKER_DISABLED : monitor.state().name(),
        connectionManager.activeConnectionCount());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StatusResponse(
      String service, String status, String broker, int activeConnections) {}
}
