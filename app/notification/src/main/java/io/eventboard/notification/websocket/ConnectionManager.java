/*
 * どこで: Notification WebSocket 層
 * 何を: 接続の認証/登録/配信/ハートビート/制御フレーム/切断/停止をまとめて管理する
 * なぜ: 接続表・ユーザ別接続表・購読表の整合を 1 箇所で保ち、失敗した接続を他から隔離するため
 */
package io.eventboard.notification.websocket;

import com.google.common.annotations.VisibleForTesting;
import io.eventboard.notification.auth.AuthenticationFailedException;
import io.eventboard.notification.auth.TokenVerifier;
import io.eventboard.notification.config.NotificationWebSocketProperties;
import io.eventboard.notification.model.NotificationView;
import io.eventboard.notification.service.NotificationMetrics;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

@Component
public class ConnectionManager implements ConnectionDirectory {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

  static final CloseStatus AUTHENTICATION_FAILED =
      CloseStatus.POLICY_VIOLATION.withReason("authentication failed");
  static final CloseStatus QUEUE_OVERFLOW =
      CloseStatus.POLICY_VIOLATION.withReason("outbound queue overflow");
  static final CloseStatus HEARTBEAT_TIMEOUT =
      CloseStatus.SESSION_NOT_RELIABLE.withReason("heartbeat timeout");
  static final CloseStatus WRITE_FAILED = CloseStatus.SERVER_ERROR.withReason("write failed");

  private static final long SHUTDOWN_POLL_MILLIS = 50L;

  private final TokenVerifier tokenVerifier;
  private final SubscriptionRegistry subscriptionRegistry;
  private final NotificationFrames frames;
  private final NotificationWebSocketProperties properties;
  private final NotificationMetrics metrics;
  private final Executor writerExecutor;
  private final Clock clock;

  private final ConcurrentMap<String, ClientConnection> connections = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  public ConnectionManager(
      TokenVerifier tokenVerifier,
      SubscriptionRegistry subscriptionRegistry,
      NotificationFrames frames,
      NotificationWebSocketProperties properties,
      NotificationMetrics metrics,
      @Qualifier("connectionWriterExecutor") Executor writerExecutor,
      Clock clock) {
    this.tokenVerifier = tokenVerifier;
    this.subscriptionRegistry = subscriptionRegistry;
    this.frames = frames;
    this.properties = properties;
    this.metrics = metrics;
    this.writerExecutor = writerExecutor;
    this.clock = clock;
  }

  /**
   * Authenticates and registers a freshly opened socket, then greets it.
   *
   * @throws AuthenticationFailedException after closing the socket with 1008
   * @throws IllegalStateException after closing the socket with 1001 when shutting down
   */
  public ClientConnection accept(ClientTransport transport, String token) {
    if (!accepting.get()) {
      transport.close(CloseStatus.GOING_AWAY);
      throw new IllegalStateException("connection manager is shutting down");
    }
    final String userId;
    try {
      userId = tokenVerifier.verify(token);
    } catch (AuthenticationFailedException ex) {
      logger.info(
          "websocket authentication failed connectionId={} reason={}", transport.id(), ex.reason());
      transport.close(AUTHENTICATION_FAILED);
      throw ex;
    }

    final Instant now = Instant.now(clock);
    final ClientConnection connection =
        new ClientConnection(
            transport,
            userId,
            properties.outboundQueueCapacity(),
            writerExecutor,
            this::onWriteFailure,
            now);
    connections.put(connection.id(), connection);
    connectionsByUser.compute(
        userId,
        (key, ids) -> {
          final Set<String> target = ids == null ? ConcurrentHashMap.newKeySet() : ids;
          target.add(connection.id());
          return target;
        });
    connection.activate();
    metrics.connectionOpened();
    logger.info("websocket connection accepted connectionId={} userId={}", connection.id(), userId);
    send(connection, frames.connectionStatus(userId, now));
    return connection;
  }

  /**
   * Queues the notification for every active connection of each recipient.
   *
   * @return users for whom at least one connection accepted the frame
   */
  public Set<String> dispatch(NotificationView notification, Collection<String> recipients) {
    final Set<String> delivered = new LinkedHashSet<>();
    for (String userId : new LinkedHashSet<>(recipients)) {
      final Set<String> ids = connectionsByUser.get(userId);
      if (ids == null || ids.isEmpty()) {
        continue;
      }
      final String payload = frames.notification(notification, userId);
      for (String connectionId : List.copyOf(ids)) {
        final ClientConnection connection = connections.get(connectionId);
        if (connection != null
            && send(connection, payload)
            && connection.state() == ConnectionState.ACTIVE) {
          delivered.add(userId);
        }
      }
    }
    return delivered;
  }

  /** One heartbeat window: counts misses, closes dead connections, pings the rest. */
  public void heartbeat() {
    for (ClientConnection connection : List.copyOf(connections.values())) {
      if (connection.state() != ConnectionState.ACTIVE) {
        continue;
      }
      final int missed = connection.recordHeartbeatTick();
      if (missed >= properties.maxMissedHeartbeats()) {
        logger.info(
            "websocket heartbeat timeout connectionId={} userId={} missed={} lastPongAt={}",
            connection.id(),
            connection.userId(),
            missed,
            connection.lastPongAt());
        close(connection, HEARTBEAT_TIMEOUT, "heartbeat_timeout");
        continue;
      }
      connection.markPingSent();
      offer(connection, OutboundFrame.ping());
    }
  }

  public void handleControlFrame(String connectionId, String payload) {
    final ClientConnection connection = connections.get(connectionId);
    if (connection == null) {
      return;
    }
    final Optional<ControlFrame> parsed = frames.parseControl(payload);
    if (parsed.isEmpty()) {
      logger.warn(
          "malformed control frame ignored connectionId={} length={}",
          connectionId,
          payload == null ? 0 : payload.length());
      return;
    }
    final ControlFrame frame = parsed.get();
    switch (frame.action()) {
      case SUBSCRIBE -> {
        if (connection.runIfActive(
            () -> subscriptionRegistry.subscribe(connectionId, frame.eventId()))) {
          send(
              connection,
              frames.subscriptionUpdate(frame.eventId(), NotificationFrames.STATUS_SUBSCRIBED));
        }
      }
      case UNSUBSCRIBE -> {
        if (connection.runIfActive(
            () -> subscriptionRegistry.unsubscribe(connectionId, frame.eventId()))) {
          send(
              connection,
              frames.subscriptionUpdate(frame.eventId(), NotificationFrames.STATUS_UNSUBSCRIBED));
        }
      }
      case PING -> {
        final Instant now = Instant.now(clock);
        connection.markPong(now);
        send(connection, frames.pong(now));
      }
    }
  }

  public void pong(String connectionId) {
    final ClientConnection connection = connections.get(connectionId);
    if (connection != null) {
      connection.markPong(Instant.now(clock));
    }
  }

  /** The client or the container closed the socket; only the registry needs cleaning. */
  public void disconnected(String connectionId, CloseStatus status) {
    final ClientConnection connection = connections.get(connectionId);
    if (connection == null) {
      return;
    }
    if (release(connection, "client_closed")) {
      logger.info(
          "websocket connection closed by peer connectionId={} userId={} code={}",
          connectionId,
          connection.userId(),
          status.getCode());
    }
  }

  public void transportError(String connectionId, Throwable cause) {
    final ClientConnection connection = connections.get(connectionId);
    if (connection == null) {
      return;
    }
    logger.warn("websocket transport error connectionId={}", connectionId, cause);
    close(connection, CloseStatus.SERVER_ERROR, "transport_error");
  }

  @Override
  public Set<String> userIdsOf(Collection<String> connectionIds) {
    final Set<String> userIds = new LinkedHashSet<>();
    for (String connectionId : connectionIds) {
      final ClientConnection connection = connections.get(connectionId);
      if (connection != null && connection.state() == ConnectionState.ACTIVE) {
        userIds.add(connection.userId());
      }
    }
    return userIds;
  }

  @Override
  public Set<String> onlineUserIds() {
    return Set.copyOf(connectionsByUser.keySet());
  }

  public int activeConnectionCount() {
    return connections.size();
  }

  @VisibleForTesting
  Optional<ClientConnection> connection(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  /** Stops accepting, lets queued frames drain for the grace period, then closes with 1001. */
  @PreDestroy
  public void shutdown() {
    accepting.set(false);
    final List<ClientConnection> open = List.copyOf(connections.values());
    if (open.isEmpty()) {
      return;
    }
    open.forEach(ClientConnection::markClosing);
    final long deadline = System.nanoTime() + properties.shutdownGracePeriod().toNanos();
    while (open.stream().anyMatch(connection -> !connection.isDrained())
        && System.nanoTime() < deadline) {
      try {
        TimeUnit.MILLISECONDS.sleep(SHUTDOWN_POLL_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    for (ClientConnection connection : open) {
      close(connection, CloseStatus.GOING_AWAY, "shutdown");
    }
    logger.info("websocket connections closed for shutdown count={}", open.size());
  }

  void close(ClientConnection connection, CloseStatus status, String reason) {
    if (!release(connection, reason)) {
      return;
    }
    connection.closeTransport(status);
    logger.info(
        "websocket connection closed connectionId={} userId={} reason={} code={}",
        connection.id(),
        connection.userId(),
        reason,
        status.getCode());
  }

  private boolean send(ClientConnection connection, String payload) {
    return offer(connection, OutboundFrame.text(payload));
  }

  private boolean offer(ClientConnection connection, OutboundFrame frame) {
    final ClientConnection.OfferResult result = connection.offer(frame);
    if (result == ClientConnection.OfferResult.QUEUE_FULL) {
      logger.warn(
          "websocket outbound queue overflow connectionId={} userId={}",
          connection.id(),
          connection.userId());
      close(connection, QUEUE_OVERFLOW, "queue_overflow");
      return false;
    }
    return result == ClientConnection.OfferResult.ACCEPTED;
  }

  private void onWriteFailure(ClientConnection connection, Exception cause) {
    logger.warn(
        "websocket write failed connectionId={} userId={}",
        connection.id(),
        connection.userId(),
        cause);
    close(connection, WRITE_FAILED, "write_failed");
  }

  // markClosed で状態を閉じてから表を外すため、購読の追加は runIfActive で必ず弾かれる
  private boolean release(ClientConnection connection, String reason) {
    if (!connection.markClosed()) {
      return false;
    }
    connections.remove(connection.id(), connection);
    connectionsByUser.computeIfPresent(
        connection.userId(),
        (key, ids) -> {
          ids.remove(connection.id());
          return ids.isEmpty() ? null : ids;
        });
    subscriptionRegistry.dropConnection(connection.id());
    metrics.connectionClosed(reason);
    return true;
  }
}
