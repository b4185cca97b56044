/*
 * どこで: Notification WebSocket 層
 * 何を: Spring WebSocket のコールバックを ConnectionManager の操作へ橋渡しする
 * なぜ: コンテナ固有の型を接続管理へ持ち込まないため
 */
package io.eventboard.notification.websocket;

import io.eventboard.notification.auth.AuthenticationFailedException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@RequiredArgsConstructor
public class NotificationWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationWebSocketHandler.class);

  private final ConnectionManager connectionManager;

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final Object token = session.getAttributes().get(TokenHandshakeInterceptor.TOKEN_ATTRIBUTE);
    try {
      connectionManager.accept(
          new WebSocketClientTransport(session), token instanceof String value ? value : null);
    } catch (AuthenticationFailedException | IllegalStateException ex) {
      // ソケットは accept 内で閉じ済み
      logger.debug(
          "websocket connection rejected sessionId={} message={}",
          session.getId(),
          ex.getMessage());
    }
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    connectionManager.handleControlFrame(session.getId(), message.getPayload());
  }

  @Override
  protected void handlePongMessage(WebSocketSession session, PongMessage message) {
    connectionManager.pong(session.getId());
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    connectionManager.transportError(session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    connectionManager.disconnected(session.getId(), status);
  }
}
