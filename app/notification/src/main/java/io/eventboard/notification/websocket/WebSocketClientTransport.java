package io.eventboard.notification.websocket;

import java.io.IOException;
import java.nio.ByteBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

final class WebSocketClientTransport implements ClientTransport {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketClientTransport.class);

  private final WebSocketSession session;

  WebSocketClientTransport(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void sendText(String payload) throws IOException {
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  public void sendPing() throws IOException {
    session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
  }

  @Override
  public void close(CloseStatus status) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(status);
    } catch (IOException ex) {
      // 相手側が既に切断している場合。登録解除は呼び出し側で完了している
      logger.warn(
          "websocket close failed sessionId={} code={}", session.getId(), status.getCode(), ex);
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }
}
