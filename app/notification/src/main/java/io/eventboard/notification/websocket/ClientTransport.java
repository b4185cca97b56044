package io.eventboard.notification.websocket;

import java.io.IOException;
import org.springframework.web.socket.CloseStatus;

/**
 * The socket behind one client connection. Sends are only ever issued by the connection's serial
 * drain task, so implementations need not be thread-safe for writes.
 */
public interface ClientTransport {

  String id();

  void sendText(String payload) throws IOException;

  void sendPing() throws IOException;

  void close(CloseStatus status);

  boolean isOpen();
}
