package io.eventboard.notification.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.eventboard.notification.auth.AuthenticationFailedException;
import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@ExtendWith(MockitoExtension.class)
class NotificationWebSocketHandlerTest {

  @Mock private ConnectionManager connectionManager;
  @Mock private WebSocketSession session;

  @Captor private ArgumentCaptor<ClientTransport> transportCaptor;

  @InjectMocks private NotificationWebSocketHandler handler;

  @Test
  void establishedSessionIsHandedToConnectionManagerWithToken() {
    final Map<String, Object> attributes = new HashMap<>();
    attributes.put(TokenHandshakeInterceptor.TOKEN_ATTRIBUTE, "t1");
    when(session.getAttributes()).thenReturn(attributes);
    when(session.getId()).thenReturn("s1");

    handler.afterConnectionEstablished(session);

    verify(connectionManager).accept(transportCaptor.capture(), eq("t1"));
    assertThat(transportCaptor.getValue().id()).isEqualTo("s1");
  }

  @Test
  void rejectedSessionDoesNotPropagate() {
    when(session.getAttributes()).thenReturn(new HashMap<>());
    when(connectionManager.accept(any(), eq(null)))
        .thenThrow(
            new AuthenticationFailedException(
                AuthenticationFailedException.Reason.MISSING_TOKEN, "token is required"));

    assertThatCode(() -> handler.afterConnectionEstablished(session)).doesNotThrowAnyException();
  }

  @Test
  void framesAndLifecycleAreRoutedBySessionId() throws Exception {
    when(session.getId()).thenReturn("s1");

    handler.handleMessage(session, new TextMessage("{\"action\":\"ping\"}"));
    handler.handleMessage(session, new PongMessage(ByteBuffer.allocate(0)));
    handler.afterConnectionClosed(session, CloseStatus.NORMAL);

    verify(connectionManager).handleControlFrame("s1", "{\"action\":\"ping\"}");
    verify(connectionManager).pong("s1");
    verify(connectionManager).disconnected("s1", CloseStatus.NORMAL);
  }
}
