/*
 * どこで: Notification アプリの WebSocket 設定
 * 何を: 通知エンドポイントにハンドラとトークン取得インターセプタを登録する
 * なぜ: パスと許可 Origin を設定値から決め、HTTP API と同じ CORS 方針に揃えるため
 */
package io.eventboard.notification.config;

import io.eventboard.notification.websocket.NotificationWebSocketHandler;
import io.eventboard.notification.websocket.TokenHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final NotificationWebSocketHandler handler;
  private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
  private final NotificationWebSocketProperties properties;
  private final NotificationCorsProperties corsProperties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    final WebSocketHandlerRegistration registration =
        registry.addHandler(handler, properties.path()).addInterceptors(tokenHandshakeInterceptor);
    if (!corsProperties.allowedOrigins().isEmpty()) {
      registration.setAllowedOriginPatterns(corsProperties.allowedOriginArray());
    }
  }
}
