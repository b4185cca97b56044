package io.eventboard.notification.websocket;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Copies the bearer token from the {@code token} query parameter or the {@code Authorization}
 * header into the session attributes.
 *
 * <p>The upgrade itself is never refused here: verification happens after the upgrade so that a
 * rejected client receives close code 1008 instead of a bare HTTP error.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

  public static final String TOKEN_ATTRIBUTE = "notification.token";

  private static final String BEARER_PREFIX = "Bearer ";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String token = resolveToken(request);
    if (token != null) {
      attributes.put(TOKEN_ATTRIBUTE, token);
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}

  static String resolveToken(ServerHttpRequest request) {
    final String fromQuery =
        UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
    if (fromQuery != null && !fromQuery.isBlank()) {
      return UriUtils.decode(fromQuery, StandardCharsets.UTF_8).trim();
    }
    final String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      final String token = header.substring(BEARER_PREFIX.length()).trim();
      return token.isEmpty() ? null : token;
    }
    return null;
  }
}
