package io.eventboard.notification.websocket;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TokenHandshakeInterceptorTest {

  private final TokenHandshakeInterceptor interceptor = new TokenHandshakeInterceptor();

  @Test
  void queryTokenWinsOverHeader() {
    final MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
    servletRequest.setQueryString("token=abc%20def");
    servletRequest.addHeader("Authorization", "Bearer header-token");

    assertThat(TokenHandshakeInterceptor.resolveToken(new ServletServerHttpRequest(servletRequest)))
        .isEqualTo("abc def");
  }

  @Test
  void fallsBackToBearerHeader() {
    final MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
    servletRequest.addHeader("Authorization", "bearer header-token");

    assertThat(TokenHandshakeInterceptor.resolveToken(new ServletServerHttpRequest(servletRequest)))
        .isEqualTo("header-token");
  }

  @Test
  void handshakeIsNeverRefused() {
    final Map<String, Object> attributes = new HashMap<>();

    final boolean proceed =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(new MockHttpServletRequest("GET", "/ws")),
            new ServletServerHttpResponse(new MockHttpServletResponse()),
            null,
            attributes);

    assertThat(proceed).isTrue();
    assertThat(attributes).doesNotContainKey(TokenHandshakeInterceptor.TOKEN_ATTRIBUTE);
  }

  @Test
  void storesResolvedToken() {
    final MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
    servletRequest.setQueryString("token=t1");
    final Map<String, Object> attributes = new HashMap<>();

    interceptor.beforeHandshake(
        new ServletServerHttpRequest(servletRequest),
        new ServletServerHttpResponse(new MockHttpServletResponse()),
        null,
        attributes);

    assertThat(attributes).containsEntry(TokenHandshakeInterceptor.TOKEN_ATTRIBUTE, "t1");
  }
}
