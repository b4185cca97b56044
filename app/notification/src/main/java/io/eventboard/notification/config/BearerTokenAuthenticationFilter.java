package io.eventboard.notification.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventboard.notification.api.ApiErrorCode;
import io.eventboard.notification.api.ApiErrorResponse;
import io.eventboard.notification.auth.AuthenticationFailedException;
import io.eventboard.notification.auth.TokenVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code Authorization: Bearer} tokens to a user id through the same {@link TokenVerifier}
 * the WebSocket handshake uses. Requests without the header pass through unauthenticated and are
 * left to the authorization rules.
 */
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String USER_ROLE = "ROLE_USER";

  private final TokenVerifier tokenVerifier;
  private final ObjectMapper objectMapper;
  private final String webSocketPath;

  public BearerTokenAuthenticationFilter(
      TokenVerifier tokenVerifier, ObjectMapper objectMapper, String webSocketPath) {
    this.tokenVerifier = tokenVerifier;
    this.objectMapper = objectMapper;
    this.webSocketPath = webSocketPath;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    // WebSocket はハンドシェイク後に ConnectionManager が検証する
    final String uri = request.getRequestURI();
    return uri == null || uri.equals(webSocketPath) || uri.startsWith("/actuator/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      filterChain.doFilter(request, response);
      return;
    }
    final String userId;
    try {
      userId = tokenVerifier.verify(header.substring(BEARER_PREFIX.length()));
    } catch (AuthenticationFailedException ex) {
      logger.info(
          "bearer authentication failed path={} reason={}", request.getRequestURI(), ex.reason());
      if (ex.reason() == AuthenticationFailedException.Reason.UNAVAILABLE) {
        writeError(
            response,
            HttpStatus.SERVICE_UNAVAILABLE,
            ApiErrorCode.AUTH_UNAVAILABLE,
            "authentication service is unavailable");
      } else {
        writeError(response, HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, ex.getMessage());
      }
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            userId, "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    logger.debug("bearer authentication established path={}", request.getRequestURI());
    filterChain.doFilter(request, response);
  }

  void writeError(
      HttpServletResponse response, HttpStatus status, ApiErrorCode code, String message)
      throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), new ApiErrorResponse(code, message));
  }
}
