/*
 * どこで: Notification 認証連携
 * 何を: auth service の /auth/me にトークンを渡して user_id を解決する
 * なぜ: トークン検証を外部サービスの契約に委ね、匿名接続へ格下げしないため
 */
package io.eventboard.notification.auth;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.eventboard.notification.config.AuthClientProperties;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@RequiredArgsConstructor
public class RemoteTokenVerifier implements TokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(RemoteTokenVerifier.class);

  private final RestClient authRestClient;
  private final AuthClientProperties properties;

  @Override
  public String verify(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.MISSING_TOKEN, "token is required");
    }
    final VerifiedUser user = callVerify(token.trim());
    if (user == null || user.userId() == null || user.userId().isBlank()) {
      logger.warn("auth verify response validation failed");
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.INVALID_RESPONSE, "auth response is invalid");
    }
    return user.userId();
  }

  private VerifiedUser callVerify(String token) {
    try {
      return authRestClient
          .get()
          .uri(properties.verifyPath())
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
          .retrieve()
          .body(VerifiedUser.class);
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      logger.warn(
          "auth verify failed with http status={} statusText={}", status, ex.getStatusText());
      // 401/403/404 はトークン自体の拒否。5xx 等は検証不能として区別する
      if (status == 401 || status == 403 || status == 404) {
        throw new AuthenticationFailedException(
            AuthenticationFailedException.Reason.INVALID_TOKEN, "token was rejected", ex);
      }
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.UNAVAILABLE, "auth service request failed", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("auth verify timed out");
        throw new AuthenticationFailedException(
            AuthenticationFailedException.Reason.UNAVAILABLE, "auth service timeout", ex);
      }
      logger.warn("auth verify connection failed", ex);
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.UNAVAILABLE, "auth service connection failed", ex);
    } catch (RuntimeException ex) {
      logger.warn("auth verify response parse failed", ex);
      throw new AuthenticationFailedException(
          AuthenticationFailedException.Reason.INVALID_RESPONSE, "auth response parse failed", ex);
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record VerifiedUser(String userId) {}
}
