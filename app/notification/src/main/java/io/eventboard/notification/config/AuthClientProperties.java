package io.eventboard.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth")
public record AuthClientProperties(
    String baseUrl, String verifyPath, Duration connectTimeout, Duration readTimeout) {

  public AuthClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://auth-service:8000" : baseUrl;
    verifyPath = verifyPath == null || verifyPath.isBlank() ? "/auth/me" : verifyPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(3) : readTimeout;
  }
}
