package io.eventboard.notification.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.cors")
public record NotificationCorsProperties(List<String> allowedOrigins) {

  public NotificationCorsProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
  }

  public String[] allowedOriginArray() {
    return allowedOrigins.toArray(String[]::new);
  }
}
