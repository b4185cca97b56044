package io.eventboard.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class NotificationWebSocketPropertiesValidationTest {

  private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

  @Test
  void defaultsAreValid() {
    assertThat(validator.validate(properties(Duration.ofSeconds(30), 2, 256))).isEmpty();
  }

  @Test
  void pingIntervalMustBePositive() {
    assertThat(validator.validate(properties(Duration.ZERO, 2, 256))).isNotEmpty();
  }

  @Test
  void queueCapacityAndMissedHeartbeatsMustBePositive() {
    assertThat(validator.validate(properties(Duration.ofSeconds(30), 0, 256))).isNotEmpty();
    assertThat(validator.validate(properties(Duration.ofSeconds(30), 2, 0))).isNotEmpty();
  }

  @Test
  void retentionDaysMustBePositive() {
    assertThat(
            validator.validate(new NotificationRetentionProperties(true, 0, Duration.ofHours(1))))
        .isNotEmpty();
  }

  private NotificationWebSocketProperties properties(
      Duration pingInterval, int maxMissedHeartbeats, int queueCapacity) {
    return new NotificationWebSocketProperties(
        "/ws", pingInterval, maxMissedHeartbeats, queueCapacity, Duration.ofSeconds(5));
  }
}
