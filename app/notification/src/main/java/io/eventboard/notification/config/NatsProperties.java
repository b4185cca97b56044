/*
 * どこで: Notification アプリの設定バインド
 * 何を: NATS 接続設定 (URL/接続タイムアウト/再試行回数/再試行間隔) を読み込む
 * なぜ: 接続失敗時の固定間隔・上限付き再試行を環境ごとに調整するため
 */
package io.eventboard.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "nats")
@Validated
public record NatsProperties(
    boolean enabled,
    @NotBlank String url,
    @NotNull Duration connectionTimeout,
    @NotNull @Positive Integer maxRetries,
    @NotNull Duration retryDelay) {

  @AssertTrue(message = "nats.connection-timeout must be positive")
  public boolean isConnectionTimeoutPositive() {
    return connectionTimeout != null
        && !connectionTimeout.isZero()
        && !connectionTimeout.isNegative();
  }

  @AssertTrue(message = "nats.retry-delay must not be negative")
  public boolean isRetryDelayNotNegative() {
    // 0 は即時再試行として許容する
    return retryDelay != null && !retryDelay.isNegative();
  }
}
