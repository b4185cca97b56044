/*
 * どこで: Notification アプリの設定バインド
 * 何を: WebSocket エンドポイント/ハートビート/送信キュー/停止猶予の設定を保持する
 * なぜ: 生存確認の間隔とバックプレッシャーの閾値を環境ごとに調整するため
 */
package io.eventboard.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.websocket")
@Validated
public record NotificationWebSocketProperties(
    @NotBlank String path,
    @NotNull Duration pingInterval,
    @NotNull @Positive Integer maxMissedHeartbeats,
    @NotNull @Positive Integer outboundQueueCapacity,
    @NotNull Duration shutdownGracePeriod) {

  @AssertTrue(message = "notification.websocket.ping-interval must be positive")
  public boolean isPingIntervalPositive() {
    return pingInterval != null && !pingInterval.isZero() && !pingInterval.isNegative();
  }

  @AssertTrue(message = "notification.websocket.shutdown-grace-period must not be negative")
  public boolean isShutdownGracePeriodNotNegative() {
    return shutdownGracePeriod != null && !shutdownGracePeriod.isNegative();
  }
}
