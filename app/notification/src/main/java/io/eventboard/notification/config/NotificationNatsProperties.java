/*
 * どこで: Notification アプリの設定バインド
 * 何を: イベント購読 (subject/stream/durable/ack-wait/max-deliver) と DLQ advisory 購読の設定を保持する
 * なぜ: 受信トピックと再配信上限、上限超過後の退避先を起動時に検証するため
 */
package io.eventboard.notification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats")
@Validated
public record NotificationNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver,
    @NotNull @Valid DeadLetter deadLetter) {

  @AssertTrue(message = "notification.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    // Duration には @Positive が使えないため、ゼロ/負値を明示的に弾く。
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "notification.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }

  /** JetStream advisories (MaxDeliver / MsgTerminated) captured into a stream of their own. */
  public record DeadLetter(
      @NotBlank String stream,
      @NotBlank String maxDeliverSubject,
      @NotBlank String maxDeliverDurable,
      @NotBlank String terminatedSubject,
      @NotBlank String terminatedDurable) {

    public List<String> subjects() {
      return List.of(maxDeliverSubject, terminatedSubject);
    }
  }
}
