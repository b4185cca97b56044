package io.eventboard.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final NotificationMetrics metrics = new NotificationMetrics(registry);

  @Test
  void countsConsumerOutcomesByTag() {
    metrics.recordConsumerOutcome("ack");
    metrics.recordConsumerOutcome("ack");
    metrics.recordConsumerOutcome("nak");

    assertThat(counter("notification.consumer.messages.total", "outcome", "ack")).isEqualTo(2.0);
    assertThat(counter("notification.consumer.messages.total", "outcome", "nak")).isEqualTo(1.0);
  }

  @Test
  void recordsDispatchAndLatency() {
    metrics.recordDispatched(3, Duration.ofMillis(20));
    metrics.recordDispatched(0, Duration.ofMillis(10));

    assertThat(registry.get("notification.dispatched.total").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("notification.delivered.users.total").counter().count())
        .isEqualTo(3.0);
    assertThat(registry.get("notification.fanout.latency").timer().count()).isEqualTo(2L);
    assertThat(
            registry.get("notification.fanout.latency").timer().totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(30.0);
  }

  @Test
  void activeConnectionGaugeNeverGoesNegative() {
    metrics.connectionOpened();
    metrics.connectionClosed("client_closed");
    metrics.connectionClosed("client_closed");

    assertThat(registry.get("notification.websocket.connections.active").gauge().value())
        .isZero();
    assertThat(counter("notification.websocket.connections.dropped", "reason", "client_closed"))
        .isEqualTo(2.0);
  }

  @Test
  void countsDeadLettersByReason() {
    metrics.recordDeadLetter("decode_failed");

    assertThat(counter("notification.dead_letter.total", "reason", "decode_failed"))
        .isEqualTo(1.0);
  }

  private double counter(String name, String tagKey, String tagValue) {
    return registry.get(name).tag(tagKey, tagValue).counter().count();
  }
}
