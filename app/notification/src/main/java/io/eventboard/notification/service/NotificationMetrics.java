/*
 * どこで: Notification サービス層
 * 何を: 受信結果/ファンアウト遅延/接続数/切断理由/DLQ のアプリ固有メトリクスを記録する
 * なぜ: 配信の健全性を Prometheus から直接観測できるようにするため
 */
package io.eventboard.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  private static final String METRIC_CONSUMER_TOTAL = "notification.consumer.messages.total";
  private static final String METRIC_DISPATCHED_TOTAL = "notification.dispatched.total";
  private static final String METRIC_DELIVERED_USERS_TOTAL = "notification.delivered.users.total";
  private static final String METRIC_FANOUT_LATENCY = "notification.fanout.latency";
  private static final String METRIC_CONNECTIONS_ACTIVE =
      "notification.websocket.connections.active";
  private static final String METRIC_CONNECTIONS_DROPPED =
      "notification.websocket.connections.dropped";
  private static final String METRIC_DEAD_LETTER_TOTAL = "notification.dead_letter.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeConnections = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> consumerCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> droppedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deadLetterCounters = new ConcurrentHashMap<>();
  private final Counter dispatchedCounter;
  private final Counter deliveredUsersCounter;
  private final Timer fanoutLatencyTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CONNECTIONS_ACTIVE, activeConnections, AtomicInteger::get)
        .description("Currently registered WebSocket connections")
        .register(meterRegistry);
    this.dispatchedCounter =
        Counter.builder(METRIC_DISPATCHED_TOTAL)
            .description("Notifications persisted and handed to the connection manager")
            .register(meterRegistry);
    this.deliveredUsersCounter =
        Counter.builder(METRIC_DELIVERED_USERS_TOTAL)
            .description("Users newly recorded in delivered_to")
            .register(meterRegistry);
    this.fanoutLatencyTimer =
        Timer.builder(METRIC_FANOUT_LATENCY)
            .description("Time from message receipt to the end of fan-out")
            .register(meterRegistry);
  }

  /** outcome: ack / nak / term / duplicate */
  public void recordConsumerOutcome(String outcome) {
    increment(
        consumerCounters, METRIC_CONSUMER_TOTAL, "Change message outcomes", "outcome", outcome);
  }

  public void recordDispatched(int deliveredUsers, Duration latency) {
    dispatchedCounter.increment();
    if (deliveredUsers > 0) {
      deliveredUsersCounter.increment(deliveredUsers);
    }
    if (latency != null && !latency.isNegative()) {
      fanoutLatencyTimer.record(latency);
    }
  }

  public void connectionOpened() {
    activeConnections.incrementAndGet();
  }

  public void connectionClosed(String reason) {
    activeConnections.updateAndGet(current -> Math.max(current - 1, 0));
    increment(
        droppedCounters,
        METRIC_CONNECTIONS_DROPPED,
        "Closed WebSocket connections",
        "reason",
        reason);
  }

  public void recordDeadLetter(String reason) {
    increment(
        deadLetterCounters,
        METRIC_DEAD_LETTER_TOTAL,
        "Messages stored as dead letters",
        "reason",
        reason);
  }

  private void increment(
      ConcurrentMap<String, Counter> counters,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    counters
        .computeIfAbsent(
            tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
