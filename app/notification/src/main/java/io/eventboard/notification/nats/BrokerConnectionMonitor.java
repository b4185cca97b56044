/*
 * どこで: Notification NATS 接続
 * 何を: 接続状態 (接続中/購読中/再接続中/失敗) を追跡し、Actuator health に公開する
 * なぜ: 再試行中は DEGRADED、打ち切り後は DOWN として外部の監視と再起動判断に使うため
 */
package io.eventboard.notification.nats;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component("brokerHealthIndicator")
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class BrokerConnectionMonitor implements ConnectionListener, HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "broker connection is being retried");

    private static final Logger logger = LoggerFactory.getLogger(BrokerConnectionMonitor.class);

    private final AtomicReference<BrokerConnectionState> state =
            new AtomicReference<>(BrokerConnectionState.DISCONNECTED);
    private final AtomicBoolean consuming = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile int attempt;
    private volatile String lastError;

    public BrokerConnectionState state() {
        return state.get();
    }

    public void markConnecting(int attempt) {
        this.attempt = attempt;
        transition(attempt > 1 ? BrokerConnectionState.RECONNECTING : BrokerConnectionState.CONNECTING);
    }

    public void markConnected() {
        lastError = null;
        transition(consuming.get() ? BrokerConnectionState.CONSUMING : BrokerConnectionState.CONNECTED);
    }

    public void markConsuming() {
        consuming.set(true);
        transition(BrokerConnectionState.CONSUMING);
    }

    public void markFailed(String reason) {
        lastError = reason;
        transition(BrokerConnectionState.FAILED);
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        // 停止時の切断/close は障害として扱わない
        stopping.set(true);
    }

    @Override
    public void connectionEvent(Connection connection, Events type) {
        switch (type) {
            case CONNECTED:
            case RECONNECTED:
            case RESUBSCRIBED:
                markConnected();
                break;
            case DISCONNECTED:
                transition(stopping.get()
                        ? BrokerConnectionState.DISCONNECTED
                        : BrokerConnectionState.RECONNECTING);
                break;
            case CLOSED:
                if (stopping.get()) {
                    transition(BrokerConnectionState.DISCONNECTED);
                } else {
                    markFailed("connection closed after reconnect attempts were exhausted");
                }
                break;
            default:
                logger.debug("nats connection event ignored type={}", type);
                break;
        }
    }

    @Override
    public Health health() {
        final BrokerConnectionState current = state.get();
        final Health.Builder builder = switch (current) {
            case CONNECTED, CONSUMING -> Health.up();
            case CONNECTING, RECONNECTING -> Health.status(DEGRADED);
            case FAILED -> Health.down();
            case DISCONNECTED -> Health.unknown();
        };
        builder.withDetail("state", current.name());
        if (attempt > 0) {
            builder.withDetail("attempt", attempt);
        }
        final String error = lastError;
        if (error != null) {
            builder.withDetail("error", error);
        }
        return builder.build();
    }

    private void transition(BrokerConnectionState next) {
        final BrokerConnectionState previous = state.getAndSet(next);
        if (previous != next) {
            logger.info("nats connection state changed from={} to={}", previous, next);
        }
    }
}
