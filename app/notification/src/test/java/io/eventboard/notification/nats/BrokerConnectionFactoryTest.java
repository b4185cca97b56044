package io.eventboard.notification.nats;

import io.eventboard.notification.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.Options;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class BrokerConnectionFactoryTest {

    private static final Duration RETRY_DELAY = Duration.ofSeconds(5);

    private final BrokerConnectionMonitor monitor = new BrokerConnectionMonitor();
    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    void retriesWithFixedDelayUntilConnected() {
        Connection connection = mock(Connection.class);
        List<Options> attempts = new ArrayList<>();
        BrokerConnectionFactory factory = factory(3, options -> {
            attempts.add(options);
            if (attempts.size() < 3) {
                throw new IOException("connection refused");
            }
            return connection;
        });

        assertThat(factory.connect()).isSameAs(connection);
        assertThat(attempts).hasSize(3);
        assertThat(sleeps).containsExactly(RETRY_DELAY, RETRY_DELAY);
        assertThat(monitor.state()).isEqualTo(BrokerConnectionState.CONNECTED);
    }

    @Test
    void failsAfterMaxRetriesAndMarksFailed() {
        BrokerConnectionFactory factory = factory(2, options -> {
            throw new IOException("connection refused");
        });

        assertThatThrownBy(factory::connect)
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class)
                .hasMessageContaining("2 attempts");
        // 最後の試行の後は待たない
        assertThat(sleeps).hasSize(1);
        assertThat(monitor.state()).isEqualTo(BrokerConnectionState.FAILED);
        assertThat(monitor.health().getDetails()).containsEntry("attempt", 2);
    }

    @Test
    void interruptStopsRetryingAndKeepsInterruptFlag() {
        BrokerConnectionFactory factory = factory(5, options -> {
            throw new InterruptedException("stop");
        });

        try {
            assertThatThrownBy(factory::connect).isInstanceOf(IllegalStateException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(monitor.state()).isEqualTo(BrokerConnectionState.FAILED);
            assertThat(sleeps).isEmpty();
        } finally {
            // 後続テストに割り込みフラグを残さない
            Thread.interrupted();
        }
    }

    @Test
    void optionsUseConfiguredRetryPolicy() {
        Options options = factory(4, o -> mock(Connection.class)).buildOptions();

        assertThat(options.getMaxReconnect()).isEqualTo(4);
        assertThat(options.getReconnectWait()).isEqualTo(RETRY_DELAY);
        assertThat(options.getConnectionTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(options.getConnectionListener()).isSameAs(monitor);
    }

    private BrokerConnectionFactory factory(int maxRetries, BrokerConnectionFactory.Connector connector) {
        NatsProperties properties = new NatsProperties(
                true, "nats://localhost:4222", Duration.ofSeconds(2), maxRetries, RETRY_DELAY);
        return new BrokerConnectionFactory(properties, monitor, connector, sleeps::add);
    }
}
