/*
 * どこで: Notification NATS 接続
 * 何を: 固定間隔・上限付きの再試行で NATS へ接続する
 * なぜ: ブローカーの起動遅れを吸収しつつ、上限到達時は起動失敗にして再起動へ委ねるため
 */
package io.eventboard.notification.nats;

import com.google.common.annotations.VisibleForTesting;
import io.eventboard.notification.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class BrokerConnectionFactory {

    private static final Logger logger = LoggerFactory.getLogger(BrokerConnectionFactory.class);

    @FunctionalInterface
    interface Connector {
        Connection connect(Options options) throws IOException, InterruptedException;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final NatsProperties properties;
    private final BrokerConnectionMonitor monitor;
    private final Connector connector;
    private final Sleeper sleeper;

    @Autowired
    public BrokerConnectionFactory(NatsProperties properties, BrokerConnectionMonitor monitor) {
        this(properties, monitor, Nats::connect, duration -> Thread.sleep(duration.toMillis()));
    }

    @VisibleForTesting
    BrokerConnectionFactory(NatsProperties properties,
            BrokerConnectionMonitor monitor,
            Connector connector,
            Sleeper sleeper) {
        this.properties = properties;
        this.monitor = monitor;
        this.connector = connector;
        this.sleeper = sleeper;
    }

    /**
     * Connects, retrying up to {@code nats.max-retries} times with {@code nats.retry-delay} in
     * between.
     *
     * @throws IllegalStateException when every attempt failed; the broker state is then FAILED
     */
    public Connection connect() {
        final Options options = buildOptions();
        final int maxRetries = properties.maxRetries();
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            monitor.markConnecting(attempt);
            try {
                final Connection connection = connector.connect(options);
                monitor.markConnected();
                logger.info("nats connected url={} attempt={}", properties.url(), attempt);
                return connection;
            } catch (IOException ex) {
                lastFailure = ex;
                logger.warn("nats connect failed url={} attempt={} maxRetries={} error={}",
                        properties.url(),
                        attempt,
                        maxRetries,
                        ex.getMessage());
            } catch (InterruptedException ex) {
                throw interrupted(ex);
            }
            if (attempt < maxRetries) {
                try {
                    sleeper.sleep(properties.retryDelay());
                } catch (InterruptedException ex) {
                    throw interrupted(ex);
                }
            }
        }
        monitor.markFailed("connect attempts exhausted after " + maxRetries + " tries");
        logger.error("nats connect gave up url={} attempts={}", properties.url(), maxRetries);
        throw new IllegalStateException(
                "failed to connect to nats after " + maxRetries + " attempts", lastFailure);
    }

    @VisibleForTesting
    Options buildOptions() {
        // 接続後の切断も同じ上限と間隔で再接続させる
        return new Options.Builder()
                .server(properties.url())
                .connectionTimeout(properties.connectionTimeout())
                .maxReconnects(properties.maxRetries())
                .reconnectWait(properties.retryDelay())
                .connectionListener(monitor)
                .build();
    }

    private IllegalStateException interrupted(InterruptedException ex) {
        Thread.currentThread().interrupt();
        monitor.markFailed("interrupted while connecting");
        return new IllegalStateException("interrupted while connecting to nats", ex);
    }
}
