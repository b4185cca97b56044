/*
 * どこで: Notification アプリのインフラ設定
 * 何を: NATS Connection を Spring 管理下に置く
 * なぜ: Subscriber が同一接続を再利用するため
 */
package io.eventboard.notification.config;

import io.eventboard.notification.nats.BrokerConnectionFactory;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    @Bean(destroyMethod = "close")
    public Connection natsConnection(BrokerConnectionFactory connectionFactory) {
        return connectionFactory.connect();
    }
}
