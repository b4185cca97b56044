/*
 * どこで: Notification テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: テストごとの重複設定を削減し、本番と同じ migration で検証するため
 */
package io.eventboard.notification;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

    // JVM 内のテスト全体で共通の Postgres コンテナを使い回し、起動コストを抑える
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    static {
        // @DynamicPropertySource より先に起動しておき、コンテキストキャッシュ時も接続先を保証する
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.datasource.hikari.schema", () -> "notification");

        // Flyway は本番同等の migration を使う
        registry.add("spring.flyway.enabled", () -> "true");
        registry.add("spring.flyway.locations", () -> "classpath:db/migration");
        registry.add("spring.flyway.default-schema", () -> "notification");
        registry.add("spring.flyway.schemas", () -> "notification");
        registry.add("spring.flyway.create-schemas", () -> "true");
        registry.add("spring.flyway.table", () -> "flyway_schema_history_notification");
    }
}
