/*
 * どこで: Notification NATS 購読
 * 何を: MaxDeliver / MsgTerminated advisory を購読して stream_seq を DLQ 保存する
 * なぜ: 再配信を打ち切られたメッセージを後から再投入できるよう記録するため
 */
package io.eventboard.notification.nats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.eventboard.notification.config.NotificationNatsProperties;
import io.eventboard.notification.model.DeadLetterReason;
import io.eventboard.notification.model.DeadLetterRecord;
import io.eventboard.notification.repository.NotificationDeadLetterRepository;
import io.eventboard.notification.service.NotificationMetrics;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterAdvisorySubscriber {

    private static final Logger logger = LoggerFactory.getLogger(DeadLetterAdvisorySubscriber.class);

    private final Connection connection;
    private final NotificationNatsProperties properties;
    private final NotificationDeadLetterRepository deadLetterRepository;
    private final NotificationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicBoolean started;
    private final List<JetStreamSubscription> subscriptions = new ArrayList<>();
    private Dispatcher dispatcher;

    public DeadLetterAdvisorySubscriber(Connection connection,
            NotificationNatsProperties properties,
            NotificationDeadLetterRepository deadLetterRepository,
            NotificationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        this.connection = connection;
        this.properties = properties;
        this.deadLetterRepository = deadLetterRepository;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        NotificationNatsProperties.DeadLetter deadLetter = properties.deadLetter();
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscriptions.add(jetStream.subscribe(
                    deadLetter.maxDeliverSubject(),
                    dispatcher,
                    message -> handleMessage(message, DeadLetterReason.MAX_DELIVER),
                    false,
                    buildPushSubscribeOptions(deadLetter.maxDeliverDurable())));
            subscriptions.add(jetStream.subscribe(
                    deadLetter.terminatedSubject(),
                    dispatcher,
                    message -> handleMessage(message, DeadLetterReason.TERMINATED),
                    false,
                    buildPushSubscribeOptions(deadLetter.terminatedDurable())));
            logger.info("dead letter advisory subscriber started stream={} subjects={}",
                    deadLetter.stream(),
                    deadLetter.subjects());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream advisory subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        for (JetStreamSubscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
        started.set(false);
    }

    @VisibleForTesting
    void handleMessage(Message message, DeadLetterReason reason) {
        try {
            JsonNode payload = objectMapper.readTree(message.getData());
            OptionalLong streamSeq = longField(payload, "stream_seq");
            if (streamSeq.isEmpty()) {
                // stream_seq が取れない advisory は再処理に使えないため破棄する
                logger.warn("advisory payload missing stream_seq subject={}", message.getSubject());
                ackSilently(message);
                return;
            }
            OptionalLong deliveries = longField(payload, "deliveries");
            DeadLetterRecord record = new DeadLetterRecord(
                    streamSeq.getAsLong(),
                    reason,
                    message.getSubject(),
                    new String(message.getData(), StandardCharsets.UTF_8),
                    errorFor(reason),
                    deliveries.isPresent() ? (int) deliveries.getAsLong() : null,
                    Instant.now(clock));
            if (deadLetterRepository.insert(record)) {
                metrics.recordDeadLetter(reason.name().toLowerCase(Locale.ROOT));
                logger.info("dead letter stored reason={} streamSeq={}", reason, streamSeq.getAsLong());
            }
            message.ack();
        } catch (IOException ex) {
            // 不正 JSON は再配信しても回復しないため ack で破棄する
            logger.warn("failed to parse advisory payload subject={}", message.getSubject(), ex);
            ackSilently(message);
        } catch (DataAccessException ex) {
            // DB 障害は復旧後に再処理できるよう nak で再配信させる
            logger.warn("temporary failure while handling advisory payload subject={}",
                    message.getSubject(), ex);
            nakSilently(message);
        } catch (RuntimeException ex) {
            logger.warn("failed to handle advisory payload subject={}", message.getSubject(), ex);
            nakSilently(message);
        }
    }

    private OptionalLong longField(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || !node.canConvertToLong()) {
            return OptionalLong.empty();
        }
        long value = node.asLong();
        return value <= 0L ? OptionalLong.empty() : OptionalLong.of(value);
    }

    private String errorFor(DeadLetterReason reason) {
        return reason == DeadLetterReason.MAX_DELIVER
                ? "max deliveries exceeded"
                : "terminated by consumer";
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        NotificationNatsProperties.DeadLetter deadLetter = properties.deadLetter();
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(deadLetter.stream())
                .subjects(deadLetter.subjects())
                .build();
        JetStreamStreams.upsert(connection.jetStreamManagement(), streamConfiguration);
        logger.info("dead letter advisory stream ensured stream={} subjects={}",
                deadLetter.stream(),
                deadLetter.subjects());
    }

    private PushSubscribeOptions buildPushSubscribeOptions(String durable) {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                // advisory も本流と同じ再配信制御値を流用する
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.deadLetter().stream())
                .durable(durable)
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack advisory message", ex);
        }
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack advisory message", ex);
        }
    }
}
