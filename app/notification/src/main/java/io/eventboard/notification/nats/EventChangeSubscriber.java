/*
 * どこで: Notification NATS 購読
 * 何を: イベント変更メッセージを durable consumer で購読し、デコードしてファンアウトへ渡す
 * なぜ: 処理結果に応じて ack / nak / TERM を選び、壊れたメッセージで購読を止めないため
 */
package io.eventboard.notification.nats;

import com.google.common.annotations.VisibleForTesting;
import io.eventboard.common.TraceIds;
import io.eventboard.notification.config.NotificationNatsProperties;
import io.eventboard.notification.model.DeadLetterReason;
import io.eventboard.notification.model.DeadLetterRecord;
import io.eventboard.notification.repository.NotificationDeadLetterRepository;
import io.eventboard.notification.service.DuplicateNotificationException;
import io.eventboard.notification.service.NotificationEventPermanentException;
import io.eventboard.notification.service.NotificationFanoutService;
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
import io.nats.client.impl.NatsJetStreamMetaData;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class EventChangeSubscriber {

    static final String MESSAGE_ID_HEADER = "Nats-Msg-Id";
    static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final Logger logger = LoggerFactory.getLogger(EventChangeSubscriber.class);
    private static final String MDC_MESSAGE_ID = "message_id";
    private static final String MDC_TRACE_ID = "trace_id";

    private final Connection connection;
    private final ChangeEnvelopeDecoder decoder;
    private final NotificationFanoutService fanoutService;
    private final NotificationDeadLetterRepository deadLetterRepository;
    private final NotificationMetrics metrics;
    private final BrokerConnectionMonitor monitor;
    private final NotificationNatsProperties properties;
    private final Clock clock;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public EventChangeSubscriber(Connection connection,
            ChangeEnvelopeDecoder decoder,
            NotificationFanoutService fanoutService,
            NotificationDeadLetterRepository deadLetterRepository,
            NotificationMetrics metrics,
            BrokerConnectionMonitor monitor,
            NotificationNatsProperties properties,
            Clock clock) {
        this.connection = connection;
        this.decoder = decoder;
        this.fanoutService = fanoutService;
        this.deadLetterRepository = deadLetterRepository;
        this.metrics = metrics;
        this.monitor = monitor;
        this.properties = properties;
        this.clock = clock;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            JetStream jetStream = connection.jetStream();
            // dispatcher 1 本で受信順に処理する
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            monitor.markConsuming();
            logger.info("event change subscriber started subject={} stream={} durable={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        // 購読を先に外し、処理中メッセージの ack/nak を終えてから dispatcher を閉じる
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
        started.set(false);
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        final String messageId = resolveMessageId(message);
        MDC.put(MDC_MESSAGE_ID, messageId);
        MDC.put(MDC_TRACE_ID, TraceIds.resolve(header(message, TRACE_ID_HEADER)));
        try {
            DecodeResult result = decoder.decode(message.getData(), messageId);
            if (!result.isSuccess()) {
                // 壊れた payload は再配信で回復しないため DLQ に残して TERM する
                logger.warn("event change decode failed subject={} error={}",
                        message.getSubject(), result.error());
                recordDecodeFailure(message, result.error());
                termSilently(message);
                metrics.recordConsumerOutcome("term");
                return;
            }
            fanoutService.handle(result.envelope());
            message.ack();
            metrics.recordConsumerOutcome("ack");
        } catch (DuplicateNotificationException ex) {
            // 前回の配信で保存済み。二重に作らず ack で再配信を止める
            logger.warn("event change already processed notificationId={}", ex.notificationId());
            ackSilently(message);
            metrics.recordConsumerOutcome("duplicate");
        } catch (NotificationEventPermanentException ex) {
            logger.warn("permanent failure while handling event change", ex);
            termSilently(message);
            metrics.recordConsumerOutcome("term");
        } catch (DataAccessException ex) {
            // DB など一時的失敗は再配信させる
            logger.warn("temporary failure while handling event change", ex);
            nakSilently(message);
            metrics.recordConsumerOutcome("nak");
        } catch (RuntimeException ex) {
            // 不明な例外はデータロス回避のため再配信に倒す
            logger.warn("failed to handle event change", ex);
            nakSilently(message);
            metrics.recordConsumerOutcome("nak");
        } finally {
            MDC.remove(MDC_MESSAGE_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    @VisibleForTesting
    static String resolveMessageId(Message message) {
        String fromHeader = header(message, MESSAGE_ID_HEADER);
        if (fromHeader != null) {
            return fromHeader;
        }
        if (message.isJetStream()) {
            NatsJetStreamMetaData metaData = message.metaData();
            return metaData.getStream() + ":" + metaData.streamSequence();
        }
        return UUID.randomUUID().toString();
    }

    private static String header(Message message, String name) {
        if (!message.hasHeaders() || message.getHeaders() == null) {
            return null;
        }
        String value = message.getHeaders().getFirst(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private void recordDecodeFailure(Message message, String error) {
        Long streamSeq = null;
        Integer deliveries = null;
        if (message.isJetStream()) {
            NatsJetStreamMetaData metaData = message.metaData();
            streamSeq = metaData.streamSequence();
            deliveries = (int) metaData.deliveredCount();
        }
        byte[] data = message.getData();
        DeadLetterRecord record = new DeadLetterRecord(
                streamSeq,
                DeadLetterReason.DECODE_FAILED,
                message.getSubject(),
                data == null ? "" : new String(data, StandardCharsets.UTF_8),
                error,
                deliveries,
                Instant.now(clock));
        try {
            if (deadLetterRepository.insert(record)) {
                metrics.recordDeadLetter(
                        DeadLetterReason.DECODE_FAILED.name().toLowerCase(Locale.ROOT));
            }
        } catch (DataAccessException ex) {
            // TERM advisory 側でも stream_seq は残るため、ここでは記録失敗を警告に留める
            logger.warn("failed to store decode failure dead letter streamSeq={}", streamSeq, ex);
        }
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.stream())
                .subjects(properties.subject())
                .duplicateWindow(properties.duplicateWindow())
                .build();
        JetStreamStreams.upsert(connection.jetStreamManagement(), streamConfiguration);
        logger.info("event stream ensured stream={} subject={} duplicateWindow={}",
                properties.stream(),
                properties.subject(),
                properties.duplicateWindow());
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                // ack-wait と max-deliver は再配信の猶予と上限を明示的に固定する
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack nats message", ex);
        }
    }

    private void nakSilently(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
