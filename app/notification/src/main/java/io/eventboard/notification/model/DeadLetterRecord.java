package io.eventboard.notification.model;

import java.time.Instant;

/**
 * A broker message that will not be processed again. {@code streamSeq} is null outside JetStream.
 */
public record DeadLetterRecord(
    Long streamSeq,
    DeadLetterReason reason,
    String subject,
    String payload,
    String error,
    Integer deliveries,
    Instant createdAt) {}
