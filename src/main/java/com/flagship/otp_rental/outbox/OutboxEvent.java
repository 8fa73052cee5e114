package com.flagship.otp_rental.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A rental event waiting in, or already published from, {@code outbox_events}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                                      String payload, Instant createdAt) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
                createdAt, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
