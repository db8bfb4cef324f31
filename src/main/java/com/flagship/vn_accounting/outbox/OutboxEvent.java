package com.flagship.vn_accounting.outbox;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event waiting in the outbox to be published.
 *
 * Written in the same transaction as the voucher or entry it describes, and
 * published to Kafka later by {@link OutboxPublisher}.
 */
@Value
@Builder(toBuilder = true)
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    /** JSON. */
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    /** Assigned by the database. */
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(aggregateType)
                .aggregateId(aggregateId)
                .eventType(eventType)
                .payload(payload)
                .createdAt(Instant.now())
                .build();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return retryCount >= maxRetries;
    }
}
