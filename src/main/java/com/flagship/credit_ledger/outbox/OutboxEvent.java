package com.flagship.credit_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox to be published to Kafka.
 *
 * Written in the same transaction as the ledger change it describes and
 * published later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Account" or "DepositClaim"
    UUID aggregateId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
