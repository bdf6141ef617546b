package com.flagship.token_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in, or already published from, the outbox.
 *
 * Rows are written in the transaction that changed the ledger, so an event
 * exists if and only if its state change committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Token" or "PendingTransfer"
    String aggregateId;        // token id or pending transfer id, used as the Kafka key
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
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
            null,
            null   // assigned by the database
        );
    }
}
