package com.flagship.token_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * Events are facts: they are written to the outbox in the same transaction
 * as the state change they describe and never updated afterwards.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance, for consumer deduplication.
     */
    UUID getEventId();

    /**
     * Aggregate the event is keyed by: a token id, or a pending transfer id
     * for settlement events.
     */
    String getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
