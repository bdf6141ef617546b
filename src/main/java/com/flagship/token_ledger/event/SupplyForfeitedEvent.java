package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a refund could not be returned because the previous
 * owner no longer has a balance entry, so the amount left the supply.
 */
@Value
public class SupplyForfeitedEvent implements LedgerEvent {
    UUID eventId;
    UUID pendingTransferId;
    String tokenId;
    String receiverId;
    String previousOwnerId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SupplyForfeited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return tokenId;
    }

    @Override
    public String getAggregateType() {
        return AggregateTypes.TOKEN;
    }

    public static SupplyForfeitedEvent of(UUID pendingTransferId, String tokenId, String receiverId,
                                          String previousOwnerId, BigInteger amount) {
        return new SupplyForfeitedEvent(
            UUID.randomUUID(), pendingTransferId, tokenId, receiverId, previousOwnerId, amount, Instant.now());
    }
}
