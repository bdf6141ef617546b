package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when resolution returns unused tokens from the receiver to the previous owner.
 */
@Value
public class TransferRefundedEvent implements LedgerEvent {
    UUID eventId;
    UUID pendingTransferId;
    String tokenId;
    String receiverId;
    String previousOwnerId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferRefunded";

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

    public static TransferRefundedEvent of(UUID pendingTransferId, String tokenId, String receiverId,
                                           String previousOwnerId, BigInteger amount) {
        return new TransferRefundedEvent(
            UUID.randomUUID(), pendingTransferId, tokenId, receiverId, previousOwnerId, amount, Instant.now());
    }
}
