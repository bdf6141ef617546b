package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when the part of an attached payment that exceeds the
 * storage cost of a call is owed back to the payer.
 *
 * The host pays the refund out; the ledger only records it.
 */
@Value
public class StorageRefundIssuedEvent implements LedgerEvent {
    UUID eventId;
    String tokenId;
    String recipientId;
    long storageBytes;
    BigInteger storageCost;
    BigInteger refund;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StorageRefundIssued";

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

    public static StorageRefundIssuedEvent of(String tokenId, String recipientId, long storageBytes,
                                              BigInteger storageCost, BigInteger refund) {
        return new StorageRefundIssuedEvent(
            UUID.randomUUID(), tokenId, recipientId, storageBytes, storageCost, refund, Instant.now());
    }
}
