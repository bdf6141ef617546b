package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a new token class is minted.
 */
@Value
public class TokenMintedEvent implements LedgerEvent {
    UUID eventId;
    String tokenId;
    String ownerId;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TokenMinted";

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

    public static TokenMintedEvent of(String tokenId, String ownerId, BigInteger amount) {
        return new TokenMintedEvent(UUID.randomUUID(), tokenId, ownerId, amount, Instant.now());
    }
}
