package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published for every executed transfer leg.
 *
 * {@code authorizedId} is the delegated spender that moved the tokens, and
 * null when the owner-of-record moved them itself.
 */
@Value
public class TokenTransferredEvent implements LedgerEvent {
    UUID eventId;
    String tokenId;
    String oldOwnerId;
    String newOwnerId;
    BigInteger amount;
    String authorizedId;
    String memo;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TokenTransferred";

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

    public static TokenTransferredEvent of(String tokenId, String oldOwnerId, String newOwnerId,
                                           BigInteger amount, String authorizedId, String memo) {
        return new TokenTransferredEvent(
            UUID.randomUUID(),
            tokenId,
            oldOwnerId,
            newOwnerId,
            amount,
            authorizedId,
            memo,
            Instant.now()
        );
    }
}
