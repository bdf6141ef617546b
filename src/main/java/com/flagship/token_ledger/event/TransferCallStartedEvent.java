package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event published when a transfer-and-notify call has moved the tokens
 * optimistically and the receiver is about to be notified.
 */
@Value
public class TransferCallStartedEvent implements LedgerEvent {
    UUID eventId;
    UUID pendingTransferId;
    String senderId;
    String receiverId;
    List<String> tokenIds;
    List<BigInteger> amounts;
    String message;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCallStarted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateId() {
        return pendingTransferId.toString();
    }

    @Override
    public String getAggregateType() {
        return AggregateTypes.PENDING_TRANSFER;
    }

    public static TransferCallStartedEvent of(UUID pendingTransferId, String senderId, String receiverId,
                                              List<String> tokenIds, List<BigInteger> amounts, String message) {
        return new TransferCallStartedEvent(
            UUID.randomUUID(),
            pendingTransferId,
            senderId,
            receiverId,
            List.copyOf(tokenIds),
            List.copyOf(amounts),
            message,
            Instant.now()
        );
    }
}
