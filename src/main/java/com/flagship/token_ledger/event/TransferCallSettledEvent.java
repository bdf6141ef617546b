package com.flagship.token_ledger.event;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event published when a transfer-and-notify call has been resolved.
 *
 * Lists are index-aligned with {@code tokenIds}.
 */
@Value
public class TransferCallSettledEvent implements LedgerEvent {
    UUID eventId;
    UUID pendingTransferId;
    String senderId;
    String receiverId;
    String status;
    String outcome;
    List<String> tokenIds;
    List<BigInteger> keptAmounts;
    List<BigInteger> refundedAmounts;
    List<BigInteger> forfeitedAmounts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCallSettled";

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

    public static TransferCallSettledEvent of(UUID pendingTransferId, String senderId, String receiverId,
                                              String status, String outcome, List<String> tokenIds,
                                              List<BigInteger> keptAmounts, List<BigInteger> refundedAmounts,
                                              List<BigInteger> forfeitedAmounts) {
        return new TransferCallSettledEvent(
            UUID.randomUUID(),
            pendingTransferId,
            senderId,
            receiverId,
            status,
            outcome,
            List.copyOf(tokenIds),
            List.copyOf(keptAmounts),
            List.copyOf(refundedAmounts),
            List.copyOf(forfeitedAmounts),
            Instant.now()
        );
    }
}
