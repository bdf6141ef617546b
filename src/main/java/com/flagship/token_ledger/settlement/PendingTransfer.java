package com.flagship.token_ledger.settlement;

import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Durable record of a transfer-and-notify call, from the optimistic
 * transfer until its resolution.
 *
 * Transitions return new instances and reject any move the lifecycle
 * does not allow.
 */
@Value
public class PendingTransfer {
    UUID id;
    String senderId;
    String receiverId;
    List<TransferLeg> legs;
    String memo;
    String message;
    PendingTransferStatus status;
    NotificationOutcome.Kind outcome;
    String outcomeDetail;
    Instant createdAt;
    Instant updatedAt;

    public static PendingTransfer start(String senderId, String receiverId, List<TransferLeg> legs,
                                        String memo, String message) {
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("A pending transfer needs at least one leg");
        }
        Instant now = Instant.now();
        return new PendingTransfer(
            UUID.randomUUID(),
            senderId,
            receiverId,
            List.copyOf(legs),
            memo,
            message,
            PendingTransferStatus.STARTED,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Records the receiver's answer. Only valid from STARTED.
     */
    public PendingTransfer notified(NotificationOutcome notification) {
        if (status != PendingTransferStatus.STARTED) {
            throw new IllegalStateException(String.format(
                "Cannot record a notification for pending transfer %s in %s status", id, status));
        }
        List<BigInteger> unused = notification.getUnusedAmounts();
        if (unused.size() != legs.size()) {
            throw new IllegalArgumentException(
                "Notification covers " + unused.size() + " tokens, transfer has " + legs.size());
        }
        List<TransferLeg> updated = new ArrayList<>(legs.size());
        for (int i = 0; i < legs.size(); i++) {
            updated.add(legs.get(i).withUnused(unused.get(i)));
        }
        return new PendingTransfer(id, senderId, receiverId, List.copyOf(updated), memo, message,
            PendingTransferStatus.NOTIFIED, notification.getKind(), notification.getDetail(),
            createdAt, Instant.now());
    }

    /**
     * Records the settlements. Only valid from NOTIFIED; ends in ABORTED when
     * the notification failed and in RESOLVED otherwise.
     */
    public PendingTransfer resolved(List<TokenSettlement> settlements) {
        if (status != PendingTransferStatus.NOTIFIED) {
            throw new IllegalStateException(String.format(
                "Cannot resolve pending transfer %s in %s status. Only NOTIFIED transfers can be resolved.",
                id, status));
        }
        if (settlements.size() != legs.size()) {
            throw new IllegalArgumentException(
                "Got " + settlements.size() + " settlements for " + legs.size() + " legs");
        }
        List<TransferLeg> updated = new ArrayList<>(legs.size());
        for (int i = 0; i < legs.size(); i++) {
            updated.add(legs.get(i).withSettlement(settlements.get(i)));
        }
        PendingTransferStatus next = outcome == NotificationOutcome.Kind.FAILED
            ? PendingTransferStatus.ABORTED
            : PendingTransferStatus.RESOLVED;
        return new PendingTransfer(id, senderId, receiverId, List.copyOf(updated), memo, message,
            next, outcome, outcomeDetail, createdAt, Instant.now());
    }

    /**
     * Rebuilds the recorded notification outcome. Only meaningful once NOTIFIED.
     */
    public NotificationOutcome notificationOutcome() {
        if (outcome == null) {
            throw new IllegalStateException("Pending transfer " + id + " has not been notified");
        }
        return new NotificationOutcome(outcome, legs.stream().map(TransferLeg::getUnusedAmount).toList(), outcomeDetail);
    }

    public boolean isTerminal() {
        return status == PendingTransferStatus.RESOLVED || status == PendingTransferStatus.ABORTED;
    }

    public List<String> tokenIds() {
        return legs.stream().map(TransferLeg::getTokenId).toList();
    }

    public List<BigInteger> amounts() {
        return legs.stream().map(TransferLeg::getAmount).toList();
    }

    public List<String> previousOwnerIds() {
        return legs.stream().map(TransferLeg::getPreviousOwnerId).toList();
    }
}
