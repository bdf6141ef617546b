package com.flagship.token_ledger.settlement;

import com.flagship.token_ledger.approval.Approval;
import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.call.CallPrechecks;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.event.SupplyForfeitedEvent;
import com.flagship.token_ledger.event.TransferCallSettledEvent;
import com.flagship.token_ledger.event.TransferCallStartedEvent;
import com.flagship.token_ledger.event.TransferRefundedEvent;
import com.flagship.token_ledger.ledger.BalanceLedger;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.outbox.OutboxService;
import com.flagship.token_ledger.transfer.TransferEngine;
import com.flagship.token_ledger.transfer.TransferOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Transfer-and-notify: move tokens first, let the receiver react, then
 * refund whatever the receiver reports as unused.
 *
 * The protocol spans three transactions:
 * 1. {@link #transferCall} transfers optimistically and records a STARTED pending transfer
 * 2. {@link #recordNotification} stores the receiver's answer (NOTIFIED)
 * 3. {@link #resolveTransfer(CallContext, UUID)} refunds and closes it (RESOLVED or ABORTED)
 *
 * Between the steps the optimistic state is visible to everybody. Refunds
 * are capped by the receiver's balance at resolution time; anything the
 * receiver already spent stays spent.
 */
@Service
@Slf4j
public class AsyncTransferProtocol {

    private final TransferEngine transferEngine;
    private final BalanceLedger balanceLedger;
    private final CallPrechecks callPrechecks;
    private final PendingTransferPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final String ledgerAccountId;

    public AsyncTransferProtocol(TransferEngine transferEngine,
                                 BalanceLedger balanceLedger,
                                 CallPrechecks callPrechecks,
                                 PendingTransferPersistenceService persistenceService,
                                 OutboxService outboxService,
                                 LedgerMetrics ledgerMetrics,
                                 @Value("${ledger.account-id}") String ledgerAccountId) {
        this.transferEngine = transferEngine;
        this.balanceLedger = balanceLedger;
        this.callPrechecks = callPrechecks;
        this.persistenceService = persistenceService;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.ledgerAccountId = ledgerAccountId;
    }

    /**
     * Transfers one token to {@code receiverId} and schedules the receiver's notification.
     *
     * @throws LedgerException PRECHECK_FAILED before any mutation if the payment
     *         floor or the compute budget is not met, or any transfer failure
     */
    @Transactional
    public PendingTransfer transferCall(CallContext context, String receiverId, String tokenId, BigInteger amount,
                                        Long approvalId, String memo, String message) {
        return batchTransferCall(context, receiverId, List.of(tokenId), List.of(amount),
            Collections.singletonList(approvalId), memo, message, "call");
    }

    /**
     * Batch form of {@link #transferCall}; all legs move or none.
     */
    @Transactional
    public PendingTransfer batchTransferCall(CallContext context, String receiverId, List<String> tokenIds,
                                             List<BigInteger> amounts, List<Long> approvalIds,
                                             String memo, String message) {
        return batchTransferCall(context, receiverId, tokenIds, amounts, approvalIds, memo, message, "batch_call");
    }

    private PendingTransfer batchTransferCall(CallContext context, String receiverId, List<String> tokenIds,
                                              List<BigInteger> amounts, List<Long> approvalIds,
                                              String memo, String message, String kind) {
        long startTime = System.currentTimeMillis();
        try {
            callPrechecks.requirePaymentFloor(context);
            callPrechecks.requireTransferCallBudget(context);
            if (message == null) {
                throw LedgerException.invalidArgument("A message for the receiver is required");
            }

            List<TransferOutcome> outcomes =
                transferEngine.transferBatch(context.getCallerId(), receiverId, tokenIds, amounts, approvalIds, memo);

            List<TransferLeg> legs = new ArrayList<>(outcomes.size());
            for (int i = 0; i < outcomes.size(); i++) {
                TransferOutcome outcome = outcomes.get(i);
                legs.add(TransferLeg.sent(
                    outcome.getTokenId(), outcome.getEffectiveOwnerId(), amounts.get(i), outcome.getRemovedApprovals()));
            }

            PendingTransfer pending = persistenceService.save(
                PendingTransfer.start(context.getCallerId(), receiverId, legs, memo, message));

            outboxService.saveEvent(TransferCallStartedEvent.of(
                pending.getId(), pending.getSenderId(), receiverId, pending.tokenIds(), pending.amounts(), message));

            ledgerMetrics.recordTransfer(kind, "success");
            log.info("Started transfer call {}: sender={}, receiver={}, tokens={}",
                pending.getId(), pending.getSenderId(), receiverId, pending.tokenIds());
            return pending;
        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer(kind, e.getErrorCode().name());
            log.warn("Transfer call to {} rejected: {}", receiverId, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency("transfer_" + kind, System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Stores the receiver's answer on a STARTED pending transfer.
     */
    @Transactional
    public PendingTransfer recordNotification(UUID pendingTransferId, NotificationOutcome outcome) {
        PendingTransfer pending = lockPending(pendingTransferId);
        PendingTransfer notified = persistenceService.update(pending.notified(outcome));
        log.info("Recorded notification outcome {} for transfer call {}", outcome.getKind(), pendingTransferId);
        return notified;
    }

    /**
     * Resolves a NOTIFIED pending transfer from its persisted state.
     *
     * @throws LedgerException UNAUTHORIZED unless called as the ledger itself,
     *         PRECHECK_FAILED if the transfer is not NOTIFIED
     */
    @Transactional
    public PendingTransfer resolveTransfer(CallContext context, UUID pendingTransferId) {
        requireLedgerCaller(context);
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.Scope ignored =
                 CorrelationContext.withMdc(CorrelationContext.PENDING_TRANSFER_ID_MDC_KEY, pendingTransferId.toString())) {
            PendingTransfer pending = lockPending(pendingTransferId);
            if (pending.getStatus() != PendingTransferStatus.NOTIFIED) {
                throw LedgerException.precheckFailed(String.format(
                    "Transfer call %s is %s, only NOTIFIED transfers can be resolved", pendingTransferId, pending.getStatus()));
            }

            List<TokenSettlement> settlements = resolveTransfer(
                context,
                pendingTransferId,
                pending.previousOwnerIds(),
                pending.getReceiverId(),
                pending.tokenIds(),
                pending.amounts(),
                pending.getLegs().stream().map(TransferLeg::getPriorApprovals).toList(),
                pending.notificationOutcome()
            );

            PendingTransfer resolved = persistenceService.update(pending.resolved(settlements));

            outboxService.saveEvent(TransferCallSettledEvent.of(
                resolved.getId(),
                resolved.getSenderId(),
                resolved.getReceiverId(),
                resolved.getStatus().name(),
                resolved.getOutcome().name(),
                resolved.tokenIds(),
                settlements.stream().map(TokenSettlement::getKept).toList(),
                settlements.stream().map(TokenSettlement::getRefunded).toList(),
                settlements.stream().map(TokenSettlement::getForfeited).toList()
            ));

            ledgerMetrics.recordSettlement(resolved.getOutcome().name(), resolved.getStatus().name());
            log.info("Transfer call resolved: status={}, outcome={}", resolved.getStatus(), resolved.getOutcome());
            return resolved;
        } finally {
            ledgerMetrics.recordLatency("resolve", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Refunds unused amounts from the receiver to the previous owners.
     *
     * Per token, the refund is the smaller of the unused amount and the
     * receiver's current balance. If the previous owner no longer has a
     * balance entry, the refund is taken from the receiver and removed from
     * the supply instead. Prior approvals are not restored.
     *
     * @param pendingTransferId used to tag the emitted events, may be null
     * @return one settlement per token, index-aligned with {@code tokenIds}
     */
    @Transactional
    public List<TokenSettlement> resolveTransfer(CallContext context, UUID pendingTransferId,
                                                 List<String> previousOwnerIds, String receiverId,
                                                 List<String> tokenIds, List<BigInteger> amounts,
                                                 List<Map<String, Approval>> priorApprovals,
                                                 NotificationOutcome outcome) {
        requireLedgerCaller(context);
        int size = tokenIds.size();
        if (previousOwnerIds.size() != size || amounts.size() != size || outcome.getUnusedAmounts().size() != size) {
            throw LedgerException.invalidArgument("Resolution lists must have one entry per token");
        }
        if (priorApprovals != null
            && priorApprovals.stream().filter(Objects::nonNull).anyMatch(approvals -> !approvals.isEmpty())) {
            log.debug("Prior approvals of transfer call {} are not restored", pendingTransferId);
        }

        List<TokenSettlement> settlements = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            settlements.add(resolveLeg(pendingTransferId, previousOwnerIds.get(i), receiverId,
                tokenIds.get(i), amounts.get(i), outcome.getUnusedAmounts().get(i)));
        }
        return settlements;
    }

    private TokenSettlement resolveLeg(UUID pendingTransferId, String previousOwnerId, String receiverId,
                                       String tokenId, BigInteger amount, BigInteger reportedUnused) {
        BigInteger unused = reportedUnused.min(amount);
        if (unused.signum() == 0) {
            return TokenSettlement.kept(tokenId, amount, BigInteger.ZERO);
        }

        BigInteger receiverBalance = balanceLedger.isRegistered(tokenId, receiverId)
            ? balanceLedger.balanceOf(tokenId, receiverId)
            : BigInteger.ZERO;
        BigInteger refund = unused.min(receiverBalance);
        BigInteger shortfall = unused.subtract(refund);
        if (refund.signum() == 0) {
            log.info("Receiver {} holds none of token {}, {} unused stays unrefunded", receiverId, tokenId, unused);
            return TokenSettlement.kept(tokenId, amount, unused);
        }

        balanceLedger.withdraw(tokenId, receiverId, refund);

        if (balanceLedger.isRegistered(tokenId, previousOwnerId)) {
            balanceLedger.deposit(tokenId, previousOwnerId, refund);
            outboxService.saveEvent(
                TransferRefundedEvent.of(pendingTransferId, tokenId, receiverId, previousOwnerId, refund));
            ledgerMetrics.incrementRefundedLegs();
            log.debug("Refunded {} of token {} from {} to {}", refund, tokenId, receiverId, previousOwnerId);
            return new TokenSettlement(tokenId, amount, unused, refund, BigInteger.ZERO, shortfall);
        }

        outboxService.saveEvent(
            SupplyForfeitedEvent.of(pendingTransferId, tokenId, receiverId, previousOwnerId, refund));
        ledgerMetrics.incrementForfeitedLegs();
        log.warn("Previous owner {} of token {} is gone, {} forfeited from supply", previousOwnerId, tokenId, refund);
        return new TokenSettlement(tokenId, amount, unused, BigInteger.ZERO, refund, shortfall);
    }

    /**
     * Loads the pending transfer with its row locked until commit, so
     * concurrent resolutions of the same transfer run one after the other
     * and the second one sees the first one's status.
     */
    private PendingTransfer lockPending(UUID pendingTransferId) {
        return persistenceService.findByIdForUpdate(pendingTransferId)
            .orElseThrow(() -> LedgerException.invalidArgument("Unknown transfer call " + pendingTransferId));
    }

    private void requireLedgerCaller(CallContext context) {
        if (!context.isCaller(ledgerAccountId)) {
            throw LedgerException.unauthorized("only the ledger may resolve transfer calls, caller was "
                + context.getCallerId());
        }
    }

    public String getLedgerAccountId() {
        return ledgerAccountId;
    }
}
