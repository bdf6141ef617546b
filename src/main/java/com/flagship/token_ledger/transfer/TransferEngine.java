package com.flagship.token_ledger.transfer;

import com.flagship.token_ledger.approval.Approval;
import com.flagship.token_ledger.approval.ApprovalStore;
import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.call.CallPrechecks;
import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.event.TokenTransferredEvent;
import com.flagship.token_ledger.ledger.Amounts;
import com.flagship.token_ledger.ledger.BalanceLedger;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.outbox.OutboxService;
import com.flagship.token_ledger.token.TokenRecord;
import com.flagship.token_ledger.token.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates and executes single and batch transfers.
 *
 * Every leg clears all approvals of its token before anything else is
 * checked, so even a transfer by the owner-of-record revokes every spender.
 * A sender that is not the owner-of-record moves tokens out of its own
 * balance and must hold an approval covering the amount.
 *
 * A batch runs in one transaction: if any leg fails, no leg is applied.
 * Each leg holds the token row lock until commit, which serializes
 * concurrent transfers, approvals and refunds of the same token.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferEngine {

    private final TokenRegistry tokenRegistry;
    private final BalanceLedger balanceLedger;
    private final ApprovalStore approvalStore;
    private final CallPrechecks callPrechecks;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Transfers {@code amount} of one token from the caller to {@code receiverId}.
     *
     * @param approvalId expected approval id when the caller is a delegated spender, may be null
     */
    @Transactional
    public TransferOutcome transfer(CallContext context, String receiverId, String tokenId,
                                    BigInteger amount, Long approvalId, String memo) {
        long startTime = System.currentTimeMillis();
        try {
            callPrechecks.requirePaymentFloor(context);
            TransferOutcome outcome = transferOne(context.getCallerId(), receiverId, tokenId, amount, approvalId, memo);
            ledgerMetrics.recordTransfer("single", "success");
            return outcome;
        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer("single", e.getErrorCode().name());
            log.warn("Transfer of token {} to {} rejected: {}", tokenId, receiverId, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Transfers several tokens from the caller to {@code receiverId}, all or nothing.
     *
     * @param approvalIds null, or one entry per token (entries may be null)
     */
    @Transactional
    public List<TransferOutcome> batchTransfer(CallContext context, String receiverId, List<String> tokenIds,
                                               List<BigInteger> amounts, List<Long> approvalIds, String memo) {
        long startTime = System.currentTimeMillis();
        try {
            callPrechecks.requirePaymentFloor(context);
            List<TransferOutcome> outcomes =
                transferBatch(context.getCallerId(), receiverId, tokenIds, amounts, approvalIds, memo);
            ledgerMetrics.recordTransfer("batch", "success");
            return outcomes;
        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer("batch", e.getErrorCode().name());
            log.warn("Batch transfer to {} rejected: {}", receiverId, e.getMessage());
            throw e;
        } finally {
            ledgerMetrics.recordLatency("batch_transfer", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Executes one transfer leg. No payment floor is checked here.
     *
     * @throws LedgerException INVALID_ARGUMENT, NOT_FOUND, UNAUTHORIZED, APPROVAL_MISMATCH,
     *         NOT_REGISTERED, INSUFFICIENT_BALANCE or OVERFLOW
     */
    @Transactional
    public TransferOutcome transferOne(String senderId, String receiverId, String tokenId,
                                       BigInteger amount, Long approvalId, String memo) {
        if (senderId == null || senderId.isBlank() || receiverId == null || receiverId.isBlank()) {
            throw LedgerException.invalidArgument("Sender and receiver are required");
        }
        if (senderId.equals(receiverId)) {
            throw LedgerException.invalidArgument("Sender and receiver must differ");
        }
        Amounts.requirePositive(amount, "Transfer amount");

        TokenRecord token = tokenRegistry.lockRecord(tokenId);
        Map<String, Approval> removedApprovals = approvalStore.removeAll(tokenId);

        String authorizedId = null;
        if (!senderId.equals(token.getOwnerId())) {
            Approval approval = removedApprovals.get(senderId);
            if (approval == null) {
                throw LedgerException.unauthorized(senderId + " is not approved for token " + tokenId);
            }
            if (approvalId != null && approval.getApprovalId() != approvalId) {
                throw new LedgerException(LedgerErrorCode.APPROVAL_MISMATCH, senderId, tokenId,
                    Long.toUnsignedString(approval.getApprovalId()), Long.toUnsignedString(approvalId));
            }
            if (amount.compareTo(approval.getCeiling()) > 0) {
                throw LedgerException.unauthorized(String.format(
                    "%s is approved for at most %s of token %s, requested %s",
                    senderId, approval.getCeiling(), tokenId, amount));
            }
            authorizedId = senderId;
        }

        balanceLedger.withdraw(tokenId, senderId, amount);
        balanceLedger.deposit(tokenId, receiverId, amount);

        outboxService.saveEvent(TokenTransferredEvent.of(tokenId, senderId, receiverId, amount, authorizedId, memo));
        ledgerMetrics.incrementTransferLegs();

        log.debug("Transferred {} of token {} from {} to {} (cleared {} approvals)",
            amount, tokenId, senderId, receiverId, removedApprovals.size());

        return new TransferOutcome(tokenId, senderId, removedApprovals);
    }

    /**
     * Executes one leg per index. No payment floor is checked here.
     */
    @Transactional
    public List<TransferOutcome> transferBatch(String senderId, String receiverId, List<String> tokenIds,
                                               List<BigInteger> amounts, List<Long> approvalIds, String memo) {
        if (tokenIds == null || amounts == null || tokenIds.isEmpty()) {
            throw LedgerException.invalidArgument("At least one token is required");
        }
        if (tokenIds.size() != amounts.size()) {
            throw LedgerException.invalidArgument(String.format(
                "Got %d token ids but %d amounts", tokenIds.size(), amounts.size()));
        }
        if (approvalIds != null && approvalIds.size() != tokenIds.size()) {
            throw LedgerException.invalidArgument(String.format(
                "Got %d token ids but %d approval ids", tokenIds.size(), approvalIds.size()));
        }

        // Token rows are always locked in id order
        tokenIds.stream().distinct().sorted().forEach(tokenRegistry::lockRecord);

        List<TransferOutcome> outcomes = new ArrayList<>(tokenIds.size());
        for (int i = 0; i < tokenIds.size(); i++) {
            Long approvalId = approvalIds == null ? null : approvalIds.get(i);
            outcomes.add(transferOne(senderId, receiverId, tokenIds.get(i), amounts.get(i), approvalId, memo));
        }
        return outcomes;
    }
}
