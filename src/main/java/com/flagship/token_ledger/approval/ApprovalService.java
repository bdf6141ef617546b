package com.flagship.token_ledger.approval;

import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.call.CallPrechecks;
import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.ledger.Amounts;
import com.flagship.token_ledger.token.TokenRecord;
import com.flagship.token_ledger.token.TokenRegistry;
import com.flagship.token_ledger.token.TokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Grants and revokes delegated transfer rights.
 *
 * Only the owner-of-record of a token manages its approvals. Approval ids come
 * from a per-token counter, so re-approving a spender always yields a new id.
 * The counter is read under the token row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApprovalService {

    private static final long LAST_APPROVAL_ID = -1L; // 2^64 - 1 as unsigned

    private final TokenRegistry tokenRegistry;
    private final TokenStore tokenStore;
    private final ApprovalStore approvalStore;
    private final CallPrechecks callPrechecks;

    /**
     * Approves {@code spenderId} to transfer up to {@code ceiling} of the token,
     * replacing any earlier approval of the same spender.
     *
     * @return the new approval
     */
    @Transactional
    public Approval approve(CallContext context, String tokenId, String spenderId, BigInteger ceiling) {
        callPrechecks.requirePaymentFloor(context);
        requireApprovalsEnabled();
        TokenRecord token = requireOwnedByCaller(context, tokenId);
        if (spenderId == null || spenderId.isBlank()) {
            throw LedgerException.invalidArgument("Spender id is required");
        }
        if (spenderId.equals(token.getOwnerId())) {
            throw LedgerException.invalidArgument("The owner cannot approve itself");
        }
        Amounts.requireValid(ceiling, "Approval ceiling");

        long current = token.getNextApprovalId();
        if (current == LAST_APPROVAL_ID) {
            throw new LedgerException(LedgerErrorCode.ID_SPACE_EXHAUSTED, "approval ids of token " + tokenId);
        }
        long approvalId = current + 1;
        tokenStore.updateNextApprovalId(tokenId, approvalId);

        Approval approval = new Approval(approvalId, ceiling);
        approvalStore.save(tokenId, spenderId, approval);
        log.info("Approved spender {} on token {}: approvalId={}, ceiling={}",
            spenderId, tokenId, Long.toUnsignedString(approvalId), ceiling);
        return approval;
    }

    /**
     * @return true if an approval was removed
     */
    @Transactional
    public boolean revoke(CallContext context, String tokenId, String spenderId) {
        callPrechecks.requirePaymentFloor(context);
        requireApprovalsEnabled();
        requireOwnedByCaller(context, tokenId);
        boolean removed = approvalStore.delete(tokenId, spenderId);
        log.info("Revoked spender {} on token {}: removed={}", spenderId, tokenId, removed);
        return removed;
    }

    @Transactional
    public int revokeAll(CallContext context, String tokenId) {
        callPrechecks.requirePaymentFloor(context);
        requireApprovalsEnabled();
        requireOwnedByCaller(context, tokenId);
        int removed = approvalStore.removeAll(tokenId).size();
        log.info("Revoked all {} approvals on token {}", removed, tokenId);
        return removed;
    }

    /**
     * Checks whether a spender may move {@code amount}, optionally pinning the approval id.
     */
    @Transactional(readOnly = true)
    public boolean isApproved(String tokenId, String spenderId, BigInteger amount, Long approvalId) {
        tokenRegistry.requireRecord(tokenId);
        Optional<Approval> approval = approvalStore.find(tokenId, spenderId);
        if (approval.isEmpty()) {
            return false;
        }
        if (approvalId != null && approval.get().getApprovalId() != approvalId) {
            return false;
        }
        return amount.compareTo(approval.get().getCeiling()) <= 0;
    }

    private TokenRecord requireOwnedByCaller(CallContext context, String tokenId) {
        TokenRecord token = tokenRegistry.lockRecord(tokenId);
        if (!context.isCaller(token.getOwnerId())) {
            throw LedgerException.unauthorized(
                "only the owner of token " + tokenId + " may manage its approvals");
        }
        return token;
    }

    private void requireApprovalsEnabled() {
        if (!tokenRegistry.getFeatures().isApprovalsEnabled()) {
            throw LedgerException.invalidArgument("The approval extension is disabled");
        }
    }
}
