package com.flagship.token_ledger.approval;

import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.support.LedgerFixture;
import com.flagship.token_ledger.token.LedgerFeatures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.flagship.token_ledger.support.LedgerFixture.as;
import static org.junit.jupiter.api.Assertions.*;

class ApprovalServiceTest {

    private LedgerFixture fixture;
    private ApprovalService approvals;
    private String tokenId;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        approvals = fixture.approvalService;
        tokenId = fixture.mint("alice", 1000);
    }

    @Test
    @DisplayName("Approval ids start at 1 and increase with every grant")
    void approvalIdsIncrease() {
        Approval first = approvals.approve(as("alice"), tokenId, "bob", BigInteger.TEN);
        Approval second = approvals.approve(as("alice"), tokenId, "carol", BigInteger.TEN);
        Approval again = approvals.approve(as("alice"), tokenId, "bob", BigInteger.ONE);

        assertEquals(1L, first.getApprovalId());
        assertEquals(2L, second.getApprovalId());
        assertEquals(3L, again.getApprovalId());
        assertEquals("3", fixture.tokenRegistry.token(tokenId).orElseThrow().getNextApprovalId());
        assertEquals(again, fixture.store.find(tokenId, "bob").orElseThrow());
    }

    @Test
    @DisplayName("The approval counter is read under the token row lock")
    void approveLocksTokenRow() {
        fixture.store.lockedRows.clear();

        approvals.approve(as("alice"), tokenId, "bob", BigInteger.TEN);

        assertEquals("token:" + tokenId, fixture.store.lockedRows.get(0));
    }

    @Test
    @DisplayName("Only the owner-of-record may approve")
    void onlyOwnerApproves() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> approvals.approve(as("bob"), tokenId, "carol", BigInteger.TEN));

        assertEquals(LedgerErrorCode.UNAUTHORIZED, exception.getErrorCode());
    }

    @Test
    @DisplayName("The owner cannot approve itself")
    void selfApprovalRejected() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> approvals.approve(as("alice"), tokenId, "alice", BigInteger.TEN));

        assertEquals(LedgerErrorCode.INVALID_ARGUMENT, exception.getErrorCode());
    }

    @Test
    @DisplayName("Approving requires the payment floor")
    void approveRequiresPayment() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> approvals.approve(CallContext.of("alice", BigInteger.ZERO), tokenId, "bob", BigInteger.TEN));

        assertEquals(LedgerErrorCode.PRECHECK_FAILED, exception.getErrorCode());
    }

    @Test
    @DisplayName("isApproved honours the ceiling and a pinned approval id")
    void isApproved() {
        Approval approval = approvals.approve(as("alice"), tokenId, "bob", BigInteger.TEN);

        assertTrue(approvals.isApproved(tokenId, "bob", BigInteger.TEN, null));
        assertTrue(approvals.isApproved(tokenId, "bob", BigInteger.ONE, approval.getApprovalId()));
        assertFalse(approvals.isApproved(tokenId, "bob", BigInteger.valueOf(11), null));
        assertFalse(approvals.isApproved(tokenId, "bob", BigInteger.ONE, approval.getApprovalId() + 1));
        assertFalse(approvals.isApproved(tokenId, "carol", BigInteger.ONE, null));
    }

    @Test
    @DisplayName("Revoke removes one spender, revokeAll removes every spender")
    void revoke() {
        approvals.approve(as("alice"), tokenId, "bob", BigInteger.TEN);
        approvals.approve(as("alice"), tokenId, "carol", BigInteger.TEN);
        approvals.approve(as("alice"), tokenId, "dave", BigInteger.TEN);

        assertTrue(approvals.revoke(as("alice"), tokenId, "bob"));
        assertFalse(approvals.revoke(as("alice"), tokenId, "bob"));
        assertEquals(2, approvals.revokeAll(as("alice"), tokenId));
        assertTrue(fixture.store.findAll(tokenId).isEmpty());
    }

    @Test
    @DisplayName("Approvals are unavailable when the extension is disabled")
    void disabledExtension() {
        LedgerFixture plain = new LedgerFixture(new LedgerFeatures(true, false));
        String plainToken = plain.mint("alice", 5);

        LedgerException exception = assertThrows(LedgerException.class,
            () -> plain.approvalService.approve(as("alice"), plainToken, "bob", BigInteger.ONE));

        assertEquals(LedgerErrorCode.INVALID_ARGUMENT, exception.getErrorCode());
    }

    @Test
    @DisplayName("Approving an unknown token fails")
    void unknownToken() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> approvals.approve(as("alice"), "404", "bob", BigInteger.ONE));

        assertEquals(LedgerErrorCode.NOT_FOUND, exception.getErrorCode());
    }
}
