package com.flagship.token_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Row of {@code pending_transfer_approvals}: an approval cleared by one leg of the transfer.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class PriorApprovalEmbeddable {

    @Column(name = "leg_index", nullable = false)
    private int legIndex;

    @Column(name = "spender_id", nullable = false)
    private String spenderId;

    @Column(name = "approval_id", nullable = false)
    private long approvalId;

    @Column(name = "ceiling", nullable = false, precision = 39, scale = 0)
    private BigInteger ceiling;
}
