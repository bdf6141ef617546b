package com.flagship.token_ledger.settlement;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Row of {@code pending_transfer_legs}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class TransferLegEmbeddable {

    @Column(name = "token_id", nullable = false, length = 20)
    private String tokenId;

    @Column(name = "previous_owner_id", nullable = false)
    private String previousOwnerId;

    @Column(name = "amount", nullable = false, precision = 39, scale = 0)
    private BigInteger amount;

    @Column(name = "unused_amount", precision = 39, scale = 0)
    private BigInteger unusedAmount;

    @Column(name = "refunded_amount", precision = 39, scale = 0)
    private BigInteger refundedAmount;

    @Column(name = "forfeited_amount", precision = 39, scale = 0)
    private BigInteger forfeitedAmount;
}
