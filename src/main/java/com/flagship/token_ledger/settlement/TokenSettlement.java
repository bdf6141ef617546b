package com.flagship.token_ledger.settlement;

import lombok.Value;

import java.math.BigInteger;

/**
 * How one token of a transfer-and-notify call ended up.
 *
 * {@code kept} is what the receiver retains from the previous owner's point
 * of view: {@code amount - refunded}. A forfeited amount left the supply
 * instead of reaching the previous owner, so it does not reduce {@code kept}.
 * {@code shortfall} is the unused amount the receiver could no longer cover.
 */
@Value
public class TokenSettlement {
    String tokenId;
    BigInteger amount;
    BigInteger unused;
    BigInteger refunded;
    BigInteger forfeited;
    BigInteger shortfall;

    public BigInteger getKept() {
        return amount.subtract(refunded);
    }

    public static TokenSettlement kept(String tokenId, BigInteger amount, BigInteger unused) {
        return new TokenSettlement(tokenId, amount, unused, BigInteger.ZERO, BigInteger.ZERO, unused);
    }
}
