package com.flagship.token_ledger.settlement;

import com.flagship.token_ledger.approval.Approval;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * One token of a pending transfer.
 *
 * {@code unusedAmount} is set once the receiver has been notified;
 * {@code refundedAmount} and {@code forfeitedAmount} once the leg is resolved.
 */
@Value
public class TransferLeg {
    String tokenId;
    String previousOwnerId;
    BigInteger amount;
    Map<String, Approval> priorApprovals;
    BigInteger unusedAmount;
    BigInteger refundedAmount;
    BigInteger forfeitedAmount;

    public static TransferLeg sent(String tokenId, String previousOwnerId, BigInteger amount,
                                   Map<String, Approval> priorApprovals) {
        return new TransferLeg(tokenId, previousOwnerId, amount, Map.copyOf(priorApprovals), null, null, null);
    }

    TransferLeg withUnused(BigInteger unused) {
        return new TransferLeg(tokenId, previousOwnerId, amount, priorApprovals, unused, refundedAmount, forfeitedAmount);
    }

    TransferLeg withSettlement(TokenSettlement settlement) {
        return new TransferLeg(tokenId, previousOwnerId, amount, priorApprovals, unusedAmount,
            settlement.getRefunded(), settlement.getForfeited());
    }
}
