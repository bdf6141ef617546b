package com.flagship.token_ledger.token;

import java.math.BigInteger;

/**
 * Settles the payment attached to a call against the storage the call used.
 */
public interface PaymentRefunds {

    /**
     * Charges {@code storageBytes} against {@code attachedPayment} and refunds
     * the rest to {@code recipientId}.
     *
     * @return the refunded amount, possibly zero
     * @throws com.flagship.token_ledger.error.LedgerException PRECHECK_FAILED if the
     *         attached payment does not cover the storage cost
     */
    BigInteger refundExcess(String tokenId, long storageBytes, String recipientId, BigInteger attachedPayment);
}
