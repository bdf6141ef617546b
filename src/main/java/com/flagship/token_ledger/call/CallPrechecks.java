package com.flagship.token_ledger.call;

import com.flagship.token_ledger.error.LedgerException;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Synchronous preconditions checked before an operation mutates anything.
 *
 * - Payment floor: mutating calls must attach at least {@code ledger.transfer.min-payment}
 *   as a confirmation signal.
 * - Compute budget: a transfer-and-notify call must be able to pay for its own
 *   work and for the resolution step that runs later.
 */
@Component
@Getter
public class CallPrechecks {

    private final BigInteger minPayment;
    private final long transferCallReserve;
    private final long resolveReserve;

    public CallPrechecks(
            @Value("${ledger.transfer.min-payment:1}") BigInteger minPayment,
            @Value("${ledger.compute.transfer-call-reserve:30000000000000}") long transferCallReserve,
            @Value("${ledger.compute.resolve-reserve:5000000000000}") long resolveReserve) {
        this.minPayment = minPayment;
        this.transferCallReserve = transferCallReserve;
        this.resolveReserve = resolveReserve;
    }

    public void requirePaymentFloor(CallContext context) {
        if (context.getAttachedPayment().compareTo(minPayment) < 0) {
            throw LedgerException.precheckFailed(String.format(
                "Requires an attached payment of at least %s, got %s", minPayment, context.getAttachedPayment()));
        }
    }

    public void requireTransferCallBudget(CallContext context) {
        long required = transferCallReserve + resolveReserve;
        if (context.getComputeBudget() <= required) {
            throw LedgerException.precheckFailed(String.format(
                "Compute budget %d does not cover the transfer call and its resolution (more than %d required)",
                context.getComputeBudget(), required));
        }
    }
}
