package com.flagship.token_ledger.call;

import lombok.Value;

import java.math.BigInteger;

/**
 * Who is invoking a ledger operation and what the invocation carries.
 *
 * The host authenticates the caller; the ledger only compares identities.
 * {@code attachedPayment} is the nominal payment sent with the call and
 * {@code computeBudget} the work allowance the host granted it.
 */
@Value
public class CallContext {
    String callerId;
    BigInteger attachedPayment;
    long computeBudget;

    public static CallContext of(String callerId, BigInteger attachedPayment, long computeBudget) {
        return new CallContext(callerId, attachedPayment == null ? BigInteger.ZERO : attachedPayment, computeBudget);
    }

    public static CallContext of(String callerId, BigInteger attachedPayment) {
        return of(callerId, attachedPayment, 0L);
    }

    /**
     * Context used by the ledger when it calls itself, e.g. for a scheduled resolution.
     */
    public static CallContext self(String ledgerAccountId) {
        return of(ledgerAccountId, BigInteger.ZERO, 0L);
    }

    public boolean isCaller(String accountId) {
        return callerId != null && callerId.equals(accountId);
    }
}
