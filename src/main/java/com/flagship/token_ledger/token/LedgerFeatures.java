package com.flagship.token_ledger.token;

import lombok.Value;

/**
 * Optional capabilities of this ledger, fixed at startup.
 */
@Value
public class LedgerFeatures {
    boolean metadataEnabled;
    boolean approvalsEnabled;

    public static LedgerFeatures all() {
        return new LedgerFeatures(true, true);
    }
}
