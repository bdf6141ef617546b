package com.flagship.token_ledger.approval;

import lombok.Value;

import java.math.BigInteger;

/**
 * Permission for a spender to transfer a token on the owner's behalf, up to {@code ceiling}.
 */
@Value
public class Approval {
    long approvalId;
    BigInteger ceiling;
}
