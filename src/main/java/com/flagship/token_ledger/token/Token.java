package com.flagship.token_ledger.token;

import com.flagship.token_ledger.approval.Approval;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Read view of a token.
 *
 * {@code metadata} is null when the metadata extension is disabled;
 * {@code approvals} and {@code nextApprovalId} are null when the approval
 * extension is disabled.
 */
@Value
public class Token {
    String tokenId;
    String ownerId;
    BigInteger supply;
    TokenMetadata metadata;
    Map<String, Approval> approvals;
    String nextApprovalId;
}
