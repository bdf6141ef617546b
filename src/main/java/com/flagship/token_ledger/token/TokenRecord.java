package com.flagship.token_ledger.token;

import lombok.Value;

/**
 * Stored attributes of a token class, without balances or approvals.
 *
 * {@code nextApprovalId} holds unsigned 64-bit bits.
 */
@Value
public class TokenRecord {
    String tokenId;
    String ownerId;
    TokenMetadata metadata;
    long nextApprovalId;
}
