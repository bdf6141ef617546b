package com.flagship.token_ledger.token;

import java.util.Optional;

/**
 * Storage of token classes and the token id sequence.
 *
 * Counters are unsigned 64-bit values carried in a {@code long}.
 */
public interface TokenStore {

    /**
     * Reads the last allocated token id and locks the sequence for the rest
     * of the transaction. Zero means nothing has been minted.
     */
    long lockTokenSequence();

    void updateTokenSequence(long lastTokenId);

    /**
     * Inserts a token with a zero supply and a zero approval counter.
     */
    void insertToken(String tokenId, String ownerId, TokenMetadata metadata);

    Optional<TokenRecord> findToken(String tokenId);

    /**
     * Reads a token and locks its row until the transaction ends.
     */
    Optional<TokenRecord> lockToken(String tokenId);

    void updateNextApprovalId(String tokenId, long nextApprovalId);
}
