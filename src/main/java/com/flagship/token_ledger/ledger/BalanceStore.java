package com.flagship.token_ledger.ledger;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Storage of per-(token, account) balances and the per-token supply counter.
 *
 * Implementations only read and write; all validation and arithmetic lives
 * in {@link BalanceLedger}.
 */
public interface BalanceStore {

    Optional<BigInteger> findBalance(String tokenId, String accountId);

    /**
     * Reads a balance and locks its entry until the transaction ends.
     */
    Optional<BigInteger> lockBalance(String tokenId, String accountId);

    /**
     * Creates a balance entry.
     *
     * @return false if an entry already existed (it is left untouched)
     */
    boolean insertBalance(String tokenId, String accountId, BigInteger amount);

    void updateBalance(String tokenId, String accountId, BigInteger amount);

    /**
     * @return the tracked supply, or empty if the token does not exist
     */
    Optional<BigInteger> findSupply(String tokenId);

    /**
     * Reads the tracked supply and locks the token row until the transaction ends.
     */
    Optional<BigInteger> lockSupply(String tokenId);

    void updateSupply(String tokenId, BigInteger supply);

    BigInteger sumBalances(String tokenId);
}
