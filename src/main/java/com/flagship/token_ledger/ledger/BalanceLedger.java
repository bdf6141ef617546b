package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Per-(token, account) balance storage with checked arithmetic.
 *
 * This service enforces the core invariants:
 * 1. A balance entry exists only after registration; absence is not zero
 * 2. Balances and the per-token supply counter only change through
 *    {@link #deposit} and {@link #withdraw}
 * 3. No operation wraps: leaving the unsigned 128-bit range fails the call
 *
 * Consequently the tracked supply of a token always equals the sum of the
 * registered balances of that token.
 *
 * Deposits and withdrawals lock the token row, then the balance row, before
 * reading, so concurrent transactions on one token apply one after another.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceLedger {

    private final BalanceStore balanceStore;

    /**
     * Gets the balance of a registered account.
     *
     * @throws LedgerException NOT_REGISTERED if the account has no entry for the token
     */
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String tokenId, String accountId) {
        return balanceStore.findBalance(tokenId, accountId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_REGISTERED, accountId, tokenId));
    }

    @Transactional(readOnly = true)
    public boolean isRegistered(String tokenId, String accountId) {
        return balanceStore.findBalance(tokenId, accountId).isPresent();
    }

    /**
     * Gets the balances of one account across several tokens.
     * Unregistered accounts read as zero here; unknown tokens fail.
     */
    @Transactional(readOnly = true)
    public List<BigInteger> batchBalanceOf(String accountId, List<String> tokenIds) {
        return tokenIds.stream()
            .map(tokenId -> {
                requireToken(tokenId);
                return balanceStore.findBalance(tokenId, accountId).orElse(BigInteger.ZERO);
            })
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<BigInteger> supplyOf(String tokenId) {
        return balanceStore.findSupply(tokenId);
    }

    @Transactional(readOnly = true)
    public List<Optional<BigInteger>> batchSupplyOf(List<String> tokenIds) {
        return tokenIds.stream()
            .map(balanceStore::findSupply)
            .toList();
    }

    /**
     * Sums every registered balance of a token. Used to audit the supply counter.
     */
    @Transactional(readOnly = true)
    public BigInteger registeredTotal(String tokenId) {
        requireToken(tokenId);
        return balanceStore.sumBalances(tokenId);
    }

    /**
     * Registers an account for a token with a zero balance.
     *
     * @throws LedgerException NOT_FOUND for an unknown token, ALREADY_REGISTERED if an entry exists
     */
    @Transactional
    public void register(String tokenId, String accountId) {
        requireAccount(accountId);
        requireToken(tokenId);
        if (!balanceStore.insertBalance(tokenId, accountId, BigInteger.ZERO)) {
            throw new LedgerException(LedgerErrorCode.ALREADY_REGISTERED, accountId, tokenId);
        }
        log.debug("Registered account {} for token {}", accountId, tokenId);
    }

    /**
     * Adds to an account's balance and to the token's supply.
     *
     * @throws LedgerException NOT_REGISTERED, or OVERFLOW if either sum leaves the u128 range
     */
    @Transactional
    public void deposit(String tokenId, String accountId, BigInteger amount) {
        Amounts.requireValid(amount, "Deposit amount");
        BigInteger supply = lockSupply(tokenId);
        BigInteger balance = lockBalance(tokenId, accountId);

        BigInteger newBalance = Amounts.checkedAdd(balance, amount, "balance of " + accountId + " on token " + tokenId);
        BigInteger newSupply = Amounts.checkedAdd(supply, amount, "total supply of token " + tokenId);

        balanceStore.updateBalance(tokenId, accountId, newBalance);
        balanceStore.updateSupply(tokenId, newSupply);
    }

    /**
     * Subtracts from an account's balance and from the token's supply.
     *
     * @throws LedgerException NOT_REGISTERED, INSUFFICIENT_BALANCE, or UNDERFLOW if the
     *         supply counter would go negative
     */
    @Transactional
    public void withdraw(String tokenId, String accountId, BigInteger amount) {
        Amounts.requireValid(amount, "Withdraw amount");
        BigInteger supply = lockSupply(tokenId);
        BigInteger balance = lockBalance(tokenId, accountId);
        if (balance.compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE, accountId, tokenId, balance, amount);
        }

        BigInteger newBalance = balance.subtract(amount);
        // Unreachable while supply equals the sum of balances
        BigInteger newSupply = Amounts.checkedSubtract(supply, amount, "total supply of token " + tokenId);

        balanceStore.updateBalance(tokenId, accountId, newBalance);
        balanceStore.updateSupply(tokenId, newSupply);
    }

    private BigInteger requireToken(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            throw LedgerException.invalidArgument("Token id is required");
        }
        return balanceStore.findSupply(tokenId)
            .orElseThrow(() -> LedgerException.tokenNotFound(tokenId));
    }

    private BigInteger lockSupply(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            throw LedgerException.invalidArgument("Token id is required");
        }
        return balanceStore.lockSupply(tokenId)
            .orElseThrow(() -> LedgerException.tokenNotFound(tokenId));
    }

    private BigInteger lockBalance(String tokenId, String accountId) {
        return balanceStore.lockBalance(tokenId, accountId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_REGISTERED, accountId, tokenId));
    }

    private static void requireAccount(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw LedgerException.invalidArgument("Account id is required");
        }
    }
}
