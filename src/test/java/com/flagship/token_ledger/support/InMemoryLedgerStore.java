package com.flagship.token_ledger.support;

import com.flagship.token_ledger.approval.Approval;
import com.flagship.token_ledger.approval.ApprovalStore;
import com.flagship.token_ledger.ledger.BalanceStore;
import com.flagship.token_ledger.token.TokenMetadata;
import com.flagship.token_ledger.token.TokenRecord;
import com.flagship.token_ledger.token.TokenStore;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-backed stand-in for the JDBC stores, so services can be tested without a database.
 *
 * Row locks are not taken, only recorded in {@link #lockedRows} as
 * {@code token:<id>} or {@code balance:<id>:<account>}, in the order requested.
 */
public class InMemoryLedgerStore implements BalanceStore, TokenStore, ApprovalStore {

    private long lastTokenId;
    private final Map<String, TokenRecord> tokens = new HashMap<>();
    private final Map<String, BigInteger> supplies = new HashMap<>();
    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();
    private final Map<String, Map<String, Approval>> approvals = new HashMap<>();

    public final List<String> lockedRows = Collections.synchronizedList(new ArrayList<>());

    public void setLastTokenId(long lastTokenId) {
        this.lastTokenId = lastTokenId;
    }

    public void deleteBalance(String tokenId, String accountId) {
        balances.getOrDefault(tokenId, new HashMap<>()).remove(accountId);
    }

    // BalanceStore

    @Override
    public Optional<BigInteger> findBalance(String tokenId, String accountId) {
        return Optional.ofNullable(balances.getOrDefault(tokenId, Map.of()).get(accountId));
    }

    @Override
    public Optional<BigInteger> lockBalance(String tokenId, String accountId) {
        lockedRows.add("balance:" + tokenId + ":" + accountId);
        return findBalance(tokenId, accountId);
    }

    @Override
    public boolean insertBalance(String tokenId, String accountId, BigInteger amount) {
        return balances.computeIfAbsent(tokenId, k -> new HashMap<>()).putIfAbsent(accountId, amount) == null;
    }

    @Override
    public void updateBalance(String tokenId, String accountId, BigInteger amount) {
        Map<String, BigInteger> tokenBalances = balances.get(tokenId);
        if (tokenBalances == null || !tokenBalances.containsKey(accountId)) {
            throw new IllegalStateException("Balance row missing for " + accountId + " on token " + tokenId);
        }
        tokenBalances.put(accountId, amount);
    }

    @Override
    public Optional<BigInteger> findSupply(String tokenId) {
        return Optional.ofNullable(supplies.get(tokenId));
    }

    @Override
    public Optional<BigInteger> lockSupply(String tokenId) {
        lockedRows.add("token:" + tokenId);
        return findSupply(tokenId);
    }

    @Override
    public void updateSupply(String tokenId, BigInteger supply) {
        supplies.put(tokenId, supply);
    }

    @Override
    public BigInteger sumBalances(String tokenId) {
        return balances.getOrDefault(tokenId, Map.of()).values().stream()
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    // TokenStore

    @Override
    public long lockTokenSequence() {
        return lastTokenId;
    }

    @Override
    public void updateTokenSequence(long lastTokenId) {
        this.lastTokenId = lastTokenId;
    }

    @Override
    public void insertToken(String tokenId, String ownerId, TokenMetadata metadata) {
        if (tokens.containsKey(tokenId)) {
            throw new IllegalStateException("Duplicate token " + tokenId);
        }
        tokens.put(tokenId, new TokenRecord(tokenId, ownerId, metadata, 0L));
        supplies.put(tokenId, BigInteger.ZERO);
    }

    @Override
    public Optional<TokenRecord> findToken(String tokenId) {
        return Optional.ofNullable(tokens.get(tokenId));
    }

    @Override
    public Optional<TokenRecord> lockToken(String tokenId) {
        lockedRows.add("token:" + tokenId);
        return findToken(tokenId);
    }

    @Override
    public void updateNextApprovalId(String tokenId, long nextApprovalId) {
        TokenRecord record = tokens.get(tokenId);
        tokens.put(tokenId, new TokenRecord(record.getTokenId(), record.getOwnerId(), record.getMetadata(), nextApprovalId));
    }

    // ApprovalStore

    @Override
    public Map<String, Approval> findAll(String tokenId) {
        return new TreeMap<>(approvals.getOrDefault(tokenId, Map.of()));
    }

    @Override
    public Optional<Approval> find(String tokenId, String spenderId) {
        return Optional.ofNullable(approvals.getOrDefault(tokenId, Map.of()).get(spenderId));
    }

    @Override
    public void save(String tokenId, String spenderId, Approval approval) {
        approvals.computeIfAbsent(tokenId, k -> new LinkedHashMap<>()).put(spenderId, approval);
    }

    @Override
    public boolean delete(String tokenId, String spenderId) {
        return approvals.getOrDefault(tokenId, new HashMap<>()).remove(spenderId) != null;
    }

    @Override
    public Map<String, Approval> removeAll(String tokenId) {
        Map<String, Approval> removed = approvals.remove(tokenId);
        return removed == null ? new LinkedHashMap<>() : removed;
    }
}
