package com.flagship.token_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of {@link BalanceStore}.
 *
 * Balances live in {@code balances}, keyed by (token_id, account_id); the
 * supply counter is a column of {@code tokens}. A CHECK constraint keeps both
 * non-negative as a database-level backstop.
 *
 * Mutations read through the {@code lock*} methods, which take row locks
 * with {@code FOR UPDATE}: the token row first, then the balance row.
 */
@Repository
public class JdbcBalanceStore implements BalanceStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcBalanceStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<BigInteger> findBalance(String tokenId, String accountId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM balances WHERE token_id = ? AND account_id = ?",
            BigDecimal.class,
            tokenId,
            accountId
        );
        return rows.stream().findFirst().map(Amounts::fromColumn);
    }

    @Override
    public Optional<BigInteger> lockBalance(String tokenId, String accountId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT amount FROM balances WHERE token_id = ? AND account_id = ? FOR UPDATE",
            BigDecimal.class,
            tokenId,
            accountId
        );
        return rows.stream().findFirst().map(Amounts::fromColumn);
    }

    @Override
    public boolean insertBalance(String tokenId, String accountId, BigInteger amount) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO balances (token_id, account_id, amount, created_at, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (token_id, account_id) DO NOTHING",
            tokenId,
            accountId,
            Amounts.toColumn(amount)
        );
        return inserted == 1;
    }

    @Override
    public void updateBalance(String tokenId, String accountId, BigInteger amount) {
        int updated = jdbcTemplate.update(
            "UPDATE balances SET amount = ?, updated_at = CURRENT_TIMESTAMP WHERE token_id = ? AND account_id = ?",
            Amounts.toColumn(amount),
            tokenId,
            accountId
        );
        if (updated != 1) {
            throw new IllegalStateException("Balance row missing for " + accountId + " on token " + tokenId);
        }
    }

    @Override
    public Optional<BigInteger> findSupply(String tokenId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT supply FROM tokens WHERE token_id = ?",
            BigDecimal.class,
            tokenId
        );
        return rows.stream().findFirst().map(Amounts::fromColumn);
    }

    @Override
    public Optional<BigInteger> lockSupply(String tokenId) {
        List<BigDecimal> rows = jdbcTemplate.queryForList(
            "SELECT supply FROM tokens WHERE token_id = ? FOR UPDATE",
            BigDecimal.class,
            tokenId
        );
        return rows.stream().findFirst().map(Amounts::fromColumn);
    }

    @Override
    public void updateSupply(String tokenId, BigInteger supply) {
        jdbcTemplate.update(
            "UPDATE tokens SET supply = ? WHERE token_id = ?",
            Amounts.toColumn(supply),
            tokenId
        );
    }

    @Override
    public BigInteger sumBalances(String tokenId) {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM balances WHERE token_id = ?",
            BigDecimal.class,
            tokenId
        );
        return total != null ? Amounts.fromColumn(total) : BigInteger.ZERO;
    }
}
