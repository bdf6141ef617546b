package com.flagship.token_ledger.approval;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcApprovalStore implements ApprovalStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcApprovalStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<String, Approval> findAll(String tokenId) {
        Map<String, Approval> approvals = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT spender_id, approval_id, ceiling FROM approvals WHERE token_id = ? ORDER BY spender_id",
            rs -> {
                approvals.put(rs.getString("spender_id"), approvalRowMapper().mapRow(rs, 0));
            },
            tokenId
        );
        return approvals;
    }

    @Override
    public Optional<Approval> find(String tokenId, String spenderId) {
        return jdbcTemplate.query(
            "SELECT approval_id, ceiling FROM approvals WHERE token_id = ? AND spender_id = ?",
            approvalRowMapper(),
            tokenId,
            spenderId
        ).stream().findFirst();
    }

    @Override
    public void save(String tokenId, String spenderId, Approval approval) {
        jdbcTemplate.update(
            "INSERT INTO approvals (token_id, spender_id, approval_id, ceiling, created_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (token_id, spender_id) DO UPDATE " +
            "SET approval_id = EXCLUDED.approval_id, ceiling = EXCLUDED.ceiling, created_at = EXCLUDED.created_at",
            tokenId,
            spenderId,
            approval.getApprovalId(),
            new BigDecimal(approval.getCeiling())
        );
    }

    @Override
    public boolean delete(String tokenId, String spenderId) {
        return jdbcTemplate.update(
            "DELETE FROM approvals WHERE token_id = ? AND spender_id = ?",
            tokenId,
            spenderId
        ) > 0;
    }

    @Override
    public Map<String, Approval> removeAll(String tokenId) {
        Map<String, Approval> removed = new LinkedHashMap<>();
        jdbcTemplate.query(
            "DELETE FROM approvals WHERE token_id = ? RETURNING spender_id, approval_id, ceiling",
            rs -> {
                removed.put(rs.getString("spender_id"), approvalRowMapper().mapRow(rs, 0));
            },
            tokenId
        );
        return removed;
    }

    private RowMapper<Approval> approvalRowMapper() {
        return (rs, rowNum) -> new Approval(
            rs.getLong("approval_id"),
            rs.getBigDecimal("ceiling").toBigIntegerExact()
        );
    }
}
