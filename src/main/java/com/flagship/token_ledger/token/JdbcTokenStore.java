package com.flagship.token_ledger.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcTokenStore implements TokenStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public long lockTokenSequence() {
        Long last = jdbcTemplate.queryForObject(
            "SELECT last_token_id FROM ledger_state WHERE id = 1 FOR UPDATE",
            Long.class
        );
        if (last == null) {
            throw new IllegalStateException("ledger_state row is missing");
        }
        return last;
    }

    @Override
    public void updateTokenSequence(long lastTokenId) {
        jdbcTemplate.update("UPDATE ledger_state SET last_token_id = ? WHERE id = 1", lastTokenId);
    }

    @Override
    public void insertToken(String tokenId, String ownerId, TokenMetadata metadata) {
        jdbcTemplate.update(
            "INSERT INTO tokens (token_id, owner_id, supply, metadata, next_approval_id, created_at) " +
            "VALUES (?, ?, 0, CAST(? AS jsonb), 0, CURRENT_TIMESTAMP)",
            tokenId,
            ownerId,
            writeMetadata(metadata)
        );
    }

    @Override
    public Optional<TokenRecord> findToken(String tokenId) {
        return jdbcTemplate.query(
            "SELECT token_id, owner_id, metadata, next_approval_id FROM tokens WHERE token_id = ?",
            tokenRowMapper(),
            tokenId
        ).stream().findFirst();
    }

    @Override
    public Optional<TokenRecord> lockToken(String tokenId) {
        return jdbcTemplate.query(
            "SELECT token_id, owner_id, metadata, next_approval_id FROM tokens WHERE token_id = ? FOR UPDATE",
            tokenRowMapper(),
            tokenId
        ).stream().findFirst();
    }

    @Override
    public void updateNextApprovalId(String tokenId, long nextApprovalId) {
        int updated = jdbcTemplate.update(
            "UPDATE tokens SET next_approval_id = ? WHERE token_id = ?",
            nextApprovalId,
            tokenId
        );
        if (updated == 0) {
            throw new IllegalStateException("Token row missing: " + tokenId);
        }
    }

    private RowMapper<TokenRecord> tokenRowMapper() {
        return (rs, rowNum) -> new TokenRecord(
            rs.getString("token_id"),
            rs.getString("owner_id"),
            readMetadata(rs.getString("metadata")),
            rs.getLong("next_approval_id")
        );
    }

    private String writeMetadata(TokenMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize token metadata", e);
        }
    }

    private TokenMetadata readMetadata(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, TokenMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored token metadata is unreadable", e);
        }
    }
}
