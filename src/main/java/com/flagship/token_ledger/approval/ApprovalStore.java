package com.flagship.token_ledger.approval;

import java.util.Map;
import java.util.Optional;

/**
 * Approvals keyed by (token, spender).
 *
 * Transfers never grant approvals; they only read and clear them through
 * {@link #removeAll(String)}.
 */
public interface ApprovalStore {

    Map<String, Approval> findAll(String tokenId);

    Optional<Approval> find(String tokenId, String spenderId);

    void save(String tokenId, String spenderId, Approval approval);

    boolean delete(String tokenId, String spenderId);

    /**
     * Removes every approval of a token.
     *
     * @return the removed approvals by spender id, empty if there were none
     */
    Map<String, Approval> removeAll(String tokenId);
}
