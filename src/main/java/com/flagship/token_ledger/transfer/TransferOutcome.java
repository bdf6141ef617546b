package com.flagship.token_ledger.transfer;

import com.flagship.token_ledger.approval.Approval;
import lombok.Value;

import java.util.Map;

/**
 * Result of one executed transfer leg.
 *
 * {@code removedApprovals} are the approvals the token had before the
 * transfer cleared them, keyed by spender id.
 */
@Value
public class TransferOutcome {
    String tokenId;
    String effectiveOwnerId;
    Map<String, Approval> removedApprovals;
}
