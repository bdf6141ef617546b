package com.flagship.token_ledger.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Failure taxonomy of the ledger.
 *
 * Every code is fatal to the invocation that raised it: the surrounding
 * transaction is rolled back, so no partial state survives a failed call.
 * Messages are format templates filled by {@link LedgerException}.
 */
@Getter
@AllArgsConstructor
public enum LedgerErrorCode {
    INVALID_ARGUMENT("L001", "Invalid argument: %s"),
    NOT_FOUND("L002", "Token not found: %s"),
    NOT_REGISTERED("L003", "Account %s is not registered for token %s"),
    ALREADY_REGISTERED("L004", "Account %s is already registered for token %s"),
    UNAUTHORIZED("L005", "Unauthorized: %s"),
    APPROVAL_MISMATCH("L006", "Approval id mismatch for %s on token %s: expected %s, given %s"),
    OVERFLOW("L007", "Amount overflow: %s"),
    UNDERFLOW("L008", "Amount underflow: %s"),
    INSUFFICIENT_BALANCE("L009", "Account %s does not have enough balance of token %s (balance: %s, required: %s)"),
    PRECHECK_FAILED("L010", "Precondition failed: %s"),
    ID_SPACE_EXHAUSTED("L011", "Id space exhausted: %s"),
    INVALID_METADATA("L012", "Invalid token metadata: %s");

    private final String code;
    private final String message;
}
