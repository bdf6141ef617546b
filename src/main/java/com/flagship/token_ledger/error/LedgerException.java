package com.flagship.token_ledger.error;

import lombok.Getter;

/**
 * Unchecked failure of a ledger operation.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode errorCode;

    public LedgerException(LedgerErrorCode errorCode, Object... args) {
        super(String.format(errorCode.getMessage(), args));
        this.errorCode = errorCode;
    }

    public static LedgerException invalidArgument(String reason) {
        return new LedgerException(LedgerErrorCode.INVALID_ARGUMENT, reason);
    }

    public static LedgerException unauthorized(String reason) {
        return new LedgerException(LedgerErrorCode.UNAUTHORIZED, reason);
    }

    public static LedgerException precheckFailed(String reason) {
        return new LedgerException(LedgerErrorCode.PRECHECK_FAILED, reason);
    }

    public static LedgerException tokenNotFound(String tokenId) {
        return new LedgerException(LedgerErrorCode.NOT_FOUND, tokenId);
    }
}
