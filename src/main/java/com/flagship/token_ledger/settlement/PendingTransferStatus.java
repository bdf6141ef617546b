package com.flagship.token_ledger.settlement;

/**
 * Lifecycle of a transfer-and-notify call.
 *
 * STARTED -> NOTIFIED -> RESOLVED | ABORTED
 */
public enum PendingTransferStatus {
    /**
     * Tokens have moved to the receiver optimistically; the receiver has not been notified yet.
     */
    STARTED,

    /**
     * The receiver's reply (or its absence) has been recorded. Resolution is next.
     */
    NOTIFIED,

    /**
     * The receiver replied and its unused amounts were refunded.
     * Terminal state.
     */
    RESOLVED,

    /**
     * The notification failed and a full reversal was attempted.
     * Terminal state.
     */
    ABORTED
}
