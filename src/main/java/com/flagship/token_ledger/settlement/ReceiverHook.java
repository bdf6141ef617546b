package com.flagship.token_ledger.settlement;

/**
 * Receiver-side logic run after tokens arrive through a transfer-and-notify call.
 *
 * The reply is a JSON array with one entry per token: the amount the
 * receiver did not use and wants returned, as a non-negative decimal integer
 * (a JSON number or a string of digits).
 */
@FunctionalInterface
public interface ReceiverHook {

    String onTransfer(TransferNotification notification) throws Exception;
}
