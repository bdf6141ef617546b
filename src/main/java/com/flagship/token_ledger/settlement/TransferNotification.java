package com.flagship.token_ledger.settlement;

import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

/**
 * What a receiver is told about tokens it has just received. Lists are index-aligned.
 */
@Value
public class TransferNotification {
    UUID pendingTransferId;
    String senderId;
    List<String> previousOwnerIds;
    List<String> tokenIds;
    List<BigInteger> amounts;
    String message;

    static TransferNotification of(PendingTransfer transfer) {
        return new TransferNotification(
            transfer.getId(),
            transfer.getSenderId(),
            transfer.previousOwnerIds(),
            transfer.tokenIds(),
            transfer.amounts(),
            transfer.getMessage()
        );
    }
}
