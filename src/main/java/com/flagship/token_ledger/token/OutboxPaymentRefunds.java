package com.flagship.token_ledger.token;

import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.event.StorageRefundIssuedEvent;
import com.flagship.token_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Records storage refunds as {@code StorageRefundIssued} events for the host to pay out.
 */
@Component
@Slf4j
public class OutboxPaymentRefunds implements PaymentRefunds {

    private final OutboxService outboxService;
    private final BigInteger byteCost;

    public OutboxPaymentRefunds(OutboxService outboxService,
                                @Value("${ledger.storage.byte-cost:10000000000000000000}") BigInteger byteCost) {
        this.outboxService = outboxService;
        this.byteCost = byteCost;
    }

    @Override
    public BigInteger refundExcess(String tokenId, long storageBytes, String recipientId, BigInteger attachedPayment) {
        BigInteger cost = byteCost.multiply(BigInteger.valueOf(storageBytes));
        if (attachedPayment.compareTo(cost) < 0) {
            throw LedgerException.precheckFailed(String.format(
                "Must attach %s to cover %d bytes of storage, got %s", cost, storageBytes, attachedPayment));
        }

        BigInteger refund = attachedPayment.subtract(cost);
        if (refund.signum() > 0) {
            outboxService.saveEvent(StorageRefundIssuedEvent.of(tokenId, recipientId, storageBytes, cost, refund));
            log.debug("Refunding {} to {} after charging {} bytes", refund, recipientId, storageBytes);
        }
        return refund;
    }
}
