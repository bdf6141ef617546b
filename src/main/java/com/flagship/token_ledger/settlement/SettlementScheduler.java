package com.flagship.token_ledger.settlement;

import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Drives pending transfers through notification and resolution.
 *
 * Each poll first resolves NOTIFIED transfers (left behind by an interrupted
 * run), then notifies and resolves STARTED ones. The receiver's hook runs
 * outside any transaction; its outcome and the resolution are committed
 * separately, so a crash in between resumes from the persisted state.
 *
 * A worker settles a transfer only while it holds that transfer's lease, so
 * the hook runs once per transfer even with several schedulers or callers.
 * A lease left by a crashed worker expires after the configured time.
 */
@Component
@ConditionalOnProperty(name = "ledger.settlement.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SettlementScheduler {

    private final AsyncTransferProtocol protocol;
    private final TransferNotifier notifier;
    private final PendingTransferPersistenceService persistenceService;
    private final int batchSize;
    private final Duration claimLease;

    public SettlementScheduler(AsyncTransferProtocol protocol,
                               TransferNotifier notifier,
                               PendingTransferPersistenceService persistenceService,
                               @Value("${ledger.settlement.batch-size:50}") int batchSize,
                               @Value("${ledger.settlement.claim-lease-ms:60000}") long claimLeaseMs) {
        this.protocol = protocol;
        this.notifier = notifier;
        this.persistenceService = persistenceService;
        this.batchSize = batchSize;
        this.claimLease = Duration.ofMillis(claimLeaseMs);
    }

    @Scheduled(fixedDelayString = "${ledger.settlement.poll-interval-ms:1000}")
    public void settlePending() {
        try {
            settleAll(persistenceService.findByStatus(PendingTransferStatus.NOTIFIED, batchSize));
            settleAll(persistenceService.findByStatus(PendingTransferStatus.STARTED, batchSize));
        } catch (Exception e) {
            log.error("Error in settlement polling loop", e);
        }
    }

    private void settleAll(List<PendingTransfer> transfers) {
        for (PendingTransfer transfer : transfers) {
            try {
                settle(transfer.getId());
            } catch (RuntimeException e) {
                log.error("Failed to settle transfer call {}, will retry on the next poll: {}",
                    transfer.getId(), e.getMessage());
            }
        }
    }

    /**
     * Advances one pending transfer as far as it can go.
     *
     * If another worker holds the transfer's lease, or the transfer is
     * already terminal, nothing runs.
     *
     * @return the transfer in its latest persisted state
     */
    public PendingTransfer settle(UUID pendingTransferId) {
        String id = pendingTransferId.toString();
        try (CorrelationContext.Scope correlation = CorrelationContext.begin(id.substring(0, 8));
             CorrelationContext.Scope transferId =
                 CorrelationContext.withMdc(CorrelationContext.PENDING_TRANSFER_ID_MDC_KEY, id)) {
            if (!persistenceService.claim(pendingTransferId, claimLease)) {
                return load(pendingTransferId);
            }
            try {
                PendingTransfer transfer = load(pendingTransferId);
                if (transfer.getStatus() == PendingTransferStatus.STARTED) {
                    NotificationOutcome outcome = notifier.notify(transfer);
                    transfer = protocol.recordNotification(pendingTransferId, outcome);
                }
                if (transfer.getStatus() == PendingTransferStatus.NOTIFIED) {
                    transfer = protocol.resolveTransfer(CallContext.self(protocol.getLedgerAccountId()), pendingTransferId);
                }
                return transfer;
            } finally {
                persistenceService.release(pendingTransferId);
            }
        }
    }

    private PendingTransfer load(UUID pendingTransferId) {
        return persistenceService.findById(pendingTransferId)
            .orElseThrow(() -> new IllegalArgumentException("Pending transfer not found: " + pendingTransferId));
    }

    public void triggerSettlement() {
        settlePending();
    }
}
