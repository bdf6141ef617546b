package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.settlement.PendingTransferPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need database queries, so scrapes stay cheap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final PendingTransferPersistenceService pendingTransfers;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            ledgerMetrics.setOpenTransferCalls(pendingTransfers.countOpen());
        } catch (Exception e) {
            log.warn("Failed to refresh transfer call metrics: {}", e.getMessage());
        }
    }
}
