package com.flagship.token_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.tokens.minted: tokens created
 * - ledger.transfers: transfer calls, tagged by kind (single, batch, call, batch_call) and status
 * - ledger.transfer.legs: executed transfer legs
 * - ledger.settlements: resolved sagas, tagged by outcome and final status
 * - ledger.settlement.refunds / ledger.settlement.forfeits: legs that refunded or forfeited
 * - ledger.operation.latency: latency per operation
 * - ledger.transfer_calls.open: transfer calls not yet resolved (refreshed by {@link MetricsScheduler})
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter tokensMinted;
    private final Counter transferLegs;
    private final Counter refundedLegs;
    private final Counter forfeitedLegs;
    private final AtomicLong openTransferCalls = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.tokensMinted = Counter.builder("ledger.tokens.minted")
                .description("Number of token classes minted")
                .register(registry);

        this.transferLegs = Counter.builder("ledger.transfer.legs")
                .description("Number of executed single-token transfer legs")
                .register(registry);

        this.refundedLegs = Counter.builder("ledger.settlement.refunds")
                .description("Settled legs that returned tokens to the previous owner")
                .register(registry);

        this.forfeitedLegs = Counter.builder("ledger.settlement.forfeits")
                .description("Settled legs whose refund left the supply")
                .register(registry);

        Gauge.builder("ledger.transfer_calls.open", openTransferCalls, AtomicLong::get)
                .description("Transfer calls in STARTED or NOTIFIED status")
                .register(registry);
    }

    public void setOpenTransferCalls(long count) {
        openTransferCalls.set(count);
    }

    public void incrementTokensMinted() {
        tokensMinted.increment();
    }

    public void incrementTransferLegs() {
        transferLegs.increment();
    }

    public void incrementRefundedLegs() {
        refundedLegs.increment();
    }

    public void incrementForfeitedLegs() {
        forfeitedLegs.increment();
    }

    public void recordTransfer(String kind, String status) {
        registry.counter("ledger.transfers",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordSettlement(String outcome, String status) {
        registry.counter("ledger.settlements",
                "outcome", sanitizeTag(outcome),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("ledger.operation.latency")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
