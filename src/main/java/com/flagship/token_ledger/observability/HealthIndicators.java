package com.flagship.token_ledger.observability;

import com.flagship.token_ledger.outbox.OutboxEventRepository;
import com.flagship.token_ledger.settlement.PendingTransferPersistenceService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators of the token ledger, exposed through Actuator.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many events wait to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                return backlogStatus(backlogSize, BACKLOG_WARNING_THRESHOLD, BACKLOG_CRITICAL_THRESHOLD)
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Unhealthy when transfer calls pile up unresolved, which means the
     * settlement scheduler is stuck or disabled.
     */
    @Component("transferCallHealth")
    public static class TransferCallHealthIndicator implements HealthIndicator {

        private final PendingTransferPersistenceService pendingTransfers;
        private final long warningThreshold;
        private final long criticalThreshold;

        public TransferCallHealthIndicator(PendingTransferPersistenceService pendingTransfers,
                                           @Value("${ledger.settlement.health.warning-threshold:500}") long warningThreshold,
                                           @Value("${ledger.settlement.health.critical-threshold:5000}") long criticalThreshold) {
            this.pendingTransfers = pendingTransfers;
            this.warningThreshold = warningThreshold;
            this.criticalThreshold = criticalThreshold;
        }

        @Override
        public Health health() {
            try {
                long open = pendingTransfers.countOpen();
                return backlogStatus(open, warningThreshold, criticalThreshold)
                        .withDetail("openTransferCalls", open)
                        .withDetail("warningThreshold", warningThreshold)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    static Health.Builder backlogStatus(long size, long warningThreshold, long criticalThreshold) {
        if (size < warningThreshold) {
            return Health.up();
        }
        return size < criticalThreshold ? Health.status("WARNING") : Health.down();
    }
}
