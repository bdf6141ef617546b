package com.flagship.token_ledger.config;

import com.flagship.token_ledger.token.LedgerFeatures;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public LedgerFeatures ledgerFeatures(
            @Value("${ledger.extensions.metadata:true}") boolean metadataEnabled,
            @Value("${ledger.extensions.approvals:true}") boolean approvalsEnabled) {
        log.info("Ledger extensions: metadata={}, approvals={}", metadataEnabled, approvalsEnabled);
        return new LedgerFeatures(metadataEnabled, approvalsEnabled);
    }
}
