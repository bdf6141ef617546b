package com.flagship.token_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Token Ledger service.
 *
 * - Balances of many token classes per account, with checked u128 arithmetic
 * - Single and batch transfers, all or nothing
 * - Transfer-and-notify calls settled by a scheduler, with refunds of unused amounts
 * - Ledger events published to Kafka through a transactional outbox
 */
@SpringBootApplication
@EnableScheduling
public class TokenLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenLedgerApplication.class, args);
    }
}
