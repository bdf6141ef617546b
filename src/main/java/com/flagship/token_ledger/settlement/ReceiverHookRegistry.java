package com.flagship.token_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Receiver hooks by account id. An account without a hook cannot accept
 * transfer-and-notify calls: its notifications fail and are reversed.
 */
@Component
@Slf4j
public class ReceiverHookRegistry {

    private final Map<String, ReceiverHook> hooks = new ConcurrentHashMap<>();

    public void register(String accountId, ReceiverHook hook) {
        hooks.put(accountId, hook);
        log.info("Registered receiver hook for {}", accountId);
    }

    public void unregister(String accountId) {
        if (hooks.remove(accountId) != null) {
            log.info("Unregistered receiver hook for {}", accountId);
        }
    }

    public Optional<ReceiverHook> find(String accountId) {
        return Optional.ofNullable(hooks.get(accountId));
    }
}
