package com.flagship.token_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id, mirrored into the logging MDC.
 *
 * The settlement scheduler opens one correlation scope per pending transfer
 * it works on, so the notification and resolution log lines of one saga
 * share an id. Ledger operations add {@code tokenId} or
 * {@code pendingTransferId} to the MDC while they run.
 *
 * Closing a scope restores whatever the caller had set before it was opened.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TOKEN_ID_MDC_KEY = "tokenId";
    public static final String PENDING_TRANSFER_ID_MDC_KEY = "pendingTransferId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Opens a correlation scope; a blank id gets a generated one.
     */
    public static Scope begin(String id) {
        String value = id != null && !id.isBlank() ? id : generateCorrelationId();
        String previous = correlationId.get();
        Scope mdcScope = withMdc(CORRELATION_ID_MDC_KEY, value);
        correlationId.set(value);
        return () -> {
            mdcScope.close();
            if (previous == null) {
                correlationId.remove();
            } else {
                correlationId.set(previous);
            }
        };
    }

    /**
     * Puts one MDC entry for the lifetime of the returned scope.
     */
    public static Scope withMdc(String key, String value) {
        String previous = MDC.get(key);
        MDC.put(key, value);
        return () -> {
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        };
    }

    public static String getCorrelationId() {
        return correlationId.get();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}
