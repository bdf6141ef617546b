package com.flagship.token_ledger;

import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.settlement.AsyncTransferProtocol;
import com.flagship.token_ledger.settlement.NotificationOutcome;
import com.flagship.token_ledger.settlement.PendingTransferPersistenceService;
import com.flagship.token_ledger.token.TokenRegistry;
import com.flagship.token_ledger.transfer.TransferEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * All-or-nothing batches and row locks rely on these entry points running
 * in one read-write transaction each. The rollback itself is exercised
 * against PostgreSQL in {@link TokenLedgerIntegrationTest}.
 */
class TransactionBoundariesTest {

    private static void assertReadWriteTransaction(Class<?> type, String name, Class<?>... parameterTypes)
            throws NoSuchMethodException {
        Method method = type.getMethod(name, parameterTypes);
        Transactional transactional = AnnotatedElementUtils.findMergedAnnotation(method, Transactional.class);

        assertNotNull(transactional, type.getSimpleName() + "." + name + " must be transactional");
        assertFalse(transactional.readOnly(), type.getSimpleName() + "." + name + " must not be read-only");
        assertTrue(Modifier.isPublic(method.getModifiers()));
        assertFalse(Modifier.isFinal(method.getModifiers()));
    }

    @Test
    @DisplayName("Batch transfers run in a single transaction")
    void batchTransfers() throws Exception {
        assertReadWriteTransaction(TransferEngine.class, "batchTransfer",
            CallContext.class, String.class, List.class, List.class, List.class, String.class);
        assertReadWriteTransaction(TransferEngine.class, "transferBatch",
            String.class, String.class, List.class, List.class, List.class, String.class);
        assertReadWriteTransaction(AsyncTransferProtocol.class, "batchTransferCall",
            CallContext.class, String.class, List.class, List.class, List.class, String.class, String.class);
    }

    @Test
    @DisplayName("Row-locking entry points run in a transaction that holds the lock")
    void lockingEntryPoints() throws Exception {
        assertReadWriteTransaction(TokenRegistry.class, "lockRecord", String.class);
        assertReadWriteTransaction(AsyncTransferProtocol.class, "resolveTransfer", CallContext.class, UUID.class);
        assertReadWriteTransaction(AsyncTransferProtocol.class, "recordNotification",
            UUID.class, NotificationOutcome.class);
        assertReadWriteTransaction(PendingTransferPersistenceService.class, "findByIdForUpdate", UUID.class);
        assertReadWriteTransaction(PendingTransferPersistenceService.class, "claim", UUID.class, Duration.class);
        assertReadWriteTransaction(TransferEngine.class, "transfer",
            CallContext.class, String.class, String.class, BigInteger.class, Long.class, String.class);
    }
}
