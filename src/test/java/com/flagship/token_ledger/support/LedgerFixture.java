package com.flagship.token_ledger.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.approval.ApprovalService;
import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.call.CallPrechecks;
import com.flagship.token_ledger.config.JacksonConfig;
import com.flagship.token_ledger.ledger.BalanceLedger;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.outbox.OutboxService;
import com.flagship.token_ledger.settlement.AsyncTransferProtocol;
import com.flagship.token_ledger.settlement.PendingTransfer;
import com.flagship.token_ledger.settlement.PendingTransferPersistenceService;
import com.flagship.token_ledger.settlement.PendingTransferStatus;
import com.flagship.token_ledger.settlement.ReceiverHookRegistry;
import com.flagship.token_ledger.settlement.SettlementScheduler;
import com.flagship.token_ledger.settlement.TransferNotifier;
import com.flagship.token_ledger.token.LedgerFeatures;
import com.flagship.token_ledger.token.OutboxPaymentRefunds;
import com.flagship.token_ledger.token.Token;
import com.flagship.token_ledger.token.TokenMetadata;
import com.flagship.token_ledger.token.TokenRegistry;
import com.flagship.token_ledger.transfer.TransferEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the ledger services by hand over {@link InMemoryLedgerStore}.
 *
 * The outbox is a Mockito mock so tests can verify emitted events; pending
 * transfers are kept in a map behind a mocked persistence service.
 * No transactions are involved: a failing call is not rolled back here.
 * Settlement leases are entries in {@link #claimedTransfers}; row-locked
 * loads are counted in {@link #lockedTransferLoads}.
 */
public class LedgerFixture {

    public static final String LEDGER_ACCOUNT = "ledger.token";
    public static final String LEDGER_OWNER = "owner.token";
    public static final BigInteger ONE = BigInteger.ONE;
    public static final long ENOUGH_COMPUTE = 100_000_000_000_000L;
    public static final BigInteger BYTE_COST = BigInteger.TEN.pow(19);

    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final LedgerMetrics metrics = new LedgerMetrics(meterRegistry);
    public final OutboxService outboxService = mock(OutboxService.class);
    public final PendingTransferPersistenceService persistenceService = mock(PendingTransferPersistenceService.class);
    public final Map<UUID, PendingTransfer> pendingTransfers = new ConcurrentHashMap<>();
    public final Set<UUID> claimedTransfers = ConcurrentHashMap.newKeySet();
    public final AtomicInteger lockedTransferLoads = new AtomicInteger();

    public final CallPrechecks prechecks = new CallPrechecks(ONE, 30_000_000_000_000L, 5_000_000_000_000L);
    public final BalanceLedger balanceLedger = new BalanceLedger(store);
    public final TokenRegistry tokenRegistry;
    public final ApprovalService approvalService;
    public final TransferEngine transferEngine;
    public final ReceiverHookRegistry hookRegistry = new ReceiverHookRegistry();
    public final TransferNotifier notifier;
    public final AsyncTransferProtocol protocol;
    public final SettlementScheduler scheduler;

    public LedgerFixture() {
        this(LedgerFeatures.all());
    }

    public LedgerFixture(LedgerFeatures features) {
        tokenRegistry = new TokenRegistry(store, balanceLedger, store, features,
            new OutboxPaymentRefunds(outboxService, BYTE_COST), outboxService, metrics, objectMapper, LEDGER_OWNER);
        approvalService = new ApprovalService(tokenRegistry, store, store, prechecks);
        transferEngine = new TransferEngine(tokenRegistry, balanceLedger, store, prechecks, outboxService, metrics);
        notifier = new TransferNotifier(hookRegistry, objectMapper);
        protocol = new AsyncTransferProtocol(transferEngine, balanceLedger, prechecks, persistenceService,
            outboxService, metrics, LEDGER_ACCOUNT);
        scheduler = new SettlementScheduler(protocol, notifier, persistenceService, 50, 60_000);

        when(persistenceService.save(any())).thenAnswer(invocation -> {
            PendingTransfer transfer = invocation.getArgument(0);
            pendingTransfers.put(transfer.getId(), transfer);
            return transfer;
        });
        when(persistenceService.update(any())).thenAnswer(invocation -> {
            PendingTransfer transfer = invocation.getArgument(0);
            pendingTransfers.put(transfer.getId(), transfer);
            return transfer;
        });
        when(persistenceService.findById(any())).thenAnswer(invocation ->
            Optional.ofNullable(pendingTransfers.get(invocation.<UUID>getArgument(0))));
        when(persistenceService.findByIdForUpdate(any())).thenAnswer(invocation -> {
            lockedTransferLoads.incrementAndGet();
            return Optional.ofNullable(pendingTransfers.get(invocation.<UUID>getArgument(0)));
        });
        when(persistenceService.claim(any(), any())).thenAnswer(invocation -> {
            UUID id = invocation.getArgument(0);
            PendingTransfer transfer = pendingTransfers.get(id);
            return transfer != null && !transfer.isTerminal() && claimedTransfers.add(id);
        });
        doAnswer(invocation -> claimedTransfers.remove(invocation.<UUID>getArgument(0)))
            .when(persistenceService).release(any());
        when(persistenceService.findByStatus(any(), anyInt())).thenAnswer(invocation -> {
            PendingTransferStatus status = invocation.getArgument(0);
            int limit = invocation.getArgument(1);
            return pendingTransfers.values().stream()
                .filter(transfer -> transfer.getStatus() == status)
                .sorted(Comparator.comparing(PendingTransfer::getCreatedAt))
                .limit(limit)
                .toList();
        });
    }

    public static CallContext as(String callerId) {
        return CallContext.of(callerId, ONE, ENOUGH_COMPUTE);
    }

    public static CallContext ledger() {
        return CallContext.self(LEDGER_ACCOUNT);
    }

    public static TokenMetadata metadata(String title) {
        return TokenMetadata.builder().title(title).build();
    }

    public String mint(String ownerId, long amount) {
        Token token = tokenRegistry.mint(as(LEDGER_OWNER), ownerId, BigInteger.valueOf(amount), metadata("token"), null);
        return token.getTokenId();
    }

    public BigInteger balance(String tokenId, String accountId) {
        return balanceLedger.balanceOf(tokenId, accountId);
    }

    public BigInteger supply(String tokenId) {
        return balanceLedger.supplyOf(tokenId).orElseThrow();
    }
}
