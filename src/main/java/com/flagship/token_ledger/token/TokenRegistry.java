package com.flagship.token_ledger.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.approval.ApprovalStore;
import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.event.TokenMintedEvent;
import com.flagship.token_ledger.ledger.Amounts;
import com.flagship.token_ledger.ledger.BalanceLedger;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.observability.LedgerMetrics;
import com.flagship.token_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Creates token classes and answers questions about them.
 *
 * Token ids come from an unsigned 64-bit sequence starting at 1 and are
 * never reused. A new token starts with a zero supply counter; the initial
 * amount reaches the owner through a regular deposit, so the supply always
 * equals the sum of the registered balances.
 */
@Service
@Slf4j
public class TokenRegistry {

    private static final long LAST_TOKEN_ID = -1L; // 2^64 - 1 as unsigned

    private final TokenStore tokenStore;
    private final BalanceLedger balanceLedger;
    private final ApprovalStore approvalStore;
    private final LedgerFeatures features;
    private final PaymentRefunds paymentRefunds;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final ObjectMapper objectMapper;
    private final String ledgerOwnerId;

    public TokenRegistry(TokenStore tokenStore,
                         BalanceLedger balanceLedger,
                         ApprovalStore approvalStore,
                         LedgerFeatures features,
                         PaymentRefunds paymentRefunds,
                         OutboxService outboxService,
                         LedgerMetrics ledgerMetrics,
                         ObjectMapper objectMapper,
                         @Value("${ledger.owner-id}") String ledgerOwnerId) {
        this.tokenStore = tokenStore;
        this.balanceLedger = balanceLedger;
        this.approvalStore = approvalStore;
        this.features = features;
        this.paymentRefunds = paymentRefunds;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.objectMapper = objectMapper;
        this.ledgerOwnerId = ledgerOwnerId;
    }

    /**
     * Mints a new token class and credits the initial amount to its owner.
     *
     * @param initialAmount    amount credited to the owner, null meaning zero
     * @param metadata         required when the metadata extension is enabled, ignored otherwise
     * @param refundRecipient  if set, the attached payment is charged for the storage written
     *                         and the excess refunded to this account
     * @throws LedgerException UNAUTHORIZED, INVALID_ARGUMENT, INVALID_METADATA,
     *                         ID_SPACE_EXHAUSTED or PRECHECK_FAILED
     */
    @Transactional
    public Token mint(CallContext context, String ownerId, BigInteger initialAmount,
                      TokenMetadata metadata, String refundRecipient) {
        long startTime = System.currentTimeMillis();

        if (!context.isCaller(ledgerOwnerId)) {
            throw LedgerException.unauthorized("only the ledger owner may mint, caller was " + context.getCallerId());
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw LedgerException.invalidArgument("Token owner id is required");
        }
        BigInteger amount = initialAmount == null ? BigInteger.ZERO : Amounts.requireValid(initialAmount, "Initial amount");
        TokenMetadata storedMetadata = checkMetadata(metadata);

        long last = tokenStore.lockTokenSequence();
        if (last == LAST_TOKEN_ID) {
            throw new LedgerException(LedgerErrorCode.ID_SPACE_EXHAUSTED, "token ids");
        }
        long next = last + 1;
        tokenStore.updateTokenSequence(next);
        String tokenId = Long.toUnsignedString(next);

        try (CorrelationContext.Scope ignored = CorrelationContext.withMdc(CorrelationContext.TOKEN_ID_MDC_KEY, tokenId)) {
            tokenStore.insertToken(tokenId, ownerId, storedMetadata);
            balanceLedger.register(tokenId, ownerId);
            balanceLedger.deposit(tokenId, ownerId, amount);

            if (refundRecipient != null) {
                long bytes = StorageFootprint.ofMint(tokenId, ownerId, metadataBytes(storedMetadata)).getBytes();
                paymentRefunds.refundExcess(tokenId, bytes, refundRecipient, context.getAttachedPayment());
            }

            outboxService.saveEvent(TokenMintedEvent.of(tokenId, ownerId, amount));

            ledgerMetrics.incrementTokensMinted();
            ledgerMetrics.recordLatency("mint", System.currentTimeMillis() - startTime);
            log.info("Minted token: owner={}, amount={}", ownerId, amount);

            return token(tokenId).orElseThrow();
        }
    }

    @Transactional(readOnly = true)
    public Optional<Token> token(String tokenId) {
        return tokenStore.findToken(tokenId).map(this::toView);
    }

    /**
     * Looks up several tokens; unknown ids yield empty entries at their index.
     */
    @Transactional(readOnly = true)
    public List<Optional<Token>> tokens(List<String> tokenIds) {
        return tokenIds.stream()
            .map(this::token)
            .toList();
    }

    /**
     * @throws LedgerException NOT_FOUND for an unknown token
     */
    @Transactional(readOnly = true)
    public TokenRecord requireRecord(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            throw LedgerException.invalidArgument("Token id is required");
        }
        return tokenStore.findToken(tokenId)
            .orElseThrow(() -> LedgerException.tokenNotFound(tokenId));
    }

    /**
     * Like {@link #requireRecord}, but also locks the token row for the rest of
     * the transaction. Every mutation of a token's approvals or balances goes
     * through this first.
     *
     * @throws LedgerException NOT_FOUND for an unknown token
     */
    @Transactional
    public TokenRecord lockRecord(String tokenId) {
        if (tokenId == null || tokenId.isBlank()) {
            throw LedgerException.invalidArgument("Token id is required");
        }
        return tokenStore.lockToken(tokenId)
            .orElseThrow(() -> LedgerException.tokenNotFound(tokenId));
    }

    public LedgerFeatures getFeatures() {
        return features;
    }

    private TokenMetadata checkMetadata(TokenMetadata metadata) {
        if (!features.isMetadataEnabled()) {
            return null;
        }
        if (metadata == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_METADATA, "metadata is required");
        }
        metadata.validate();
        return metadata;
    }

    private Token toView(TokenRecord record) {
        BigInteger supply = balanceLedger.supplyOf(record.getTokenId()).orElse(BigInteger.ZERO);
        if (!features.isApprovalsEnabled()) {
            return new Token(record.getTokenId(), record.getOwnerId(), supply, record.getMetadata(), null, null);
        }
        return new Token(
            record.getTokenId(),
            record.getOwnerId(),
            supply,
            record.getMetadata(),
            approvalStore.findAll(record.getTokenId()),
            Long.toUnsignedString(record.getNextApprovalId())
        );
    }

    private byte[] metadataBytes(TokenMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsBytes(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize token metadata", e);
        }
    }
}
