package com.flagship.token_ledger.token;

import com.flagship.token_ledger.call.CallContext;
import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;
import com.flagship.token_ledger.event.LedgerEvent;
import com.flagship.token_ledger.event.StorageRefundIssuedEvent;
import com.flagship.token_ledger.event.TokenMintedEvent;
import com.flagship.token_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static com.flagship.token_ledger.support.LedgerFixture.LEDGER_OWNER;
import static com.flagship.token_ledger.support.LedgerFixture.as;
import static com.flagship.token_ledger.support.LedgerFixture.metadata;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

class TokenRegistryTest {

    private static final String HASH_32 = "47DEQpj8HBSa+/TImW+5JCeuQeRkm5NMpJWZG3hSuFU="; // SHA-256 of ""

    private LedgerFixture fixture;
    private TokenRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
        registry = fixture.tokenRegistry;
    }

    private List<LedgerEvent> savedEvents() {
        ArgumentCaptor<LedgerEvent> captor = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(fixture.outboxService, atLeastOnce()).saveEvent(captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("Mint allocates increasing ids starting at 1 and credits the owner")
    void mintAllocatesIds() {
        Token first = registry.mint(as(LEDGER_OWNER), "alice", BigInteger.valueOf(1000), metadata("gold"), null);
        Token second = registry.mint(as(LEDGER_OWNER), "alice", BigInteger.valueOf(5), metadata("silver"), null);

        assertEquals("1", first.getTokenId());
        assertEquals("2", second.getTokenId());
        assertEquals("alice", first.getOwnerId());
        assertEquals(BigInteger.valueOf(1000), fixture.balance("1", "alice"));
        assertEquals(BigInteger.valueOf(1000), first.getSupply());
        assertEquals("gold", first.getMetadata().getTitle());
        assertEquals("0", first.getNextApprovalId());
        assertTrue(first.getApprovals().isEmpty());
    }

    @Test
    @DisplayName("Supply after mint equals the initial amount, not a sentinel")
    void supplyEqualsInitialAmount() {
        String tokenId = fixture.mint("alice", 1000);

        assertEquals(BigInteger.valueOf(1000), fixture.supply(tokenId));
        assertEquals(fixture.supply(tokenId), fixture.balanceLedger.registeredTotal(tokenId));
    }

    @Test
    @DisplayName("Mint without an initial amount registers the owner with zero")
    void mintWithoutAmount() {
        Token token = registry.mint(as(LEDGER_OWNER), "alice", null, metadata("empty"), null);

        assertEquals(BigInteger.ZERO, fixture.balance(token.getTokenId(), "alice"));
        assertEquals(BigInteger.ZERO, token.getSupply());
    }

    @Test
    @DisplayName("Mint emits a TokenMinted event")
    void mintEmitsEvent() {
        String tokenId = fixture.mint("alice", 10);

        TokenMintedEvent event = (TokenMintedEvent) savedEvents().stream()
            .filter(e -> e instanceof TokenMintedEvent)
            .findFirst()
            .orElseThrow();
        assertEquals(tokenId, event.getTokenId());
        assertEquals("alice", event.getOwnerId());
        assertEquals(BigInteger.TEN, event.getAmount());
    }

    @Test
    @DisplayName("Only the ledger owner may mint")
    void onlyOwnerMints() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(as("mallory"), "mallory", BigInteger.TEN, metadata("x"), null));

        assertEquals(LedgerErrorCode.UNAUTHORIZED, exception.getErrorCode());
        assertEquals(Optional.empty(), registry.token("1"));
    }

    @Test
    @DisplayName("Metadata is required while the metadata extension is enabled")
    void metadataRequired() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(as(LEDGER_OWNER), "alice", BigInteger.TEN, null, null));

        assertEquals(LedgerErrorCode.INVALID_METADATA, exception.getErrorCode());
    }

    @Test
    @DisplayName("A media hash without media is rejected")
    void unpairedHashRejected() {
        TokenMetadata metadata = TokenMetadata.builder().title("x").mediaHash(HASH_32).build();

        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(as(LEDGER_OWNER), "alice", BigInteger.TEN, metadata, null));

        assertEquals(LedgerErrorCode.INVALID_METADATA, exception.getErrorCode());
    }

    @Test
    @DisplayName("Hashes must decode to 32 bytes")
    void shortHashRejected() {
        TokenMetadata metadata = TokenMetadata.builder().title("x").reference("ipfs://x").referenceHash("AAAA").build();

        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(as(LEDGER_OWNER), "alice", BigInteger.TEN, metadata, null));

        assertEquals(LedgerErrorCode.INVALID_METADATA, exception.getErrorCode());
    }

    @Test
    @DisplayName("Paired media and hash are accepted and stored")
    void pairedMediaAccepted() {
        TokenMetadata metadata = TokenMetadata.builder().title("x").media("https://m").mediaHash(HASH_32).build();

        Token token = registry.mint(as(LEDGER_OWNER), "alice", BigInteger.TEN, metadata, null);

        assertEquals("https://m", token.getMetadata().getMedia());
    }

    @Test
    @DisplayName("Metadata and approvals are absent when the extensions are disabled")
    void extensionsDisabled() {
        LedgerFixture plain = new LedgerFixture(new LedgerFeatures(false, false));

        Token token = plain.tokenRegistry.mint(as(LEDGER_OWNER), "alice", BigInteger.TEN, metadata("ignored"), null);

        assertNull(token.getMetadata());
        assertNull(token.getApprovals());
        assertNull(token.getNextApprovalId());
    }

    @Test
    @DisplayName("The last id of the 64-bit space can be allocated once, then minting fails")
    void idSpaceExhaustion() {
        fixture.store.setLastTokenId(-2L);

        Token last = registry.mint(as(LEDGER_OWNER), "alice", BigInteger.ONE, metadata("last"), null);
        assertEquals("18446744073709551615", last.getTokenId());

        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(as(LEDGER_OWNER), "alice", BigInteger.ONE, metadata("overflow"), null));
        assertEquals(LedgerErrorCode.ID_SPACE_EXHAUSTED, exception.getErrorCode());
    }

    @Test
    @DisplayName("Storage is charged against the attached payment and the excess refunded")
    void storageRefund() {
        BigInteger attached = LedgerFixture.BYTE_COST.multiply(BigInteger.valueOf(1000));

        Token token = registry.mint(CallContext.of(LEDGER_OWNER, attached), "alice", BigInteger.TEN,
            metadata("paid"), "payer");

        StorageRefundIssuedEvent refund = (StorageRefundIssuedEvent) savedEvents().stream()
            .filter(e -> e instanceof StorageRefundIssuedEvent)
            .findFirst()
            .orElseThrow();
        assertEquals(token.getTokenId(), refund.getTokenId());
        assertEquals("payer", refund.getRecipientId());
        assertTrue(refund.getStorageBytes() > 0);
        assertEquals(LedgerFixture.BYTE_COST.multiply(BigInteger.valueOf(refund.getStorageBytes())), refund.getStorageCost());
        assertEquals(attached.subtract(refund.getStorageCost()), refund.getRefund());
    }

    @Test
    @DisplayName("Mint fails when the attached payment does not cover storage")
    void storageNotCovered() {
        LedgerException exception = assertThrows(LedgerException.class,
            () -> registry.mint(CallContext.of(LEDGER_OWNER, BigInteger.ONE), "alice", BigInteger.TEN,
                metadata("cheap"), "payer"));

        assertEquals(LedgerErrorCode.PRECHECK_FAILED, exception.getErrorCode());
    }

    @Test
    @DisplayName("Token views report unknown ids as empty")
    void tokensView() {
        String tokenId = fixture.mint("alice", 3);

        List<Optional<Token>> tokens = registry.tokens(List.of(tokenId, "77"));

        assertTrue(tokens.get(0).isPresent());
        assertTrue(tokens.get(1).isEmpty());
    }
}
