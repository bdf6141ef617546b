package com.flagship.token_ledger.settlement;

import com.flagship.token_ledger.config.JacksonConfig;
import com.flagship.token_ledger.ledger.Amounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransferNotifierTest {

    private static final List<BigInteger> SENT = List.of(BigInteger.valueOf(100), BigInteger.valueOf(7));

    private ReceiverHookRegistry hookRegistry;
    private TransferNotifier notifier;

    @BeforeEach
    void setUp() {
        hookRegistry = new ReceiverHookRegistry();
        notifier = new TransferNotifier(hookRegistry, JacksonConfig.createObjectMapper());
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("Numbers and digit strings are both accepted")
    void numbersAndStrings() {
        NotificationOutcome outcome = notifier.parseReply("[\"30\", 2]", SENT);

        assertEquals(NotificationOutcome.Kind.REPLIED, outcome.getKind());
        assertEquals(List.of(amount(30), amount(2)), outcome.getUnusedAmounts());
    }

    @Test
    @DisplayName("Values above the sent amount are clamped")
    void clamped() {
        NotificationOutcome outcome = notifier.parseReply("[1000, \"8\"]", SENT);

        assertEquals(List.of(amount(100), amount(7)), outcome.getUnusedAmounts());
    }

    @Test
    @DisplayName("Wrong shapes are malformed and count as fully used")
    void malformedShapes() {
        for (String reply : List.of("{}", "\"30\"", "[1]", "[1, 2, 3]", "[-1, 0]", "[\"1.5\", 0]",
                "[1.5, 0]", "[null, 0]", "[\"-3\", 0]", "[\"0x10\", 0]", "garbage")) {
            NotificationOutcome outcome = notifier.parseReply(reply, SENT);

            assertEquals(NotificationOutcome.Kind.MALFORMED, outcome.getKind(), reply);
            assertEquals(List.of(BigInteger.ZERO, BigInteger.ZERO), outcome.getUnusedAmounts(), reply);
        }
    }

    @Test
    @DisplayName("Values beyond the amount range are malformed")
    void beyondRange() {
        String tooLarge = Amounts.MAX.add(BigInteger.ONE).toString();

        NotificationOutcome outcome = notifier.parseReply("[\"" + tooLarge + "\", 0]", SENT);

        assertEquals(NotificationOutcome.Kind.MALFORMED, outcome.getKind());
    }

    @Test
    @DisplayName("A null reply is malformed")
    void nullReply() {
        assertEquals(NotificationOutcome.Kind.MALFORMED, notifier.parseReply(null, SENT).getKind());
    }

    @Test
    @DisplayName("Missing hook fails and reports everything unused")
    void missingHook() {
        PendingTransfer transfer = PendingTransfer.start("alice", "bob",
            List.of(TransferLeg.sent("1", "alice", amount(100), Map.of())), null, "hi");

        NotificationOutcome outcome = notifier.notify(transfer);

        assertEquals(NotificationOutcome.Kind.FAILED, outcome.getKind());
        assertEquals(List.of(amount(100)), outcome.getUnusedAmounts());
    }

    @Test
    @DisplayName("Registered hook is called and its reply parsed")
    void registeredHook() {
        hookRegistry.register("bob", notification -> "[\"" + notification.getAmounts().get(0) + "\"]");
        PendingTransfer transfer = PendingTransfer.start("alice", "bob",
            List.of(TransferLeg.sent("1", "alice", amount(12), Map.of())), null, "hi");

        NotificationOutcome outcome = notifier.notify(transfer);

        assertEquals(NotificationOutcome.Kind.REPLIED, outcome.getKind());
        assertEquals(List.of(amount(12)), outcome.getUnusedAmounts());
    }
}
