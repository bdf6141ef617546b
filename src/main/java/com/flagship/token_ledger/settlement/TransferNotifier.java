package com.flagship.token_ledger.settlement;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_ledger.ledger.Amounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Calls the receiver's hook and classifies its answer.
 *
 * Never throws for receiver faults: they become a FAILED or MALFORMED outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferNotifier {

    private static final Pattern DECIMAL = Pattern.compile("[0-9]+");

    private final ReceiverHookRegistry hookRegistry;
    private final ObjectMapper objectMapper;

    public NotificationOutcome notify(PendingTransfer transfer) {
        List<BigInteger> sent = transfer.amounts();

        Optional<ReceiverHook> hook = hookRegistry.find(transfer.getReceiverId());
        if (hook.isEmpty()) {
            log.warn("No receiver hook for {}, notification failed", transfer.getReceiverId());
            return NotificationOutcome.failed(sent, "no receiver hook registered");
        }

        String reply;
        try {
            reply = hook.get().onTransfer(TransferNotification.of(transfer));
        } catch (Exception e) {
            log.warn("Receiver hook of {} threw: {}", transfer.getReceiverId(), e.toString());
            return NotificationOutcome.failed(sent, "receiver hook threw: " + e.getMessage());
        }

        return parseReply(reply, sent);
    }

    NotificationOutcome parseReply(String reply, List<BigInteger> sent) {
        if (reply == null) {
            return NotificationOutcome.malformed(sent, "empty reply");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(reply);
        } catch (JsonProcessingException e) {
            return NotificationOutcome.malformed(sent, "reply is not JSON");
        }
        if (root == null || !root.isArray()) {
            return NotificationOutcome.malformed(sent, "reply is not a JSON array");
        }
        if (root.size() != sent.size()) {
            return NotificationOutcome.malformed(sent,
                "reply has " + root.size() + " entries for " + sent.size() + " tokens");
        }

        List<BigInteger> reported = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            BigInteger value = toAmount(entry);
            if (value == null) {
                return NotificationOutcome.malformed(sent, "reply entry is not an amount: " + entry);
            }
            reported.add(value);
        }
        return NotificationOutcome.replied(reported, sent);
    }

    private static BigInteger toAmount(JsonNode entry) {
        BigInteger value;
        if (entry.isTextual() && DECIMAL.matcher(entry.textValue()).matches()) {
            value = new BigInteger(entry.textValue());
        } else if (entry.isIntegralNumber()) {
            value = entry.bigIntegerValue();
        } else {
            return null;
        }
        return value.signum() < 0 || value.compareTo(Amounts.MAX) > 0 ? null : value;
    }
}
