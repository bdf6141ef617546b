package com.flagship.token_ledger.settlement;

import lombok.Value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What the receiver reported back, reduced to an unused amount per token.
 */
@Value
public class NotificationOutcome {

    public enum Kind {
        /**
         * No hook, or the hook threw. Every token counts as unused.
         */
        FAILED,
        /**
         * Well-formed reply. Unused amounts are the reported values, clamped to what was sent.
         */
        REPLIED,
        /**
         * The hook answered with something unreadable. Every token counts as used.
         */
        MALFORMED
    }

    Kind kind;
    List<BigInteger> unusedAmounts;
    String detail;

    public static NotificationOutcome failed(List<BigInteger> sentAmounts, String detail) {
        return new NotificationOutcome(Kind.FAILED, List.copyOf(sentAmounts), detail);
    }

    public static NotificationOutcome malformed(List<BigInteger> sentAmounts, String detail) {
        return new NotificationOutcome(
            Kind.MALFORMED, Collections.nCopies(sentAmounts.size(), BigInteger.ZERO), detail);
    }

    /**
     * @param reported one unused amount per token, each non-negative
     */
    public static NotificationOutcome replied(List<BigInteger> reported, List<BigInteger> sentAmounts) {
        if (reported.size() != sentAmounts.size()) {
            throw new IllegalArgumentException(
                "Reply has " + reported.size() + " entries for " + sentAmounts.size() + " tokens");
        }
        List<BigInteger> clamped = new ArrayList<>(reported.size());
        for (int i = 0; i < reported.size(); i++) {
            clamped.add(reported.get(i).min(sentAmounts.get(i)));
        }
        return new NotificationOutcome(Kind.REPLIED, List.copyOf(clamped), null);
    }
}
