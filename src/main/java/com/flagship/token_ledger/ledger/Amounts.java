package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.error.LedgerErrorCode;
import com.flagship.token_ledger.error.LedgerException;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Checked arithmetic over unsigned 128-bit amounts.
 *
 * Amounts are carried as {@link BigInteger} but are only valid in
 * {@code [0, 2^128 - 1]}. Nothing here wraps: leaving the range fails.
 */
public final class Amounts {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private Amounts() {
    }

    public static BigInteger requireValid(BigInteger amount, String label) {
        if (amount == null) {
            throw LedgerException.invalidArgument(label + " is required");
        }
        if (amount.signum() < 0 || amount.compareTo(MAX) > 0) {
            throw LedgerException.invalidArgument(label + " must be within the unsigned 128-bit range: " + amount);
        }
        return amount;
    }

    public static BigInteger requirePositive(BigInteger amount, String label) {
        requireValid(amount, label);
        if (amount.signum() == 0) {
            throw LedgerException.invalidArgument(label + " must be positive");
        }
        return amount;
    }

    public static BigInteger checkedAdd(BigInteger left, BigInteger right, String what) {
        BigInteger sum = left.add(right);
        if (sum.compareTo(MAX) > 0) {
            throw new LedgerException(LedgerErrorCode.OVERFLOW, what);
        }
        return sum;
    }

    public static BigInteger checkedSubtract(BigInteger left, BigInteger right, String what) {
        BigInteger difference = left.subtract(right);
        if (difference.signum() < 0) {
            throw new LedgerException(LedgerErrorCode.UNDERFLOW, what);
        }
        return difference;
    }

    static BigDecimal toColumn(BigInteger amount) {
        return new BigDecimal(amount);
    }

    static BigInteger fromColumn(BigDecimal value) {
        return value == null ? null : value.toBigIntegerExact();
    }
}
