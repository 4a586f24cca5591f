package io.walletstate.core.protocol;

import java.math.BigInteger;

/** Amounts travel as non-negative base-10 integer strings in the smallest unit. */
public final class Amounts {
    private Amounts() {}

    public static BigInteger parse(String amount) {
        if (amount == null || amount.isEmpty()) {
            throw new IllegalArgumentException("Missing amount");
        }
        for (int i = 0; i < amount.length(); i++) {
            char c = amount.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("Amount must be a non-negative integer: " + amount);
            }
        }
        return new BigInteger(amount);
    }

    /** Canonical form, so "007" and "7" compare equal once stored. */
    public static String normalize(String amount) {
        return parse(amount).toString();
    }
}
