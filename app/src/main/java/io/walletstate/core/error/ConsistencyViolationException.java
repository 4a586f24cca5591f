package io.walletstate.core.error;

/**
 * Stored data contradicts itself (index without primary record, UTXO sum mismatch, ...).
 * Never repaired automatically.
 */
public class ConsistencyViolationException extends StateException {

    public ConsistencyViolationException(String message) {
        super(message);
    }
}
