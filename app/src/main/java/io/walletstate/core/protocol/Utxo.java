package io.walletstate.core.protocol;

import java.util.Objects;

/**
 * Unspent output composing a bitcoin balance. Amount in satoshi, limited to
 * {@link Long#MAX_VALUE} (far above the total bitcoin supply); vout likewise to
 * {@link Integer#MAX_VALUE}.
 */
public record Utxo(String txid, int vout, long amount) {
    public Utxo {
        Objects.requireNonNull(txid, "txid");
        if (vout < 0) throw new IllegalArgumentException("vout must be >= 0");
        if (amount < 0) throw new IllegalArgumentException("utxo amount must be >= 0");
    }
}
