package io.walletstate.core.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * User annotation of a transaction. Lives beside the transaction, not inside it, so labels
 * never bump the transaction version.
 */
public final class TransactionMeta {
    private final long timestamp;
    private final Blockchain blockchain;
    private final String txId;
    private final String label;
    private final byte[] raw;

    public TransactionMeta(long timestamp, Blockchain blockchain, String txId, String label, byte[] raw) {
        this.timestamp = timestamp;
        this.blockchain = Objects.requireNonNull(blockchain, "blockchain");
        this.txId = txId == null ? "" : txId;
        this.label = label == null ? "" : label;
        this.raw = raw == null ? new byte[0] : raw.clone();
    }

    public long timestamp() { return timestamp; }
    public Blockchain blockchain() { return blockchain; }
    public String txId() { return txId; }
    public String label() { return label; }
    public byte[] raw() { return raw.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionMeta)) return false;
        TransactionMeta m = (TransactionMeta) o;
        return timestamp == m.timestamp
                && blockchain == m.blockchain
                && txId.equals(m.txId)
                && label.equals(m.label)
                && Arrays.equals(raw, m.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, blockchain, txId, label, Arrays.hashCode(raw));
    }
}
