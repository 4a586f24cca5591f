package io.walletstate.core.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Wallet-tracked transaction as persisted by the transaction store.
 * Identity is (blockchain, txId); {@link #version()} is owned by the store.
 */
public final class Transaction {

    private final Blockchain blockchain;
    private final String txId;
    private final Boolean own;
    private final long sinceTimestamp;
    private final long syncTimestamp;
    private final long confirmTimestamp;
    private final State state;
    private final BlockRef block;
    private final int blockPos;
    private final Status status;
    private final List<Change> changes;
    private final long version;

    private Transaction(Builder b) {
        this.blockchain = b.blockchain == null ? Blockchain.UNSPECIFIED : b.blockchain;
        this.txId = b.txId;
        this.own = b.own;
        this.sinceTimestamp = b.sinceTimestamp;
        this.syncTimestamp = b.syncTimestamp;
        this.confirmTimestamp = b.confirmTimestamp;
        this.state = b.state == null ? State.PREPARED : b.state;
        this.block = b.block;
        this.blockPos = b.blockPos;
        this.status = b.status == null ? Status.UNKNOWN : b.status;
        this.changes = Collections.unmodifiableList(new ArrayList<>(b.changes));
        this.version = b.version;
        checkFields();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .blockchain(blockchain)
                .txId(txId)
                .own(own)
                .sinceTimestamp(sinceTimestamp)
                .syncTimestamp(syncTimestamp)
                .confirmTimestamp(confirmTimestamp)
                .state(state)
                .block(block)
                .blockPos(blockPos)
                .status(status)
                .changes(changes)
                .version(version);
    }

    public static final class Builder {
        private Blockchain blockchain;
        private String txId;
        private Boolean own;
        private long sinceTimestamp;
        private long syncTimestamp;
        private long confirmTimestamp;
        private State state;
        private BlockRef block;
        private int blockPos;
        private Status status;
        private final List<Change> changes = new ArrayList<>();
        private long version;

        public Builder blockchain(Blockchain v) { this.blockchain = v; return this; }
        public Builder txId(String v) { this.txId = v; return this; }
        public Builder own(Boolean v) { this.own = v; return this; }
        public Builder sinceTimestamp(long v) { this.sinceTimestamp = v; return this; }
        public Builder syncTimestamp(long v) { this.syncTimestamp = v; return this; }
        public Builder confirmTimestamp(long v) { this.confirmTimestamp = v; return this; }
        public Builder state(State v) { this.state = v; return this; }
        public Builder block(BlockRef v) { this.block = v; return this; }
        public Builder blockPos(int v) { this.blockPos = v; return this; }
        public Builder status(Status v) { this.status = v; return this; }
        public Builder version(long v) { this.version = v; return this; }

        public Builder changes(List<Change> v) {
            this.changes.clear();
            if (v != null) this.changes.addAll(v);
            return this;
        }

        public Builder addChange(Change c) {
            this.changes.add(Objects.requireNonNull(c, "change"));
            return this;
        }

        public Transaction build() { return new Transaction(this); }
    }

    // -------------------- getters --------------------
    public Blockchain blockchain() { return blockchain; }
    public String txId() { return txId; }
    public long sinceTimestamp() { return sinceTimestamp; }
    public long syncTimestamp() { return syncTimestamp; }
    public long confirmTimestamp() { return confirmTimestamp; }
    public State state() { return state; }
    public Optional<BlockRef> block() { return Optional.ofNullable(block); }
    public int blockPos() { return blockPos; }
    public Status status() { return status; }
    public List<Change> changes() { return changes; }
    public long version() { return version; }

    /** Explicit flag if one was recorded. */
    public Optional<Boolean> ownFlag() { return Optional.ofNullable(own); }

    /** Explicit flag, otherwise true when any change spends from the wallet. */
    public boolean isOwn() {
        if (own != null) return own;
        for (Change c : changes) {
            if (c.direction() == Direction.SEND) return true;
        }
        return false;
    }

    /**
     * Timestamp the transaction is ordered by in address history: first seen, else confirmed,
     * else last synced.
     */
    public long orderingTimestamp() {
        if (sinceTimestamp > 0) return sinceTimestamp;
        if (confirmTimestamp > 0) return confirmTimestamp;
        return syncTimestamp;
    }

    public Transaction withVersion(long v) {
        return toBuilder().version(v).build();
    }

    /**
     * Checks what a write needs on top of what every instance satisfies. Records read back with
     * a chain code this build does not know carry {@link Blockchain#UNSPECIFIED} and fail here.
     */
    public void basicValidate() {
        if (blockchain == Blockchain.UNSPECIFIED) throw new IllegalArgumentException("Missing blockchain");
        checkFields();
    }

    private void checkFields() {
        if (txId == null || txId.isBlank()) throw new IllegalArgumentException("Missing txId");
        if (sinceTimestamp < 0 || syncTimestamp < 0 || confirmTimestamp < 0) {
            throw new IllegalArgumentException("timestamps must be >= 0");
        }
        if (blockPos < 0) throw new IllegalArgumentException("blockPos must be >= 0");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction t = (Transaction) o;
        return sinceTimestamp == t.sinceTimestamp
                && syncTimestamp == t.syncTimestamp
                && confirmTimestamp == t.confirmTimestamp
                && blockPos == t.blockPos
                && version == t.version
                && blockchain == t.blockchain
                && txId.equals(t.txId)
                && Objects.equals(own, t.own)
                && state == t.state
                && Objects.equals(block, t.block)
                && status == t.status
                && changes.equals(t.changes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(blockchain, txId, state, block, version);
    }

    @Override
    public String toString() {
        return "Transaction{" + blockchain + "/" + txId + " " + state
                + (block != null ? " @" + block.height() : "") + " v" + version + "}";
    }
}
