package io.walletstate.core.state;

import io.walletstate.core.protocol.Blockchain;
import io.walletstate.core.protocol.Change;
import io.walletstate.core.protocol.Transaction;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Criteria for {@link TransactionStore#count(TransactionFilter)}. Every criterion left unset
 * matches everything; set criteria must all hold.
 *
 * Time bounds are inclusive and checked against the since and confirm timestamps, ignoring
 * unset ones: {@code after} holds when either is {@code >= after}, {@code before} when either
 * is {@code <= before}.
 */
public final class TransactionFilter {
    private final Set<Blockchain> blockchains;
    private final String walletId;
    private final Integer entryId;
    private final Set<String> addresses;
    private final Long after;
    private final Long before;

    private TransactionFilter(Builder b) {
        this.blockchains = b.blockchains.isEmpty()
                ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(b.blockchains));
        this.walletId = b.walletId;
        this.entryId = b.entryId;
        this.addresses = Collections.unmodifiableSet(new LinkedHashSet<>(b.addresses));
        this.after = b.after;
        this.before = b.before;
        if (entryId != null && walletId == null) {
            throw new IllegalArgumentException("entryId requires walletId");
        }
    }

    public static Builder builder() { return new Builder(); }

    /** Matches every transaction. */
    public static TransactionFilter any() { return new Builder().build(); }

    public static final class Builder {
        private final Set<Blockchain> blockchains = new LinkedHashSet<>();
        private String walletId;
        private Integer entryId;
        private final Set<String> addresses = new LinkedHashSet<>();
        private Long after;
        private Long before;

        public Builder blockchain(Blockchain b) { this.blockchains.add(b); return this; }
        public Builder wallet(String walletId) { this.walletId = walletId; this.entryId = null; return this; }
        public Builder walletEntry(String walletId, int entryId) { this.walletId = walletId; this.entryId = entryId; return this; }
        public Builder address(String address) { this.addresses.add(address); return this; }
        public Builder after(long ts) { this.after = ts; return this; }
        public Builder before(long ts) { this.before = ts; return this; }

        public TransactionFilter build() { return new TransactionFilter(this); }
    }

    public boolean matches(Transaction tx) {
        if (!blockchains.isEmpty() && !blockchains.contains(tx.blockchain())) {
            return false;
        }
        if (after != null && !inWindow(tx, after, Long.MAX_VALUE)) {
            return false;
        }
        if (before != null && !inWindow(tx, 0L, before)) {
            return false;
        }
        if (walletId != null) {
            boolean found = false;
            for (Change c : tx.changes()) {
                if (c.walletId().equals(walletId) && (entryId == null || c.entryId() == entryId)) {
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        if (!addresses.isEmpty()) {
            for (Change c : tx.changes()) {
                if (addresses.contains(c.address())) return true;
            }
            return false;
        }
        return true;
    }

    private static boolean inWindow(Transaction tx, long from, long to) {
        long since = tx.sinceTimestamp();
        long confirm = tx.confirmTimestamp();
        return (since != 0 && since >= from && since <= to)
                || (confirm != 0 && confirm >= from && confirm <= to);
    }
}
