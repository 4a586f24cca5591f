package io.walletstate.core.protocol;

import java.util.Objects;

/**
 * Cached ERC-20 allowance: {@code spender} may move up to {@code amount} of {@code token}
 * on behalf of {@code owner}. Valid while {@code now <= ts + ttl}.
 */
public final class Allowance {
    private final long ts;
    private final long ttl;
    private final String walletId;
    private final Blockchain blockchain;
    private final String token;
    private final String owner;
    private final String spender;
    private final String amount;

    public Allowance(long ts, long ttl, String walletId, Blockchain blockchain,
                     String token, String owner, String spender, String amount) {
        this.ts = ts;
        this.ttl = ttl;
        this.walletId = walletId == null ? "" : walletId;
        this.blockchain = Objects.requireNonNull(blockchain, "blockchain");
        this.token = token == null ? "" : token;
        this.owner = owner == null ? "" : owner;
        this.spender = spender == null ? "" : spender;
        this.amount = Amounts.normalize(amount == null ? "0" : amount);
        if (ts < 0) throw new IllegalArgumentException("ts must be >= 0");
        if (ttl < 0) throw new IllegalArgumentException("ttl must be >= 0");
    }

    public long ts() { return ts; }
    public long ttl() { return ttl; }
    public String walletId() { return walletId; }
    public Blockchain blockchain() { return blockchain; }
    public String token() { return token; }
    public String owner() { return owner; }
    public String spender() { return spender; }
    public String amount() { return amount; }

    /** Last millisecond at which the allowance is still valid. */
    public long expiresAt() {
        long end = ts + ttl;
        return end < ts ? Long.MAX_VALUE : end;
    }

    public boolean isExpired(long nowMillis) {
        return nowMillis > expiresAt();
    }

    public Allowance withTiming(long newTs, long newTtl) {
        return new Allowance(newTs, newTtl, walletId, blockchain, token, owner, spender, amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Allowance)) return false;
        Allowance a = (Allowance) o;
        return ts == a.ts && ttl == a.ttl
                && walletId.equals(a.walletId)
                && blockchain == a.blockchain
                && token.equals(a.token)
                && owner.equals(a.owner)
                && spender.equals(a.spender)
                && amount.equals(a.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ts, ttl, walletId, blockchain, token, owner, spender, amount);
    }

    @Override
    public String toString() {
        return "Allowance{" + blockchain + " token=" + token + " owner=" + owner
                + " spender=" + spender + " amount=" + amount + "}";
    }
}
