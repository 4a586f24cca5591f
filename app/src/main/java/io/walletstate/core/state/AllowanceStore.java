package io.walletstate.core.state;

import io.walletstate.core.config.StoreConfig;
import io.walletstate.core.error.MalformedValueException;
import io.walletstate.core.index.KeyCodec;
import io.walletstate.core.metrics.StoreMetrics;
import io.walletstate.core.protocol.Allowance;
import io.walletstate.core.protocol.AllowanceCodec;
import io.walletstate.core.protocol.Blockchain;
import io.walletstate.core.storage.Batch;
import io.walletstate.core.storage.KeyValueDB;
import io.walletstate.core.storage.ReadView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Short-lived cache of ERC-20 allowances. Entries expire at {@code ts + ttl}; expiry is checked
 * on read and expired entries are only physically removed by {@link #purge()}. Entries that no
 * longer decode are treated like expired ones.
 */
public final class AllowanceStore {
    private static final Logger LOG = Logger.getLogger(AllowanceStore.class.getName());
    static final String NAME = "allowances";

    private static final Pattern ETH_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private final KeyValueDB db;
    private final StoreConfig config;
    private final StoreMetrics metrics;
    private final Clock clock;

    public AllowanceStore(KeyValueDB db, StoreConfig config, StoreMetrics metrics, Clock clock) {
        this.db = db;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Caches the allowance. {@code ts = 0} stands for now, {@code ttl = 0} for the default TTL;
     * the TTL is capped at the configured maximum.
     *
     * @return false if the allowance was already expired and so not stored
     */
    public boolean upsert(Allowance allowance) {
        checkAddress("token", allowance.token());
        checkAddress("owner", allowance.owner());
        checkAddress("spender", allowance.spender());
        checkWallet(allowance.walletId());
        if (allowance.blockchain() == Blockchain.UNSPECIFIED) {
            throw new IllegalArgumentException("Missing blockchain");
        }

        long now = clock.millis();
        long ts = allowance.ts() == 0 ? now : allowance.ts();
        long ttl = allowance.ttl() == 0 ? config.defaultAllowanceTtl.toMillis() : allowance.ttl();
        ttl = Math.min(ttl, config.maxAllowanceTtl.toMillis());
        Allowance stored = allowance.withTiming(ts, ttl);
        if (stored.isExpired(now)) {
            metrics.noop(NAME);
            LOG.fine("Not caching expired " + stored);
            return false;
        }
        String key = key(stored.blockchain(), stored.token(), stored.owner(), stored.spender());
        db.write(new Batch().put(key, AllowanceCodec.toBytes(stored)));
        metrics.write(NAME);
        return true;
    }

    /** Live allowance, empty once expired even if still stored. */
    public Optional<Allowance> get(Blockchain blockchain, String token, String owner, String spender) {
        long now = clock.millis();
        return db.get(KeyCodec.bytes(key(blockchain, token, owner, spender)))
                .map(AllowanceCodec::fromBytes)
                .filter(a -> !a.isExpired(now));
    }

    /**
     * Live allowances, of one wallet or of all when {@code walletId} is null. Purges the store
     * when the listed scope holds more expired entries than live ones.
     */
    public List<Allowance> list(String walletId) {
        long now = clock.millis();
        List<Allowance> live = new ArrayList<>();
        int[] expired = {0};
        try (ReadView view = db.snapshot()) {
            view.scan(prefix(), (k, v) -> {
                Allowance a = decode(k, v);
                if (a == null) {
                    if (walletId == null) expired[0]++;
                } else if (walletId == null || walletId.equals(a.walletId())) {
                    if (a.isExpired(now)) {
                        expired[0]++;
                    } else {
                        live.add(a);
                    }
                }
                return true;
            });
        }
        if (expired[0] > live.size()) {
            purge();
        }
        return live;
    }

    /**
     * Deletes the wallet's allowances, only those of {@code blockchain} if given and only those
     * stored before {@code minTs} if given.
     *
     * @return number of entries deleted
     */
    public int remove(String walletId, Blockchain blockchain, Long minTs) {
        checkWallet(walletId);
        Batch batch = new Batch();
        try (ReadView view = db.snapshot()) {
            view.scan(prefix(), (k, v) -> {
                Allowance a = decode(k, v);
                if (a != null && walletId.equals(a.walletId())
                        && (blockchain == null || a.blockchain() == blockchain)
                        && (minTs == null || a.ts() < minTs)) {
                    batch.delete(k);
                }
                return true;
            });
        }
        if (!batch.isEmpty()) {
            db.write(batch);
            metrics.write(NAME);
        }
        return batch.size();
    }

    /** Physically deletes expired and undecodable entries. */
    public int purge() {
        long now = clock.millis();
        Batch batch = new Batch();
        try (ReadView view = db.snapshot()) {
            view.scan(prefix(), (k, v) -> {
                Allowance a = decode(k, v);
                if (a == null || a.isExpired(now)) batch.delete(k);
                return true;
            });
        }
        if (!batch.isEmpty()) {
            db.write(batch);
            metrics.purged(NAME, batch.size());
            LOG.info("Purged " + batch.size() + " allowances");
        }
        return batch.size();
    }

    /** Null for an entry that cannot be decoded; {@link #purge()} removes those. */
    private static Allowance decode(byte[] key, byte[] value) {
        try {
            return AllowanceCodec.fromBytes(value);
        } catch (MalformedValueException e) {
            LOG.warning("Undecodable allowance " + KeyCodec.printable(KeyCodec.string(key)) + ": " + e.getMessage());
            return null;
        }
    }

    private static String key(Blockchain blockchain, String token, String owner, String spender) {
        return KeyCodec.allowanceKey(blockchain, token, owner, spender);
    }

    private static byte[] prefix() {
        return KeyCodec.bytes(KeyCodec.prefix(KeyCodec.ALLOWANCE));
    }

    private static void checkAddress(String field, String value) {
        if (value == null || !ETH_ADDRESS.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + field + " address: " + value);
        }
    }

    private static void checkWallet(String walletId) {
        try {
            UUID.fromString(walletId);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid wallet id: " + walletId, e);
        }
    }
}
