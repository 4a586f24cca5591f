package io.walletstate.core.state;

import io.walletstate.core.config.StoreConfig;
import io.walletstate.core.error.ConsistencyViolationException;
import io.walletstate.core.error.InvalidTransitionException;
import io.walletstate.core.error.MalformedCursorException;
import io.walletstate.core.error.NotFoundException;
import io.walletstate.core.error.StaleCursorException;
import io.walletstate.core.error.VersionConflictException;
import io.walletstate.core.index.CursorCodec;
import io.walletstate.core.index.KeyCodec;
import io.walletstate.core.metrics.StoreMetrics;
import io.walletstate.core.protocol.Blockchain;
import io.walletstate.core.protocol.BlockRef;
import io.walletstate.core.protocol.Change;
import io.walletstate.core.protocol.Cursor;
import io.walletstate.core.protocol.State;
import io.walletstate.core.protocol.Transaction;
import io.walletstate.core.protocol.TransactionCodec;
import io.walletstate.core.protocol.TransactionMeta;
import io.walletstate.core.storage.Batch;
import io.walletstate.core.storage.KeyValueDB;
import io.walletstate.core.storage.ReadView;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Wallet transactions with their secondary indices.
 *
 * Every write commits the primary record and all index changes as one {@link Batch}; the
 * read-check-write of a record runs under a lock striped by its primary key. Listings read
 * through one engine snapshot and fail with {@link ConsistencyViolationException} rather than
 * skip an index entry whose record is missing.
 */
public final class TransactionStore {
    private static final Logger LOG = Logger.getLogger(TransactionStore.class.getName());
    static final String NAME = "transactions";

    private final KeyValueDB db;
    private final StoreConfig config;
    private final StoreMetrics metrics;
    private final Clock clock;
    private final long schemaEpoch;
    private final KeyLocks locks;

    public TransactionStore(KeyValueDB db, StoreConfig config, StoreMetrics metrics, Clock clock, long schemaEpoch) {
        this.db = db;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.schemaEpoch = schemaEpoch;
        this.locks = new KeyLocks(config.lockStripes);
    }

    // -------------------- writes --------------------

    /**
     * Creates a record at version 0. Any initial state is accepted since received transactions
     * are first seen already submitted or confirmed.
     *
     * @throws VersionConflictException if the transaction is already stored (expected version -1)
     */
    public Transaction insert(Transaction tx) {
        tx.basicValidate();
        checkBlock(tx);
        String pk = KeyCodec.primaryKey(tx.blockchain(), tx.txId());
        return locks.withLock(pk, () -> {
            Optional<Transaction> stored = read(pk);
            if (stored.isPresent()) {
                metrics.versionConflict(NAME);
                throw new VersionConflictException(KeyCodec.printable(pk), -1, stored.get().version());
            }
            return doInsert(pk, tx);
        });
    }

    /**
     * Replaces the stored record if its version is {@code expectedVersion}; the new record gets
     * {@code expectedVersion + 1}. Stale index entries are removed in the same batch.
     */
    public Transaction upsert(Transaction tx, long expectedVersion) {
        tx.basicValidate();
        String pk = KeyCodec.primaryKey(tx.blockchain(), tx.txId());
        return locks.withLock(pk, () -> {
            Transaction stored = read(pk).orElseThrow(() ->
                    new NotFoundException("No transaction " + tx.blockchain() + "/" + tx.txId()));
            if (stored.version() != expectedVersion) {
                metrics.versionConflict(NAME);
                throw new VersionConflictException(KeyCodec.printable(pk), expectedVersion, stored.version());
            }
            checkTransition(stored, tx);
            return doReplace(pk, stored, tx);
        });
    }

    /**
     * Sync-feed entry point: inserts an unknown transaction, otherwise merges the observation
     * into the stored one (see {@link TransactionMerge}) and writes it as the next version.
     * An observation that changes nothing is not written.
     */
    public Transaction record(Transaction observation) {
        observation.basicValidate();
        String pk = KeyCodec.primaryKey(observation.blockchain(), observation.txId());
        return locks.withLock(pk, () -> {
            Optional<Transaction> stored = read(pk);
            if (stored.isEmpty()) {
                checkBlock(observation);
                return doInsert(pk, observation);
            }
            Transaction current = stored.get();
            Transaction merged = TransactionMerge.merge(current, observation);
            if (merged.equals(current)) {
                metrics.noop(NAME);
                return current;
            }
            checkTransition(current, merged);
            return doReplace(pk, current, merged);
        });
    }

    /**
     * Reorg handling: every transaction of {@code blockchain} recorded in a block at or above
     * {@code height} loses its block and confirm timestamp. CONFIRMED ones go back to SUBMITTED.
     * One batch for all.
     *
     * @return number of transactions changed
     */
    public int invalidateFrom(Blockchain blockchain, long height) {
        List<String> candidates = new ArrayList<>();
        try (ReadView view = db.snapshot()) {
            view.scan(bytes(KeyCodec.heightPrefix(blockchain)), bytes(KeyCodec.heightStart(blockchain, height)),
                    (k, v) -> {
                        candidates.add(KeyCodec.string(v));
                        return true;
                    });
        }
        if (candidates.isEmpty()) {
            return 0;
        }
        return locks.withLocks(candidates, () -> {
            Batch batch = new Batch();
            int changed = 0;
            for (String pk : new LinkedHashSet<>(candidates)) {
                Optional<Transaction> stored = read(pk);
                if (stored.isEmpty()) continue;
                Transaction tx = stored.get();
                Optional<BlockRef> block = tx.block();
                if (block.isEmpty() || block.get().height() < height) continue;
                if (tx.state() == State.UNKNOWN) {
                    LOG.warning("Left " + tx + " in its block, state is not known to this schema");
                    continue;
                }
                Transaction.Builder next = tx.toBuilder()
                        .block(null)
                        .blockPos(0)
                        .confirmTimestamp(0)
                        .version(tx.version() + 1);
                if (tx.state() == State.CONFIRMED) {
                    next.state(State.SUBMITTED);
                }
                Transaction reverted = next.build();
                reindex(batch, pk, tx, reverted);
                batch.put(pk, TransactionCodec.toBytes(reverted));
                changed++;
            }
            if (changed > 0) {
                db.write(batch);
                metrics.write(NAME);
            }
            LOG.info("Invalidated " + changed + " " + blockchain + " transactions from height " + height);
            return changed;
        });
    }

    /** Removes the transaction, its index entries and its metadata. */
    public boolean forget(Blockchain blockchain, String txId) {
        String pk = KeyCodec.primaryKey(blockchain, txId);
        return locks.withLock(pk, () -> {
            Optional<Transaction> stored = read(pk);
            Batch batch = new Batch();
            stored.ifPresent(tx -> {
                for (String k : indexKeys(tx)) {
                    batch.delete(k);
                }
            });
            batch.delete(pk);
            batch.delete(KeyCodec.metaKey(blockchain, txId));
            db.write(batch);
            metrics.write(NAME);
            LOG.fine("Forgot " + blockchain + "/" + txId);
            return stored.isPresent();
        });
    }

    // -------------------- reads --------------------

    public Optional<Transaction> getByTxId(Blockchain blockchain, String txId) {
        return read(KeyCodec.primaryKey(blockchain, txId));
    }

    /** Wallet history in (entry id, blockchain, tx id) order, one item per wallet entry involved. */
    public Page<Transaction> listByWallet(String walletId, String cursor, int pageSize) {
        return listIndex("wallet", KeyCodec.walletPrefix(walletId), cursor, pageSize);
    }

    public Page<Transaction> listByWalletEntry(String walletId, int entryId, String cursor, int pageSize) {
        return listIndex("wallet", KeyCodec.walletEntryPrefix(walletId, entryId), cursor, pageSize);
    }

    /** Address history, oldest first. */
    public Page<Transaction> listByAddress(String address, String cursor, int pageSize) {
        return listIndex("address", KeyCodec.addressPrefix(address), cursor, pageSize);
    }

    /**
     * Transactions first seen or confirmed at or after {@code timestamp}, ascending by the
     * earliest qualifying timestamp, each once.
     */
    public List<Transaction> listSince(long timestamp) {
        return metrics.recordScan(NAME, "time", () -> collect(
                bytes(KeyCodec.prefix(KeyCodec.IDX_TIME)), bytes(KeyCodec.timeStart(timestamp))));
    }

    /** Transactions recorded in a block at or above {@code fromHeight}, ascending by height. */
    public List<Transaction> listByHeight(Blockchain blockchain, long fromHeight) {
        return metrics.recordScan(NAME, "height", () -> collect(
                bytes(KeyCodec.heightPrefix(blockchain)), bytes(KeyCodec.heightStart(blockchain, fromHeight))));
    }

    public long count(TransactionFilter filter) {
        return metrics.recordScan(NAME, "primary", () -> {
            long[] n = {0};
            try (ReadView view = db.snapshot()) {
                view.scan(bytes(KeyCodec.prefix(KeyCodec.TX)), (k, v) -> {
                    if (filter.matches(TransactionCodec.fromBytes(v))) n[0]++;
                    return true;
                });
            }
            return n[0];
        });
    }

    // -------------------- metadata & remote cursors --------------------

    public Optional<TransactionMeta> getMeta(Blockchain blockchain, String txId) {
        return db.get(bytes(KeyCodec.metaKey(blockchain, txId))).map(TransactionCodec::metaFromBytes);
    }

    /**
     * Stores the metadata unless the stored copy is at least as recent.
     *
     * @return the metadata now in effect
     */
    public TransactionMeta setMeta(TransactionMeta meta) {
        if (meta.txId().isEmpty()) throw new IllegalArgumentException("Missing txId");
        if (meta.blockchain() == Blockchain.UNSPECIFIED) throw new IllegalArgumentException("Missing blockchain");
        String key = KeyCodec.metaKey(meta.blockchain(), meta.txId());
        return locks.withLock(key, () -> {
            Optional<TransactionMeta> existing = getMeta(meta.blockchain(), meta.txId());
            if (existing.isPresent() && existing.get().timestamp() >= meta.timestamp()) {
                metrics.noop(NAME);
                return existing.get();
            }
            db.write(new Batch().put(key, TransactionCodec.metaToBytes(meta)));
            metrics.write(NAME);
            return meta;
        });
    }

    /** Upstream sync position for an address; a stored empty value reads as absent. */
    public Optional<Cursor> getRemoteCursor(String address) {
        return db.get(bytes(KeyCodec.remoteCursorKey(address)))
                .map(CursorCodec::fromBytes)
                .filter(c -> !c.value().isEmpty());
    }

    public void setRemoteCursor(String address, String value) {
        if (address == null || address.isBlank()) throw new IllegalArgumentException("Missing address");
        Cursor cursor = new Cursor(address, value == null ? "" : value, clock.millis());
        db.write(new Batch().put(KeyCodec.remoteCursorKey(address), CursorCodec.toBytes(cursor)));
        metrics.write(NAME);
    }

    // -------------------- consistency --------------------

    /**
     * Cross-checks all index entries against primary records.
     *
     * @return number of index entries checked
     * @throws ConsistencyViolationException on the first mismatch found
     */
    public long verifyIndexes() {
        long[] checked = {0};
        try (ReadView view = db.snapshot()) {
            for (String space : KeyCodec.TX_INDEXES) {
                view.scan(bytes(KeyCodec.prefix(space)), (k, v) -> {
                    String key = KeyCodec.string(k);
                    Transaction tx = resolve(view, key, KeyCodec.string(v));
                    // entries of a chain this build does not know can only be checked for a target
                    if (tx.blockchain() != Blockchain.UNSPECIFIED) {
                        KeyCodec.TxKey target = KeyCodec.parseIndexTarget(key);
                        String pk = KeyCodec.primaryKey(target.blockchain(), target.txId());
                        if (!pk.equals(KeyCodec.string(v))) {
                            throw new ConsistencyViolationException("Index entry " + KeyCodec.printable(key)
                                    + " points to " + KeyCodec.printable(KeyCodec.string(v)));
                        }
                        if (!indexKeys(tx).contains(key)) {
                            throw new ConsistencyViolationException("Stale index entry " + KeyCodec.printable(key));
                        }
                    }
                    checked[0]++;
                    return true;
                });
            }
            view.scan(bytes(KeyCodec.prefix(KeyCodec.TX)), (k, v) -> {
                Transaction tx = TransactionCodec.fromBytes(v);
                if (tx.blockchain() == Blockchain.UNSPECIFIED) return true;
                for (String key : indexKeys(tx)) {
                    if (view.get(bytes(key)).isEmpty()) {
                        throw new ConsistencyViolationException("Missing index entry " + KeyCodec.printable(key));
                    }
                }
                return true;
            });
        }
        return checked[0];
    }

    /**
     * Drops every index entry (including ones written by older layouts) and rebuilds them from
     * the primary records into {@code batch}. Entries of transactions on a chain this build does
     * not know are kept as they are, their keys cannot be derived here.
     *
     * @return number of transactions indexed
     */
    static int rebuildIndexes(ReadView view, Batch batch) {
        Set<String> foreign = new HashSet<>();
        Map<String, String> entries = new LinkedHashMap<>();
        int[] n = {0};
        view.scan(bytes(KeyCodec.prefix(KeyCodec.TX)), (k, v) -> {
            Transaction tx = TransactionCodec.fromBytes(v);
            String pk = KeyCodec.string(k);
            if (tx.blockchain() == Blockchain.UNSPECIFIED) {
                foreign.add(pk);
            } else {
                for (String key : indexKeys(tx)) {
                    entries.put(key, pk);
                }
                n[0]++;
            }
            return true;
        });
        view.scan(bytes("idx"), (k, v) -> {
            if (!foreign.contains(KeyCodec.string(v))) batch.delete(k);
            return true;
        });
        entries.forEach(batch::put);
        if (!foreign.isEmpty()) {
            LOG.warning("Kept index entries of " + foreign.size() + " transactions on unknown chains");
        }
        return n[0];
    }

    /** Every index key a transaction must have. */
    static Set<String> indexKeys(Transaction tx) {
        Set<String> keys = new LinkedHashSet<>();
        Blockchain bc = tx.blockchain();
        String txId = tx.txId();
        long ts = tx.orderingTimestamp();
        for (Change c : tx.changes()) {
            if (c.hasWallet()) {
                keys.add(KeyCodec.walletIndexKey(c.walletId(), c.entryId(), bc, txId));
            }
            if (!c.address().isEmpty()) {
                keys.add(KeyCodec.addressIndexKey(c.address(), ts, bc, txId));
            }
        }
        tx.block().ifPresent(b -> keys.add(KeyCodec.heightIndexKey(bc, b.height(), txId)));
        if (tx.sinceTimestamp() > 0) {
            keys.add(KeyCodec.timeIndexKey(tx.sinceTimestamp(), bc, txId));
        }
        if (tx.confirmTimestamp() > 0) {
            keys.add(KeyCodec.timeIndexKey(tx.confirmTimestamp(), bc, txId));
        }
        return keys;
    }

    // -------------------- internals --------------------

    private Transaction doInsert(String pk, Transaction tx) {
        Transaction created = tx.withVersion(0);
        Batch batch = new Batch();
        for (String k : indexKeys(created)) {
            batch.put(k, pk);
        }
        batch.put(pk, TransactionCodec.toBytes(created));
        db.write(batch);
        metrics.write(NAME);
        LOG.fine("Inserted " + created);
        return created;
    }

    private Transaction doReplace(String pk, Transaction stored, Transaction tx) {
        Transaction next = tx.withVersion(stored.version() + 1);
        Batch batch = new Batch();
        reindex(batch, pk, stored, next);
        batch.put(pk, TransactionCodec.toBytes(next));
        db.write(batch);
        metrics.write(NAME);
        LOG.fine("Updated " + next);
        return next;
    }

    private static void reindex(Batch batch, String pk, Transaction stored, Transaction next) {
        Set<String> oldKeys = indexKeys(stored);
        Set<String> newKeys = indexKeys(next);
        for (String k : oldKeys) {
            if (!newKeys.contains(k)) batch.delete(k);
        }
        for (String k : newKeys) {
            if (!oldKeys.contains(k)) batch.put(k, pk);
        }
    }

    private void checkBlock(Transaction tx) {
        try {
            Lifecycle.checkBlock(tx);
        } catch (InvalidTransitionException e) {
            rejected(tx, e);
            throw e;
        }
    }

    private void checkTransition(Transaction stored, Transaction next) {
        try {
            Lifecycle.checkTransition(stored, next);
        } catch (InvalidTransitionException e) {
            rejected(next, e);
            throw e;
        }
    }

    private void rejected(Transaction tx, InvalidTransitionException e) {
        metrics.rejectedTransition(NAME);
        LOG.warning("Rejected " + tx.blockchain() + "/" + tx.txId() + ": " + e.getMessage());
    }

    private Optional<Transaction> read(String pk) {
        return db.get(bytes(pk)).map(TransactionCodec::fromBytes);
    }

    private List<Transaction> collect(byte[] prefix, byte[] start) {
        Set<String> seen = new LinkedHashSet<>();
        List<Transaction> out = new ArrayList<>();
        try (ReadView view = db.snapshot()) {
            view.scan(prefix, start, (k, v) -> {
                String pk = KeyCodec.string(v);
                if (seen.add(pk)) {
                    out.add(resolve(view, KeyCodec.string(k), pk));
                }
                return true;
            });
        }
        return out;
    }

    private Page<Transaction> listIndex(String index, String prefix, String token, int pageSize) {
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1");
        int limit = Math.min(pageSize, config.maxPageSize);
        String scope = KeyCodec.printable(prefix);
        String after = token == null ? null : resume(token, scope, prefix);
        byte[] start = bytes(after == null ? prefix : after);

        return metrics.recordScan(NAME, index, () -> {
            List<Transaction> items = new ArrayList<>();
            String[] last = {null};
            boolean[] more = {false};
            try (ReadView view = db.snapshot()) {
                view.scan(bytes(prefix), start, (k, v) -> {
                    String key = KeyCodec.string(k);
                    if (key.equals(after)) return true;
                    if (items.size() == limit) {
                        more[0] = true;
                        return false;
                    }
                    items.add(resolve(view, key, KeyCodec.string(v)));
                    last[0] = key;
                    return true;
                });
            }
            String next = more[0] ? CursorCodec.encode(new Cursor(scope, last[0], clock.millis())) : null;
            return new Page<>(items, next);
        });
    }

    /** Validates a continuation token and returns the index key to resume after. */
    private String resume(String token, String scope, String prefix) {
        Cursor cursor = CursorCodec.decode(token);
        if (!cursor.address().equals(scope) || !cursor.value().startsWith(prefix)) {
            throw new MalformedCursorException("Cursor was issued for another listing");
        }
        long horizon = Math.max(schemaEpoch, clock.millis() - config.cursorMaxAge.toMillis());
        if (cursor.ts() < horizon) {
            throw new StaleCursorException("Cursor from " + cursor.ts() + " predates " + horizon);
        }
        return cursor.value();
    }

    private static Transaction resolve(ReadView view, String indexKey, String pk) {
        return view.get(bytes(pk)).map(TransactionCodec::fromBytes).orElseThrow(() ->
                new ConsistencyViolationException("Index entry " + KeyCodec.printable(indexKey)
                        + " has no transaction " + KeyCodec.printable(pk)));
    }

    private static byte[] bytes(String key) {
        return KeyCodec.bytes(key);
    }
}
