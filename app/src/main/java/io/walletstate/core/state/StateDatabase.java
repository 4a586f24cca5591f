package io.walletstate.core.state;

import io.walletstate.core.config.StoreConfig;
import io.walletstate.core.error.StateException;
import io.walletstate.core.index.KeyCodec;
import io.walletstate.core.metrics.StoreMetrics;
import io.walletstate.core.storage.Batch;
import io.walletstate.core.storage.InMemoryKeyValueDB;
import io.walletstate.core.storage.KeyValueDB;
import io.walletstate.core.storage.ReadView;
import io.walletstate.core.storage.RocksKeyValueDB;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One wallet state database: the engine handle shared by the stores plus schema versioning.
 *
 * On construction the stored schema version is checked. A store without a version, or with an
 * older one, is migrated: balances (a refreshable cache) are dropped and every transaction
 * index is rebuilt from the primary records, all in one batch together with the new version
 * and a new schema epoch. Cursors issued before the epoch are stale.
 */
public final class StateDatabase implements Closeable {
    private static final Logger LOG = Logger.getLogger(StateDatabase.class.getName());

    public static final int CURRENT_VERSION = 1;

    private final KeyValueDB db;
    private final StoreConfig config;
    private final StoreMetrics metrics;
    private final long schemaEpoch;
    private final TransactionStore transactions;
    private final BalanceStore balances;
    private final AllowanceStore allowances;

    public StateDatabase(KeyValueDB db, StoreConfig config, StoreMetrics metrics, Clock clock) {
        this.db = db;
        this.config = config;
        this.metrics = metrics;
        this.schemaEpoch = migrate(db, clock);
        this.transactions = new TransactionStore(db, config, metrics, clock, schemaEpoch);
        this.balances = new BalanceStore(db, config, metrics);
        this.allowances = new AllowanceStore(db, config, metrics, clock);
    }

    /** Opens (creating if needed) a RocksDB-backed database in {@code dir}. */
    public static StateDatabase open(Path dir, StoreConfig config) {
        KeyValueDB db = RocksKeyValueDB.open(dir.toString(), config.syncWrites);
        try {
            return new StateDatabase(db, config, StoreMetrics.simple(), Clock.systemUTC());
        } catch (RuntimeException e) {
            db.close();
            throw e;
        }
    }

    /** Non-persistent database for tests and throwaway profiles. */
    public static StateDatabase inMemory(StoreConfig config) {
        return new StateDatabase(new InMemoryKeyValueDB(), config, StoreMetrics.simple(), Clock.systemUTC());
    }

    public TransactionStore transactions() { return transactions; }
    public BalanceStore balances() { return balances; }
    public AllowanceStore allowances() { return allowances; }
    public StoreConfig config() { return config; }
    public StoreMetrics metrics() { return metrics; }

    /** Millis at which the current schema generation started. */
    public long schemaEpoch() { return schemaEpoch; }

    /** Schema version as stored, empty when none is recorded or it cannot be read. */
    public static Optional<Integer> storedVersion(KeyValueDB db) {
        return readNumber(db, KeyCodec.VERSION).map(Long::intValue);
    }

    @Override
    public void close() {
        db.close();
    }

    private static long migrate(KeyValueDB db, Clock clock) {
        Optional<Integer> version = storedVersion(db);
        if (version.isPresent() && version.get() > CURRENT_VERSION) {
            throw new StateException("Schema version " + version.get() + " is newer than supported "
                    + CURRENT_VERSION);
        }
        if (version.isPresent() && version.get() == CURRENT_VERSION) {
            Optional<Long> epoch = readNumber(db, KeyCodec.SCHEMA_EPOCH);
            if (epoch.isPresent()) {
                return epoch.get();
            }
        }

        long epoch = clock.millis();
        Batch batch = new Batch();
        int reindexed;
        try (ReadView view = db.snapshot()) {
            view.scan(KeyCodec.bytes(KeyCodec.prefix(KeyCodec.BALANCE)), (k, v) -> {
                batch.delete(k);
                return true;
            });
            reindexed = TransactionStore.rebuildIndexes(view, batch);
        }
        batch.put(KeyCodec.VERSION, Integer.toString(CURRENT_VERSION));
        batch.put(KeyCodec.SCHEMA_EPOCH, Long.toString(epoch));
        db.write(batch);
        LOG.info("Migrated schema " + version.map(String::valueOf).orElse("none") + " -> " + CURRENT_VERSION
                + ", reindexed " + reindexed + " transactions");
        return epoch;
    }

    private static Optional<Long> readNumber(KeyValueDB db, String key) {
        Optional<byte[]> raw = db.get(KeyCodec.bytes(key));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        String text = new String(raw.get(), StandardCharsets.UTF_8);
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            LOG.warning("Unreadable " + key + " value '" + text + "', treating as absent");
            return Optional.empty();
        }
    }
}
