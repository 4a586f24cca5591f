package io.walletstate.core.storage;

import io.walletstate.core.error.StorageException;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent engine using RocksDB, one database per wallet profile directory.
 *
 * Layout: a single default column family; the keyspace is partitioned by the string prefixes
 * produced by {@code KeyCodec}. Batches map 1:1 onto a RocksDB {@link WriteBatch}.
 */
public final class RocksKeyValueDB implements KeyValueDB {
    private static final Logger LOG = Logger.getLogger(RocksKeyValueDB.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final Options options;
    private final boolean syncWrites;
    private final String dataDir;

    private RocksKeyValueDB(RocksDB db, Options options, boolean syncWrites, String dataDir) {
        this.db = db;
        this.options = options;
        this.syncWrites = syncWrites;
        this.dataDir = dataDir;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksKeyValueDB open(String dataDir, boolean syncWrites) {
        Options opts = new Options().setCreateIfMissing(true);
        try {
            RocksDB db = RocksDB.open(opts, dataDir);
            LOG.info("Opened RocksDB state store at " + dataDir);
            return new RocksKeyValueDB(db, opts, syncWrites, dataDir);
        } catch (RocksDBException e) {
            opts.close();
            throw new StorageException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        if (key == null) return Optional.empty();
        try {
            return Optional.ofNullable(db.get(key));
        } catch (RocksDBException e) {
            throw new StorageException("get failed", e);
        }
    }

    @Override
    public void write(Batch batch) {
        if (batch.isEmpty()) return;
        try (WriteOptions wo = new WriteOptions().setSync(syncWrites);
             WriteBatch wb = new WriteBatch()) {
            for (Batch.Op op : batch.ops()) {
                if (op.kind() == Batch.Kind.PUT) {
                    wb.put(op.key(), op.value());
                } else {
                    wb.delete(op.key());
                }
            }
            db.write(wo, wb);
        } catch (RocksDBException e) {
            throw new StorageException("write of " + batch.size() + " operations failed", e);
        }
    }

    @Override
    public ReadView snapshot() {
        Snapshot snapshot = db.getSnapshot();
        ReadOptions readOptions = new ReadOptions().setSnapshot(snapshot);
        return new SnapshotView(snapshot, readOptions);
    }

    @Override
    public void close() {
        // Close DB first, then options
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "Failed to close RocksDB at " + dataDir, e);
        } finally {
            options.close();
        }
        LOG.info("Closed RocksDB state store at " + dataDir);
    }

    private final class SnapshotView implements ReadView {
        private final Snapshot snapshot;
        private final ReadOptions readOptions;

        SnapshotView(Snapshot snapshot, ReadOptions readOptions) {
            this.snapshot = snapshot;
            this.readOptions = readOptions;
        }

        @Override
        public Optional<byte[]> get(byte[] key) {
            try {
                return Optional.ofNullable(db.get(readOptions, key));
            } catch (RocksDBException e) {
                throw new StorageException("snapshot get failed", e);
            }
        }

        @Override
        public void scan(byte[] prefix, byte[] start, BiPredicate<byte[], byte[]> visitor) {
            try (RocksIterator it = db.newIterator(readOptions)) {
                for (it.seek(start); it.isValid(); it.next()) {
                    byte[] key = it.key();
                    if (!Bytes.startsWith(key, prefix)) {
                        if (Bytes.ORDER.compare(key, prefix) > 0) break;
                        continue;
                    }
                    if (!visitor.test(key, it.value())) break;
                }
                it.status();
            } catch (RocksDBException e) {
                throw new StorageException("scan failed", e);
            }
        }

        @Override
        public void close() {
            readOptions.close();
            db.releaseSnapshot(snapshot);
        }
    }
}
