package io.walletstate.core.storage;

import io.walletstate.core.error.StorageException;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiPredicate;

/**
 * Simple, fast in-memory engine.
 * Good for tests and ephemeral profiles; not persistent, resets every process run.
 *
 * Keys are kept sorted by unsigned byte order so scans behave exactly like RocksDB.
 * Snapshots are copies of the map taken under the lock.
 */
public final class InMemoryKeyValueDB implements KeyValueDB {

    private final NavigableMap<byte[], byte[]> data = new TreeMap<>(Bytes.ORDER);
    private boolean closed;

    @Override
    public synchronized Optional<byte[]> get(byte[] key) {
        ensureOpen();
        if (key == null) return Optional.empty();
        byte[] value = data.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public synchronized void write(Batch batch) {
        ensureOpen();
        for (Batch.Op op : batch.ops()) {
            if (op.kind() == Batch.Kind.PUT) {
                data.put(op.key(), op.value());
            } else {
                data.remove(op.key());
            }
        }
    }

    @Override
    public synchronized ReadView snapshot() {
        ensureOpen();
        return new CopyView(new TreeMap<>(data));
    }

    /** Number of stored entries (debug/tests). */
    public synchronized int size() {
        return data.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        data.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("In-memory store is closed");
        }
    }

    private static final class CopyView implements ReadView {
        private final NavigableMap<byte[], byte[]> view;

        CopyView(NavigableMap<byte[], byte[]> view) {
            this.view = view;
        }

        @Override
        public Optional<byte[]> get(byte[] key) {
            byte[] value = view.get(key);
            return value == null ? Optional.empty() : Optional.of(value.clone());
        }

        @Override
        public void scan(byte[] prefix, byte[] start, BiPredicate<byte[], byte[]> visitor) {
            for (Map.Entry<byte[], byte[]> e : view.tailMap(start, true).entrySet()) {
                if (!Bytes.startsWith(e.getKey(), prefix)) {
                    if (Bytes.ORDER.compare(e.getKey(), prefix) > 0) break;
                    continue;
                }
                if (!visitor.test(e.getKey().clone(), e.getValue().clone())) break;
            }
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
