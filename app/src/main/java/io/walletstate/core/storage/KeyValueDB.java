package io.walletstate.core.storage;

import java.io.Closeable;
import java.util.Optional;

/**
 * Minimal ordered key-value API so we can swap implementations (RocksDB, in-memory, etc.).
 * Keys/values are raw bytes compared as unsigned bytes; callers handle encoding.
 *
 * Every mutation goes through {@link #write(Batch)}, which applies all operations of the batch
 * atomically or none of them.
 */
public interface KeyValueDB extends Closeable {

    /** Point read against the latest committed state. */
    Optional<byte[]> get(byte[] key);

    /** Apply the batch as one atomic unit. Empty batches are a no-op. */
    void write(Batch batch);

    /** Consistent read view; multi-key reads through it never observe a half-applied batch. */
    ReadView snapshot();

    @Override void close();
}
