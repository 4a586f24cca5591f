package io.walletstate.core.storage;

import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Point-in-time view of a {@link KeyValueDB}. Close it to release the engine snapshot.
 */
public interface ReadView extends AutoCloseable {

    Optional<byte[]> get(byte[] key);

    /**
     * Visit entries whose key starts with {@code prefix}, in ascending key order, beginning at
     * the first key {@code >= start}. Stops when the visitor returns false.
     */
    void scan(byte[] prefix, byte[] start, BiPredicate<byte[], byte[]> visitor);

    default void scan(byte[] prefix, BiPredicate<byte[], byte[]> visitor) {
        scan(prefix, prefix, visitor);
    }

    @Override void close();
}
