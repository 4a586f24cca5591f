package io.walletstate.core.protocol;

import java.util.Objects;

/** Block a transaction was seen in. */
public record BlockRef(long height, String blockId, long timestamp) {
    public BlockRef {
        Objects.requireNonNull(blockId, "blockId");
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (blockId.isBlank()) throw new IllegalArgumentException("Missing block id");
    }
}
