package io.walletstate.core.protocol;

import java.util.Objects;

/**
 * Continuation token payload: the scope it was issued for ({@code address}), an opaque
 * position and the moment it was issued.
 */
public record Cursor(String address, String value, long ts) {
    public Cursor {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(value, "value");
    }
}
