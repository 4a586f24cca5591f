package io.walletstate.core.storage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of puts and deletes committed together by {@link KeyValueDB#write(Batch)}.
 * Later operations on the same key win.
 */
public final class Batch {

    public enum Kind { PUT, DELETE }

    public static final class Op {
        private final Kind kind;
        private final byte[] key;
        private final byte[] value;

        private Op(Kind kind, byte[] key, byte[] value) {
            this.kind = kind;
            this.key = key;
            this.value = value;
        }

        public Kind kind() { return kind; }
        public byte[] key() { return key.clone(); }
        /** Null for deletes. */
        public byte[] value() { return value == null ? null : value.clone(); }
    }

    private final List<Op> ops = new ArrayList<>();

    public Batch put(byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        ops.add(new Op(Kind.PUT, key.clone(), value.clone()));
        return this;
    }

    public Batch put(String key, byte[] value) {
        return put(key.getBytes(StandardCharsets.UTF_8), value);
    }

    public Batch put(String key, String value) {
        return put(key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
    }

    public Batch delete(byte[] key) {
        Objects.requireNonNull(key, "key");
        ops.add(new Op(Kind.DELETE, key.clone(), null));
        return this;
    }

    public Batch delete(String key) {
        return delete(key.getBytes(StandardCharsets.UTF_8));
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public int size() {
        return ops.size();
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }
}
