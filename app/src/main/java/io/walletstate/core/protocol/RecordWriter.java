package io.walletstate.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Writes the tagged-field record format.
 *
 * Each field is {@code u16 field number, u8 wire type, payload}; payload is 8 bytes for
 * {@link #WIRE_I64}, 4 bytes for {@link #WIRE_I32} and {@code i32 length + bytes} for
 * {@link #WIRE_BYTES}. Zero numbers and empty strings are omitted, readers default them.
 * Repeated fields are written once per element under the same number.
 */
public final class RecordWriter {
    static final int WIRE_I64 = 0;
    static final int WIRE_I32 = 1;
    static final int WIRE_BYTES = 2;

    private ByteBuffer buf = ByteBuffer.allocate(128);

    public RecordWriter putLong(int field, long v) {
        if (v == 0L) return this;
        header(field, WIRE_I64, 8);
        buf.putLong(v);
        return this;
    }

    public RecordWriter putInt(int field, int v) {
        if (v == 0) return this;
        header(field, WIRE_I32, 4);
        buf.putInt(v);
        return this;
    }

    public RecordWriter putString(int field, String s) {
        if (s == null || s.isEmpty()) return this;
        return putBytesAlways(field, s.getBytes(StandardCharsets.UTF_8));
    }

    public RecordWriter putBytes(int field, byte[] b) {
        if (b == null || b.length == 0) return this;
        return putBytesAlways(field, b);
    }

    /** Nested record; written even when empty so repeated elements keep their count. */
    public RecordWriter putRecord(int field, RecordWriter nested) {
        return putBytesAlways(field, nested.toBytes());
    }

    public byte[] toBytes() {
        byte[] out = new byte[buf.position()];
        System.arraycopy(buf.array(), 0, out, 0, out.length);
        return out;
    }

    private RecordWriter putBytesAlways(int field, byte[] b) {
        header(field, WIRE_BYTES, 4 + b.length);
        buf.putInt(b.length);
        buf.put(b);
        return this;
    }

    private void header(int field, int wire, int payload) {
        if (field < 1 || field > 0xFFFF) {
            throw new IllegalArgumentException("field number out of range: " + field);
        }
        ensure(3 + payload);
        buf.putShort((short) field);
        buf.put((byte) wire);
    }

    private void ensure(int extra) {
        if (buf.remaining() >= extra) return;
        int size = Math.max(buf.capacity() * 2, buf.position() + extra);
        ByteBuffer bigger = ByteBuffer.allocate(size);
        buf.flip();
        bigger.put(buf);
        buf = bigger;
    }
}
