package io.walletstate.core.protocol;

import io.walletstate.core.error.MalformedValueException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the format produced by {@link RecordWriter}. Unknown field numbers are skipped so
 * records written by a newer schema still load; absent fields read as zero/empty.
 */
public final class RecordReader {

    private final String type;
    private final Map<Integer, List<Object>> fields;

    private RecordReader(String type, Map<Integer, List<Object>> fields) {
        this.type = type;
        this.fields = fields;
    }

    /** @param type record name, used in error messages only */
    public static RecordReader parse(byte[] bytes, String type) {
        if (bytes == null) {
            throw new MalformedValueException("Malformed " + type + ": null bytes");
        }
        Map<Integer, List<Object>> out = new HashMap<>();
        try {
            ByteBuffer b = ByteBuffer.wrap(bytes);
            while (b.hasRemaining()) {
                int field = Short.toUnsignedInt(b.getShort());
                int wire = Byte.toUnsignedInt(b.get());
                Object value;
                switch (wire) {
                    case RecordWriter.WIRE_I64:
                        value = b.getLong();
                        break;
                    case RecordWriter.WIRE_I32:
                        value = b.getInt();
                        break;
                    case RecordWriter.WIRE_BYTES:
                        int len = b.getInt();
                        if (len < 0 || len > b.remaining()) {
                            throw new MalformedValueException("Malformed " + type + ": bad length " + len
                                    + " (remaining=" + b.remaining() + ")");
                        }
                        byte[] data = new byte[len];
                        b.get(data);
                        value = data;
                        break;
                    default:
                        throw new MalformedValueException("Malformed " + type + ": unknown wire type " + wire
                                + " for field " + field);
                }
                out.computeIfAbsent(field, k -> new ArrayList<>()).add(value);
            }
        } catch (BufferUnderflowException e) {
            throw new MalformedValueException("Malformed " + type + ": truncated", e);
        }
        return new RecordReader(type, out);
    }

    public long getLong(int field) {
        Object v = last(field);
        if (v == null) return 0L;
        if (v instanceof Long l) return l;
        throw wrongType(field);
    }

    public int getInt(int field) {
        Object v = last(field);
        if (v == null) return 0;
        if (v instanceof Integer i) return i;
        throw wrongType(field);
    }

    public String getString(int field) {
        byte[] b = getBytes(field);
        return new String(b, StandardCharsets.UTF_8);
    }

    public byte[] getBytes(int field) {
        Object v = last(field);
        if (v == null) return new byte[0];
        if (v instanceof byte[] bytes) return bytes.clone();
        throw wrongType(field);
    }

    /** All elements of a repeated nested record, in write order. */
    public List<RecordReader> getRecords(int field, String nestedType) {
        List<Object> values = fields.get(field);
        if (values == null) return Collections.emptyList();
        List<RecordReader> out = new ArrayList<>(values.size());
        for (Object v : values) {
            if (!(v instanceof byte[])) throw wrongType(field);
            out.add(parse((byte[]) v, nestedType));
        }
        return out;
    }

    /** Single nested record if present. */
    public RecordReader getRecord(int field, String nestedType) {
        Object v = last(field);
        if (v == null) return null;
        if (!(v instanceof byte[])) throw wrongType(field);
        return parse((byte[]) v, nestedType);
    }

    public boolean has(int field) {
        return fields.containsKey(field);
    }

    private Object last(int field) {
        List<Object> values = fields.get(field);
        return values == null ? null : values.get(values.size() - 1);
    }

    private MalformedValueException wrongType(int field) {
        return new MalformedValueException("Malformed " + type + ": unexpected wire type for field " + field);
    }
}
