package io.walletstate.core.index;

import io.walletstate.core.error.MalformedCursorException;
import io.walletstate.core.error.MalformedValueException;
import io.walletstate.core.protocol.Cursor;
import io.walletstate.core.protocol.RecordReader;
import io.walletstate.core.protocol.RecordWriter;

import java.util.Base64;

/**
 * Opaque pagination tokens: a {@link Cursor} record encoded as URL-safe Base64.
 * A token that cannot be decoded, or lacks its scope, position or issue time, is always an
 * error, never "start over".
 */
public final class CursorCodec {
    private CursorCodec(){}

    private static final int F_ADDRESS = 1;
    private static final int F_VALUE = 2;
    private static final int F_TS = 3;

    public static String encode(Cursor cursor) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(toBytes(cursor));
    }

    /** Binary record form, also used for stored remote sync cursors. */
    public static byte[] toBytes(Cursor cursor) {
        return new RecordWriter()
                .putString(F_ADDRESS, cursor.address())
                .putString(F_VALUE, cursor.value())
                .putLong(F_TS, cursor.ts())
                .toBytes();
    }

    /** Inverse of {@link #toBytes(Cursor)}; an empty value is allowed here. */
    public static Cursor fromBytes(byte[] bytes) {
        RecordReader r = RecordReader.parse(bytes, "Cursor");
        return new Cursor(r.getString(F_ADDRESS), r.getString(F_VALUE), r.getLong(F_TS));
    }

    public static Cursor decode(String token) {
        if (token == null || token.isEmpty()) {
            throw new MalformedCursorException("Empty cursor");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            throw new MalformedCursorException("Cursor is not valid base64", e);
        }
        try {
            RecordReader r = RecordReader.parse(raw, "Cursor");
            // a token cut at a field boundary still parses, so every field must be there
            if (!r.has(F_ADDRESS) || !r.has(F_VALUE) || !r.has(F_TS)) {
                throw new MalformedCursorException("Cursor is incomplete");
            }
            return new Cursor(r.getString(F_ADDRESS), r.getString(F_VALUE), r.getLong(F_TS));
        } catch (MalformedValueException e) {
            throw new MalformedCursorException("Corrupt cursor: " + e.getMessage(), e);
        }
    }
}
