package io.walletstate.core.storage;

import java.util.Arrays;
import java.util.Comparator;

/** Byte helpers shared by the engines. */
public final class Bytes {
    private Bytes() {}

    /** Unsigned lexicographic order, the order both engines iterate in. */
    public static final Comparator<byte[]> ORDER = Arrays::compareUnsigned;

    public static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        return Arrays.equals(data, 0, prefix.length, prefix, 0, prefix.length);
    }
}
