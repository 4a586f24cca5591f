package io.walletstate.core.index;

import io.walletstate.core.error.MalformedKeyException;
import io.walletstate.core.protocol.Blockchain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composite, order-preserving keys for primary records and secondary indices.
 *
 * Layout (components joined by {@link #SEP}):
 * <pre>
 *  tx          / blockchain / txId                              -> Transaction
 *  txmeta      / blockchain / txId                              -> TransactionMeta
 *  idx:wallet  / walletId / entryId / blockchain / txId         -> primary key
 *  idx:addr    / address / ts / blockchain / txId               -> primary key
 *  idx:height  / blockchain / height / txId                     -> primary key
 *  idx:time    / ts / blockchain / txId                         -> primary key
 *  balance     / address / blockchain / asset                   -> Balance
 *  allowance   / blockchain / token / owner / spender           -> Allowance
 *  cursor      / address                                        -> Cursor
 * </pre>
 * Numbers are fixed-width zero-padded decimals so byte order equals numeric order.
 * Inside a component {@code \u0000} becomes {@code \u0001\u0001} and {@code \u0001}
 * becomes {@code \u0001\u0002}; the separator sorts below every escaped byte, so a component
 * that is a prefix of another sorts first and no two logical keys collide.
 */
public final class KeyCodec {
    private KeyCodec(){}

    public static final char SEP = '\u0000';
    private static final char ESC = '\u0001';

    public static final String TX = "tx";
    public static final String TX_META = "txmeta";
    public static final String IDX_WALLET = "idx:wallet";
    public static final String IDX_ADDRESS = "idx:addr";
    public static final String IDX_HEIGHT = "idx:height";
    public static final String IDX_TIME = "idx:time";
    public static final String BALANCE = "balance";
    public static final String ALLOWANCE = "allowance";
    public static final String REMOTE_CURSOR = "cursor";
    public static final String VERSION = "version";
    public static final String SCHEMA_EPOCH = "schema_epoch";

    /** All index keyspaces maintained for transactions. */
    public static final List<String> TX_INDEXES = List.of(IDX_WALLET, IDX_ADDRESS, IDX_HEIGHT, IDX_TIME);

    // -------------------- builders --------------------

    public static String primaryKey(Blockchain blockchain, String txId) {
        return join(TX, chain(blockchain), txId);
    }

    public static String metaKey(Blockchain blockchain, String txId) {
        return join(TX_META, chain(blockchain), txId);
    }

    public static String walletIndexKey(String walletId, int entryId, Blockchain blockchain, String txId) {
        return join(IDX_WALLET, walletId, u32(entryId), chain(blockchain), txId);
    }

    public static String addressIndexKey(String address, long ts, Blockchain blockchain, String txId) {
        return join(IDX_ADDRESS, address, u64(ts), chain(blockchain), txId);
    }

    public static String heightIndexKey(Blockchain blockchain, long height, String txId) {
        return join(IDX_HEIGHT, chain(blockchain), u64(height), txId);
    }

    public static String timeIndexKey(long ts, Blockchain blockchain, String txId) {
        return join(IDX_TIME, u64(ts), chain(blockchain), txId);
    }

    public static String balanceKey(String address, Blockchain blockchain, String asset) {
        return join(BALANCE, address, chain(blockchain), asset);
    }

    /** Token, owner and spender are hex addresses and compared case-insensitively. */
    public static String allowanceKey(Blockchain blockchain, String token, String owner, String spender) {
        return join(ALLOWANCE, chain(blockchain), lower(token), lower(owner), lower(spender));
    }

    public static String remoteCursorKey(String address) {
        return join(REMOTE_CURSOR, address);
    }

    // -------------------- scan prefixes --------------------

    /** Prefix covering every key whose leading components equal {@code components}. */
    public static String prefix(String... components) {
        return join(components) + SEP;
    }

    public static String walletPrefix(String walletId) {
        return prefix(IDX_WALLET, walletId);
    }

    public static String walletEntryPrefix(String walletId, int entryId) {
        return prefix(IDX_WALLET, walletId, u32(entryId));
    }

    public static String addressPrefix(String address) {
        return prefix(IDX_ADDRESS, address);
    }

    public static String heightPrefix(Blockchain blockchain) {
        return prefix(IDX_HEIGHT, chain(blockchain));
    }

    public static String heightStart(Blockchain blockchain, long fromHeight) {
        return join(IDX_HEIGHT, chain(blockchain), u64(fromHeight));
    }

    public static String timeStart(long fromTs) {
        return join(IDX_TIME, u64(fromTs));
    }

    public static String balancePrefix(String address) {
        return prefix(BALANCE, address);
    }

    // -------------------- parsers --------------------

    public static TxKey parsePrimaryKey(String key) {
        List<String> p = split(key, TX, 3);
        return new TxKey(parseChain(p.get(1), key), p.get(2));
    }

    public static WalletIndexKey parseWalletIndexKey(String key) {
        List<String> p = split(key, IDX_WALLET, 5);
        return new WalletIndexKey(p.get(1), (int) parseNumber(p.get(2), 10, key),
                new TxKey(parseChain(p.get(3), key), p.get(4)));
    }

    public static AddressIndexKey parseAddressIndexKey(String key) {
        List<String> p = split(key, IDX_ADDRESS, 5);
        return new AddressIndexKey(p.get(1), parseNumber(p.get(2), 20, key),
                new TxKey(parseChain(p.get(3), key), p.get(4)));
    }

    public static HeightIndexKey parseHeightIndexKey(String key) {
        List<String> p = split(key, IDX_HEIGHT, 4);
        Blockchain blockchain = parseChain(p.get(1), key);
        return new HeightIndexKey(parseNumber(p.get(2), 20, key), new TxKey(blockchain, p.get(3)));
    }

    public static TimeIndexKey parseTimeIndexKey(String key) {
        List<String> p = split(key, IDX_TIME, 4);
        return new TimeIndexKey(parseNumber(p.get(1), 20, key), new TxKey(parseChain(p.get(2), key), p.get(3)));
    }

    public static AllowanceKey parseAllowanceKey(String key) {
        List<String> p = split(key, ALLOWANCE, 5);
        return new AllowanceKey(parseChain(p.get(1), key), p.get(2), p.get(3), p.get(4));
    }

    /** Transaction referenced by any transaction index key. */
    public static TxKey parseIndexTarget(String key) {
        String space = keyspace(key);
        switch (space) {
            case IDX_WALLET: return parseWalletIndexKey(key).tx();
            case IDX_ADDRESS: return parseAddressIndexKey(key).tx();
            case IDX_HEIGHT: return parseHeightIndexKey(key).tx();
            case IDX_TIME: return parseTimeIndexKey(key).tx();
            default: throw new MalformedKeyException("Not a transaction index key: " + printable(key));
        }
    }

    /** First component of a key, unescaped. */
    public static String keyspace(String key) {
        int i = key.indexOf(SEP);
        return unescape(i < 0 ? key : key.substring(0, i), key);
    }

    // -------------------- bytes --------------------

    public static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }

    public static String string(byte[] key) {
        return new String(key, StandardCharsets.UTF_8);
    }

    /** Key with separators made visible, for logs and error messages. */
    public static String printable(String key) {
        return key.replace(SEP, '/').replace(ESC, '\\');
    }

    // -------------------- parsed forms --------------------

    public record TxKey(Blockchain blockchain, String txId) {}

    public record WalletIndexKey(String walletId, int entryId, TxKey tx) {}

    public record AddressIndexKey(String address, long ts, TxKey tx) {}

    public record HeightIndexKey(long height, TxKey tx) {}

    public record TimeIndexKey(long ts, TxKey tx) {}

    public record AllowanceKey(Blockchain blockchain, String token, String owner, String spender) {}

    // -------------------- helpers --------------------

    static String join(String... components) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) sb.append(SEP);
            sb.append(escape(components[i]));
        }
        return sb.toString();
    }

    static String escape(String component) {
        if (component == null) {
            throw new IllegalArgumentException("key component must not be null");
        }
        if (component.indexOf(SEP) < 0 && component.indexOf(ESC) < 0) {
            return component;
        }
        StringBuilder sb = new StringBuilder(component.length() + 4);
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (c == SEP) {
                sb.append(ESC).append(ESC);
            } else if (c == ESC) {
                sb.append(ESC).append('\u0002');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String unescape(String raw, String key) {
        if (raw.indexOf(ESC) < 0) return raw;
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != ESC) {
                sb.append(c);
                continue;
            }
            if (i + 1 >= raw.length()) {
                throw new MalformedKeyException("Dangling escape in key " + printable(key));
            }
            char next = raw.charAt(++i);
            if (next == ESC) {
                sb.append(SEP);
            } else if (next == '\u0002') {
                sb.append(ESC);
            } else {
                throw new MalformedKeyException("Bad escape in key " + printable(key));
            }
        }
        return sb.toString();
    }

    private static List<String> split(String key, String expectedSpace, int parts) {
        if (key == null) {
            throw new MalformedKeyException("null key");
        }
        List<String> out = new ArrayList<>(parts);
        int start = 0;
        for (int i = 0; i <= key.length(); i++) {
            if (i == key.length() || key.charAt(i) == SEP) {
                out.add(unescape(key.substring(start, i), key));
                start = i + 1;
            }
        }
        if (out.size() != parts || !out.get(0).equals(expectedSpace)) {
            throw new MalformedKeyException("Expected " + parts + "-part " + expectedSpace + " key, got "
                    + printable(key));
        }
        return out;
    }

    private static String chain(Blockchain blockchain) {
        if (blockchain == null) {
            throw new IllegalArgumentException("blockchain must not be null");
        }
        return u32(blockchain.code());
    }

    private static Blockchain parseChain(String raw, String key) {
        int code = (int) parseNumber(raw, 10, key);
        Blockchain b = Blockchain.fromCode(code);
        if (b == Blockchain.UNSPECIFIED) {
            throw new MalformedKeyException("Unknown blockchain " + code + " in key " + printable(key));
        }
        return b;
    }

    private static String u32(int v) {
        if (v < 0) throw new IllegalArgumentException("negative key number: " + v);
        return pad(Integer.toString(v), 10);
    }

    private static String u64(long v) {
        if (v < 0) throw new IllegalArgumentException("negative key number: " + v);
        return pad(Long.toString(v), 20);
    }

    private static String pad(String digits, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int i = digits.length(); i < width; i++) sb.append('0');
        return sb.append(digits).toString();
    }

    private static long parseNumber(String raw, int width, String key) {
        if (raw.length() != width) {
            throw new MalformedKeyException("Expected " + width + " digits in key " + printable(key));
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedKeyException("Non-digit number in key " + printable(key));
            }
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new MalformedKeyException("Number out of range in key " + printable(key));
        }
    }

    private static String lower(String address) {
        return address == null ? null : address.toLowerCase(Locale.ROOT);
    }
}
