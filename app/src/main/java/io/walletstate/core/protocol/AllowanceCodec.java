package io.walletstate.core.protocol;

import io.walletstate.core.error.MalformedValueException;

/**
 * Allowance: 1 ts, 2 ttl, 3 wallet_id, 4 blockchain, 5 token, 6 owner, 7 spender, 8 amount.
 */
public final class AllowanceCodec {
    private AllowanceCodec(){}

    public static byte[] toBytes(Allowance a) {
        return new RecordWriter()
                .putLong(1, a.ts())
                .putLong(2, a.ttl())
                .putString(3, a.walletId())
                .putInt(4, a.blockchain().code())
                .putString(5, a.token())
                .putString(6, a.owner())
                .putString(7, a.spender())
                .putString(8, a.amount())
                .toBytes();
    }

    public static Allowance fromBytes(byte[] bytes) {
        RecordReader r = RecordReader.parse(bytes, "Allowance");
        try {
            String amount = r.getString(8);
            return new Allowance(
                    r.getLong(1),
                    r.getLong(2),
                    r.getString(3),
                    Blockchain.fromCode(r.getInt(4)),
                    r.getString(5),
                    r.getString(6),
                    r.getString(7),
                    amount.isEmpty() ? "0" : amount);
        } catch (IllegalArgumentException ex) {
            throw new MalformedValueException("Malformed Allowance bytes", ex);
        }
    }
}
