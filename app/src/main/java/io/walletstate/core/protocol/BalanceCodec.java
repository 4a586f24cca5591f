package io.walletstate.core.protocol;

import io.walletstate.core.error.MalformedValueException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Balance: 1 address, 2 ts, 3 blockchain, 4 asset, 5 amount, 6 utxo.
 * Utxo: 1 txid, 2 vout, 3 amount.
 */
public final class BalanceCodec {
    private BalanceCodec(){}

    public static byte[] toBytes(Balance balance) {
        RecordWriter w = new RecordWriter()
                .putString(1, balance.address())
                .putLong(2, balance.timestamp())
                .putInt(3, balance.blockchain().code())
                .putString(4, balance.asset())
                .putString(5, balance.amount().toString());
        for (Utxo u : balance.utxo()) {
            w.putRecord(6, new RecordWriter()
                    .putString(1, u.txid())
                    .putInt(2, u.vout())
                    .putLong(3, u.amount()));
        }
        return w.toBytes();
    }

    public static Balance fromBytes(byte[] bytes) {
        RecordReader r = RecordReader.parse(bytes, "Balance");
        try {
            List<Utxo> utxo = new ArrayList<>();
            for (RecordReader u : r.getRecords(6, "Utxo")) {
                utxo.add(new Utxo(u.getString(1), u.getInt(2), u.getLong(3)));
            }
            String amount = r.getString(5);
            return new Balance(
                    r.getString(1),
                    r.getLong(2),
                    Blockchain.fromCode(r.getInt(3)),
                    r.getString(4),
                    amount.isEmpty() ? BigInteger.ZERO : Amounts.parse(amount),
                    utxo);
        } catch (IllegalArgumentException ex) {
            throw new MalformedValueException("Malformed Balance bytes", ex);
        }
    }
}
