package io.walletstate.core.protocol;

import io.walletstate.core.error.MalformedValueException;

import java.util.ArrayList;
import java.util.List;

/**
 * Binary layout of transactions and their metadata.
 *
 * Field numbers (never reuse a removed one):
 * Transaction: 1 blockchain, 2 tx_id, 3 since, 4 sync, 5 confirm, 6 state, 7 block,
 * 8 status, 9 changes, 10 version, 11 block_pos, 12 own (0 unset, 1 false, 2 true).
 * BlockRef: 1 height, 2 block_id, 3 timestamp.
 * Change: 1 wallet_id, 2 entry_id, 3 address, 4 hd_path, 5 asset, 6 amount, 7 change_type, 8 direction.
 * TransactionMeta: 1 timestamp, 2 blockchain, 3 tx_id, 4 label, 5 raw.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static byte[] toBytes(Transaction tx) {
        RecordWriter w = new RecordWriter()
                .putInt(1, tx.blockchain().code())
                .putString(2, tx.txId())
                .putLong(3, tx.sinceTimestamp())
                .putLong(4, tx.syncTimestamp())
                .putLong(5, tx.confirmTimestamp())
                .putInt(6, tx.state().code());
        tx.block().ifPresent(block -> w.putRecord(7, blockRef(block)));
        w.putInt(8, tx.status().code());
        for (Change c : tx.changes()) {
            w.putRecord(9, change(c));
        }
        w.putLong(10, tx.version());
        w.putInt(11, tx.blockPos());
        w.putInt(12, tx.ownFlag().map(own -> own ? 2 : 1).orElse(0));
        return w.toBytes();
    }

    public static Transaction fromBytes(byte[] bytes) {
        RecordReader r = RecordReader.parse(bytes, "Transaction");
        try {
            Transaction.Builder b = Transaction.builder()
                    .blockchain(Blockchain.fromCode(r.getInt(1)))
                    .txId(r.getString(2))
                    .sinceTimestamp(r.getLong(3))
                    .syncTimestamp(r.getLong(4))
                    .confirmTimestamp(r.getLong(5))
                    .state(State.fromCode(r.getInt(6)))
                    .status(Status.fromCode(r.getInt(8)))
                    .version(r.getLong(10))
                    .blockPos(r.getInt(11));
            RecordReader block = r.getRecord(7, "BlockRef");
            if (block != null) {
                b.block(new BlockRef(block.getLong(1), block.getString(2), block.getLong(3)));
            }
            List<Change> changes = new ArrayList<>();
            for (RecordReader c : r.getRecords(9, "Change")) {
                changes.add(Change.builder()
                        .walletId(c.getString(1))
                        .entryId(c.getInt(2))
                        .address(c.getString(3))
                        .hdPath(c.getString(4))
                        .asset(c.getString(5))
                        .amount(c.getString(6).isEmpty() ? "0" : c.getString(6))
                        .changeType(ChangeType.fromCode(c.getInt(7)))
                        .direction(Direction.fromCode(c.getInt(8)))
                        .build());
            }
            b.changes(changes);
            int own = r.getInt(12);
            b.own(own == 0 ? null : own == 2);
            return b.build();
        } catch (IllegalArgumentException ex) {
            throw new MalformedValueException("Malformed Transaction bytes", ex);
        }
    }

    public static byte[] metaToBytes(TransactionMeta meta) {
        return new RecordWriter()
                .putLong(1, meta.timestamp())
                .putInt(2, meta.blockchain().code())
                .putString(3, meta.txId())
                .putString(4, meta.label())
                .putBytes(5, meta.raw())
                .toBytes();
    }

    public static TransactionMeta metaFromBytes(byte[] bytes) {
        RecordReader r = RecordReader.parse(bytes, "TransactionMeta");
        return new TransactionMeta(
                r.getLong(1),
                Blockchain.fromCode(r.getInt(2)),
                r.getString(3),
                r.getString(4),
                r.getBytes(5));
    }

    private static RecordWriter blockRef(BlockRef block) {
        return new RecordWriter()
                .putLong(1, block.height())
                .putString(2, block.blockId())
                .putLong(3, block.timestamp());
    }

    private static RecordWriter change(Change c) {
        return new RecordWriter()
                .putString(1, c.walletId())
                .putInt(2, c.entryId())
                .putString(3, c.address())
                .putString(4, c.hdPath())
                .putString(5, c.asset())
                .putString(6, c.amount())
                .putInt(7, c.changeType().code())
                .putInt(8, c.direction().code());
    }
}
