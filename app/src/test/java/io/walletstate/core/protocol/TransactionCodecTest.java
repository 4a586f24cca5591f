package io.walletstate.core.protocol;

import io.walletstate.core.error.MalformedValueException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionCodecTest {

    private static Transaction sample() {
        return Transaction.builder()
                .blockchain(Blockchain.ETHEREUM)
                .txId("0x2f761cbf069962cf3a82ab0d9b11c453e5d0caf4fb6d192624360def7bd1e81b")
                .sinceTimestamp(1_647_313_850_992L)
                .confirmTimestamp(1_647_313_900_000L)
                .state(State.CONFIRMED)
                .block(new BlockRef(14_000_000L, "0xblock", 1_647_313_899_000L))
                .blockPos(7)
                .status(Status.OK)
                .own(Boolean.FALSE)
                .version(3)
                .addChange(Change.builder()
                        .walletId("72279ede-44c4-4951-925b-f51a7b9e929a")
                        .entryId(1)
                        .address("0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48")
                        .asset("ETH")
                        .amount("100000000")
                        .changeType(ChangeType.TRANSFER)
                        .direction(Direction.SEND)
                        .build())
                .addChange(Change.builder()
                        .amount("21000")
                        .asset("ETH")
                        .changeType(ChangeType.FEE)
                        .direction(Direction.SEND)
                        .build())
                .build();
    }

    @Test
    void encodesEveryField() {
        Transaction tx = sample();
        Transaction back = TransactionCodec.fromBytes(TransactionCodec.toBytes(tx));
        assertEquals(tx, back);
        assertEquals(Boolean.FALSE, back.ownFlag().orElseThrow());
        assertEquals(14_000_000L, back.block().orElseThrow().height());
    }

    @Test
    void skipsFieldsFromNewerWriters() {
        byte[] known = TransactionCodec.toBytes(sample());
        byte[] extra = new RecordWriter()
                .putString(200, "future field")
                .putLong(201, 42L)
                .toBytes();
        byte[] combined = Arrays.copyOf(known, known.length + extra.length);
        System.arraycopy(extra, 0, combined, known.length, extra.length);

        assertEquals(sample(), TransactionCodec.fromBytes(combined));
    }

    @Test
    void unknownEnumCodesFallBack() {
        byte[] bytes = new RecordWriter()
                .putInt(1, Blockchain.BITCOIN.code())
                .putString(2, "abc")
                .putInt(8, 77)
                .putRecord(9, new RecordWriter().putString(6, "5").putInt(7, 99).putInt(8, 99))
                .toBytes();
        Transaction tx = TransactionCodec.fromBytes(bytes);
        assertEquals(Status.UNKNOWN, tx.status());
        assertEquals(ChangeType.UNSPECIFIED, tx.changes().get(0).changeType());
        assertEquals(Direction.RECEIVE, tx.changes().get(0).direction());

        byte[] newerState = new RecordWriter()
                .putInt(1, Blockchain.BITCOIN.code())
                .putString(2, "abc")
                .putInt(6, 13)
                .toBytes();
        assertEquals(State.UNKNOWN, TransactionCodec.fromBytes(newerState).state());

        byte[] newerChain = new RecordWriter()
                .putInt(1, 10010)
                .putString(2, "abc")
                .toBytes();
        Transaction foreign = TransactionCodec.fromBytes(newerChain);
        assertEquals(Blockchain.UNSPECIFIED, foreign.blockchain());
        assertThrows(IllegalArgumentException.class, foreign::basicValidate);
    }

    @Test
    void entryIdsCoverTheSignedRange() {
        Transaction tx = Transaction.builder()
                .blockchain(Blockchain.ETHEREUM)
                .txId("0xabc")
                .addChange(Change.builder().walletId("w").entryId(Integer.MAX_VALUE).amount("1").build())
                .build();
        assertEquals(Integer.MAX_VALUE, TransactionCodec.fromBytes(TransactionCodec.toBytes(tx)).changes().get(0).entryId());

        assertThrows(IllegalArgumentException.class, () -> Change.builder().entryId(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new Utxo("aa", 0, -1L));
        assertEquals(Long.MAX_VALUE, new Utxo("aa", Integer.MAX_VALUE, Long.MAX_VALUE).amount());
    }

    @Test
    void rejectsTruncatedAndInvalidRecords() {
        byte[] bytes = TransactionCodec.toBytes(sample());
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 3);
        assertThrows(MalformedValueException.class, () -> TransactionCodec.fromBytes(truncated));

        byte[] missingId = new RecordWriter().putInt(1, Blockchain.BITCOIN.code()).toBytes();
        assertThrows(MalformedValueException.class, () -> TransactionCodec.fromBytes(missingId));

        byte[] badWire = {0, 1, 9, 0};
        assertThrows(MalformedValueException.class, () -> TransactionCodec.fromBytes(badWire));
    }

    @Test
    void metadataKeepsRawPayload() {
        TransactionMeta meta = new TransactionMeta(1_000L, Blockchain.BITCOIN, "txid", "rent", new byte[]{1, 2, 3});
        TransactionMeta back = TransactionCodec.metaFromBytes(TransactionCodec.metaToBytes(meta));
        assertEquals(meta, back);
        assertArrayEquals(new byte[]{1, 2, 3}, back.raw());
    }
}
