package io.walletstate.core.state;

import io.walletstate.core.config.StoreConfig;
import io.walletstate.core.error.ConsistencyViolationException;
import io.walletstate.core.error.InvalidTransitionException;
import io.walletstate.core.error.MalformedCursorException;
import io.walletstate.core.error.NotFoundException;
import io.walletstate.core.error.StaleCursorException;
import io.walletstate.core.error.VersionConflictException;
import io.walletstate.core.index.CursorCodec;
import io.walletstate.core.index.KeyCodec;
import io.walletstate.core.metrics.StoreMetrics;
import io.walletstate.core.protocol.BlockRef;
import io.walletstate.core.protocol.Blockchain;
import io.walletstate.core.protocol.Change;
import io.walletstate.core.protocol.ChangeType;
import io.walletstate.core.protocol.Cursor;
import io.walletstate.core.protocol.Direction;
import io.walletstate.core.protocol.RecordWriter;
import io.walletstate.core.protocol.State;
import io.walletstate.core.protocol.Transaction;
import io.walletstate.core.protocol.TransactionMeta;
import io.walletstate.core.storage.Batch;
import io.walletstate.core.storage.InMemoryKeyValueDB;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class TransactionStoreTest {

    private static final String WALLET = "72279ede-44c4-4951-925b-f51a7b9e929a";
    private static final String OTHER_WALLET = "0c9b9e4b-5b1c-4c3f-9d71-3a4f6a2b8e10";
    private static final String ADDRESS = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String OTHER_ADDRESS = "0x6218b36c1d19d4a2e9eb0ce3606eb48a0b86991c";
    private static final BlockRef B1 = new BlockRef(100, "0xb1", 1_700_000_100_000L);
    private static final BlockRef B2 = new BlockRef(101, "0xb2", 1_700_000_200_000L);

    private InMemoryKeyValueDB db;
    private MutableClock clock;
    private StoreMetrics metrics;
    private StateDatabase database;
    private TransactionStore store;

    @BeforeEach
    void setUp() {
        db = new InMemoryKeyValueDB();
        clock = new MutableClock(1_700_000_000_000L);
        metrics = StoreMetrics.simple();
        database = new StateDatabase(db, StoreConfig.defaults(), metrics, clock);
        store = database.transactions();
    }

    private static Change transfer(String wallet, int entry, String address, String amount) {
        return Change.builder()
                .walletId(wallet)
                .entryId(entry)
                .address(address)
                .asset("ETH")
                .amount(amount)
                .changeType(ChangeType.TRANSFER)
                .direction(Direction.SEND)
                .build();
    }

    private static Transaction.Builder tx(String txId, State state) {
        return Transaction.builder()
                .blockchain(Blockchain.ETHEREUM)
                .txId(txId)
                .state(state)
                .sinceTimestamp(1_699_999_000_000L)
                .addChange(transfer(WALLET, 0, ADDRESS, "1000"));
    }

    // -------------------- versioning --------------------

    @Test
    void secondWriterWithSameExpectedVersionLoses() {
        Transaction created = store.insert(tx("0xabc", State.PREPARED).build());
        assertEquals(0, created.version());

        Transaction submitted = store.upsert(tx("0xabc", State.SUBMITTED).build(), 0);
        assertEquals(1, submitted.version());

        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> store.upsert(tx("0xabc", State.SUBMITTED).syncTimestamp(5L).build(), 0));
        assertEquals(0, e.expectedVersion());
        assertEquals(1, e.actualVersion());

        Transaction stored = store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow();
        assertEquals(State.SUBMITTED, stored.state());
        assertEquals(1, stored.version());
        assertEquals(0L, stored.syncTimestamp());
        assertEquals(1.0, metrics.count("walletstate.version.conflicts", TransactionStore.NAME));
    }

    @Test
    void versionCountsSuccessfulUpserts() {
        store.insert(tx("0xabc", State.PREPARED).build());
        long version = 0;
        for (int i = 1; i <= 5; i++) {
            version = store.upsert(tx("0xabc", State.SUBMITTED).syncTimestamp(i).build(), version).version();
        }
        Transaction stored = store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow();
        assertEquals(5, stored.version());
        assertEquals(5L, stored.syncTimestamp());
    }

    @Test
    void insertTwiceAndUpsertMissing() {
        store.insert(tx("0xabc", State.PREPARED).build());
        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> store.insert(tx("0xabc", State.PREPARED).build()));
        assertEquals(-1, e.expectedVersion());
        assertThrows(NotFoundException.class, () -> store.upsert(tx("0xdef", State.SUBMITTED).build(), 0));
        assertTrue(store.getByTxId(Blockchain.ETHEREUM, "0xdef").isEmpty());
    }

    @Test
    void concurrentWritersRetryingOnConflictAllLand() throws Exception {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        while (true) {
                            Transaction current = store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow();
                            try {
                                store.upsert(current.toBuilder().syncTimestamp(current.syncTimestamp() + 1).build(),
                                        current.version());
                                break;
                            } catch (VersionConflictException retry) {
                                // lost the race, read again
                            }
                        }
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        Transaction stored = store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow();
        assertEquals(400, stored.version());
        assertEquals(400L, stored.syncTimestamp());
    }

    // -------------------- lifecycle --------------------

    @Test
    void confirmReorgAndConfirmAgain() {
        store.insert(tx("0xabc", State.PREPARED).build());
        store.upsert(tx("0xabc", State.SUBMITTED).build(), 0);
        store.upsert(tx("0xabc", State.CONFIRMED).block(B1).build(), 1);
        store.upsert(tx("0xabc", State.SUBMITTED).build(), 2);
        Transaction last = store.upsert(tx("0xabc", State.CONFIRMED).block(B2).build(), 3);

        assertEquals(4, last.version());
        assertEquals(B2, last.block().orElseThrow());
        assertEquals(List.of("0xabc"), ids(store.listByHeight(Blockchain.ETHEREUM, 101)));
        assertTrue(store.listByHeight(Blockchain.ETHEREUM, 102).isEmpty());
    }

    @Test
    void preparedCannotJumpToConfirmed() {
        store.insert(tx("0xabc", State.PREPARED).build());
        assertThrows(InvalidTransitionException.class,
                () -> store.upsert(tx("0xabc", State.CONFIRMED).block(B1).build(), 0));

        Transaction stored = store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow();
        assertEquals(State.PREPARED, stored.state());
        assertEquals(0, stored.version());
        assertTrue(store.listByHeight(Blockchain.ETHEREUM, 0).isEmpty());
        assertEquals(1.0, metrics.count("walletstate.transitions.rejected", TransactionStore.NAME));
    }

    @Test
    void terminalStatesStayTerminal() {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        store.upsert(tx("0xabc", State.REPLACED).build(), 0);
        assertThrows(InvalidTransitionException.class, () -> store.upsert(tx("0xabc", State.SUBMITTED).build(), 1));
        assertThrows(InvalidTransitionException.class, () -> store.upsert(tx("0xabc", State.DROPPED).build(), 1));
    }

    @Test
    void confirmedWithoutBlockIsRejectedOnInsert() {
        assertThrows(InvalidTransitionException.class, () -> store.insert(tx("0xabc", State.CONFIRMED).build()));
        assertTrue(store.getByTxId(Blockchain.ETHEREUM, "0xabc").isEmpty());
    }

    // -------------------- pagination --------------------

    @Test
    void walletPagesCoverEveryEntryOnce() {
        for (int i = 0; i < 7; i++) {
            store.insert(tx("tx-" + i, State.SUBMITTED).build());
        }
        List<List<String>> pages = new ArrayList<>();
        String cursor = null;
        do {
            Page<Transaction> page = store.listByWallet(WALLET, cursor, 3);
            pages.add(ids(page.items()));
            cursor = page.nextCursor().orElse(null);
        } while (cursor != null);

        assertEquals(List.of(
                List.of("tx-0", "tx-1", "tx-2"),
                List.of("tx-3", "tx-4", "tx-5"),
                List.of("tx-6")), pages);
    }

    @Test
    void exactMultipleOfPageSizeHasNoTrailingEmptyPage() {
        for (int i = 0; i < 6; i++) {
            store.insert(tx("tx-" + i, State.SUBMITTED).build());
        }
        Page<Transaction> first = store.listByWallet(WALLET, null, 3);
        Page<Transaction> second = store.listByWallet(WALLET, first.nextCursor().orElseThrow(), 3);
        assertEquals(3, second.items().size());
        assertFalse(second.hasMore());
    }

    @Test
    void walletPagesFollowEntryOrder() {
        store.insert(tx("tx-a", State.SUBMITTED).changes(List.of(transfer(WALLET, 2, ADDRESS, "1"))).build());
        store.insert(tx("tx-b", State.SUBMITTED).changes(List.of(transfer(WALLET, 1, ADDRESS, "1"))).build());
        store.insert(tx("tx-c", State.SUBMITTED).changes(List.of(transfer(OTHER_WALLET, 0, ADDRESS, "1"))).build());

        assertEquals(List.of("tx-b", "tx-a"), ids(store.listByWallet(WALLET, null, 10).items()));
        assertEquals(List.of("tx-a"), ids(store.listByWalletEntry(WALLET, 2, null, 10).items()));
    }

    @Test
    void addressHistoryIsOldestFirst() {
        store.insert(tx("late", State.SUBMITTED).sinceTimestamp(3_000L).build());
        store.insert(tx("early", State.SUBMITTED).sinceTimestamp(1_000L).build());
        store.insert(tx("middle", State.SUBMITTED).sinceTimestamp(2_000L).build());

        Page<Transaction> first = store.listByAddress(ADDRESS, null, 2);
        assertEquals(List.of("early", "middle"), ids(first.items()));
        Page<Transaction> rest = store.listByAddress(ADDRESS, first.nextCursor().orElseThrow(), 2);
        assertEquals(List.of("late"), ids(rest.items()));
        assertFalse(rest.hasMore());
    }

    @Test
    void cursorFromAnotherListingIsMalformed() {
        for (int i = 0; i < 3; i++) {
            store.insert(tx("tx-" + i, State.SUBMITTED).build());
        }
        String cursor = store.listByWallet(WALLET, null, 1).nextCursor().orElseThrow();
        assertThrows(MalformedCursorException.class, () -> store.listByWallet(OTHER_WALLET, cursor, 1));
        assertThrows(MalformedCursorException.class, () -> store.listByAddress(ADDRESS, cursor, 1));
        assertThrows(MalformedCursorException.class, () -> store.listByWallet(WALLET, "garbage!", 1));
        assertThrows(MalformedCursorException.class, () -> store.listByWallet(WALLET, "", 1));
    }

    @Test
    void oldCursorIsStale() {
        for (int i = 0; i < 3; i++) {
            store.insert(tx("tx-" + i, State.SUBMITTED).build());
        }
        String cursor = store.listByWallet(WALLET, null, 1).nextCursor().orElseThrow();
        clock.advance(Duration.ofDays(6));
        assertEquals(1, store.listByWallet(WALLET, cursor, 1).items().size());
        clock.advance(Duration.ofDays(2));
        assertThrows(StaleCursorException.class, () -> store.listByWallet(WALLET, cursor, 1));
    }

    @Test
    void cursorFromBeforeSchemaEpochIsStale() {
        store.insert(tx("tx-0", State.SUBMITTED).build());
        String prefix = KeyCodec.walletPrefix(WALLET);
        String token = CursorCodec.encode(new Cursor(KeyCodec.printable(prefix),
                KeyCodec.walletIndexKey(WALLET, 0, Blockchain.ETHEREUM, "tx-0"), database.schemaEpoch() - 1));
        assertThrows(StaleCursorException.class, () -> store.listByWallet(WALLET, token, 1));
    }

    @Test
    void pageSizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> store.listByWallet(WALLET, null, 0));
    }

    // -------------------- index maintenance --------------------

    @Test
    void changedAddressMovesIndexEntry() {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        store.upsert(tx("0xabc", State.SUBMITTED).changes(List.of(transfer(WALLET, 0, OTHER_ADDRESS, "1000"))).build(), 0);

        assertTrue(store.listByAddress(ADDRESS, null, 10).items().isEmpty());
        assertEquals(List.of("0xabc"), ids(store.listByAddress(OTHER_ADDRESS, null, 10).items()));
        assertTrue(store.verifyIndexes() > 0);
    }

    @Test
    void listSinceReturnsEachTransactionOnce() {
        store.insert(tx("first", State.SUBMITTED).sinceTimestamp(1_000L).build());
        store.insert(tx("second", State.SUBMITTED).sinceTimestamp(3_000L).build());
        store.upsert(tx("first", State.CONFIRMED).sinceTimestamp(1_000L).confirmTimestamp(5_000L).block(B1).build(), 0);

        assertEquals(List.of("first", "second"), ids(store.listSince(0)));
        assertEquals(List.of("second", "first"), ids(store.listSince(2_000L)));
        assertTrue(store.listSince(6_000L).isEmpty());
    }

    @Test
    void indexWithoutRecordIsAViolation() {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        db.write(new Batch().delete(KeyCodec.primaryKey(Blockchain.ETHEREUM, "0xabc")));

        assertThrows(ConsistencyViolationException.class, () -> store.listByWallet(WALLET, null, 10));
        assertThrows(ConsistencyViolationException.class, () -> store.verifyIndexes());
    }

    @Test
    void recordWithoutIndexIsAViolation() {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        db.write(new Batch().delete(KeyCodec.addressIndexKey(ADDRESS, 1_699_999_000_000L, Blockchain.ETHEREUM, "0xabc")));
        assertThrows(ConsistencyViolationException.class, () -> store.verifyIndexes());
    }

    // -------------------- reorg & prune --------------------

    @Test
    void invalidateFromRevertsBlocksAtOrAboveHeight() {
        store.insert(tx("below", State.CONFIRMED).block(new BlockRef(90, "0x90", 1L)).build());
        store.insert(tx("at", State.CONFIRMED).block(new BlockRef(100, "0x100", 1L)).build());
        store.insert(tx("above", State.SUBMITTED).block(new BlockRef(110, "0x110", 1L)).build());
        store.insert(tx("btc", State.CONFIRMED).blockchain(Blockchain.BITCOIN).block(new BlockRef(500, "00ff", 1L)).build());

        assertEquals(2, store.invalidateFrom(Blockchain.ETHEREUM, 100));

        Transaction at = store.getByTxId(Blockchain.ETHEREUM, "at").orElseThrow();
        assertEquals(State.SUBMITTED, at.state());
        assertTrue(at.block().isEmpty());
        assertEquals(1, at.version());
        Transaction above = store.getByTxId(Blockchain.ETHEREUM, "above").orElseThrow();
        assertEquals(State.SUBMITTED, above.state());
        assertTrue(above.block().isEmpty());
        assertEquals(0, store.getByTxId(Blockchain.ETHEREUM, "below").orElseThrow().version());
        assertEquals(State.CONFIRMED, store.getByTxId(Blockchain.BITCOIN, "btc").orElseThrow().state());

        assertEquals(List.of("below"), ids(store.listByHeight(Blockchain.ETHEREUM, 0)));
        store.verifyIndexes();

        store.upsert(tx("at", State.CONFIRMED).block(new BlockRef(100, "0x100b", 2L)).build(), 1);
        assertEquals(List.of("below", "at"), ids(store.listByHeight(Blockchain.ETHEREUM, 0)));
    }

    @Test
    void reorgForgetsConfirmTimestamp() {
        store.insert(tx("0xabc", State.SUBMITTED).sinceTimestamp(1_000L).build());
        store.upsert(tx("0xabc", State.CONFIRMED).sinceTimestamp(1_000L).confirmTimestamp(5_000L).block(B1).build(), 0);
        assertEquals(List.of("0xabc"), ids(store.listSince(4_000L)));

        assertEquals(1, store.invalidateFrom(Blockchain.ETHEREUM, B1.height()));
        assertEquals(0L, store.getByTxId(Blockchain.ETHEREUM, "0xabc").orElseThrow().confirmTimestamp());
        assertTrue(store.listSince(4_000L).isEmpty());

        Transaction again = store.record(tx("0xabc", State.SUBMITTED).sinceTimestamp(1_000L).build());
        assertEquals(0L, again.confirmTimestamp());
        assertTrue(store.listSince(4_000L).isEmpty());
        store.verifyIndexes();
    }

    // -------------------- records from a newer schema --------------------

    private void appendField(String txId, RecordWriter field) {
        String pk = KeyCodec.primaryKey(Blockchain.ETHEREUM, txId);
        byte[] stored = db.get(KeyCodec.bytes(pk)).orElseThrow();
        byte[] extra = field.toBytes();
        byte[] combined = Arrays.copyOf(stored, stored.length + extra.length);
        System.arraycopy(extra, 0, combined, stored.length, extra.length);
        db.write(new Batch().put(pk, combined));
    }

    @Test
    void newerStateCodeIsReadableButFrozen() {
        store.insert(tx("0xnew", State.SUBMITTED).build());
        store.insert(tx("0xold", State.SUBMITTED).build());
        appendField("0xnew", new RecordWriter().putInt(6, 30));

        assertEquals(State.UNKNOWN, store.getByTxId(Blockchain.ETHEREUM, "0xnew").orElseThrow().state());
        assertEquals(List.of("0xnew", "0xold"), ids(store.listByWallet(WALLET, null, 10).items()));
        assertEquals(2, store.listByAddress(ADDRESS, null, 10).items().size());

        assertThrows(InvalidTransitionException.class, () -> store.upsert(tx("0xnew", State.SUBMITTED).build(), 0));
        assertThrows(InvalidTransitionException.class, () -> store.record(tx("0xnew", State.DROPPED).build()));
        assertThrows(InvalidTransitionException.class, () -> store.insert(tx("0xother", State.UNKNOWN).build()));
        assertEquals(State.UNKNOWN, store.getByTxId(Blockchain.ETHEREUM, "0xnew").orElseThrow().state());
        store.verifyIndexes();
    }

    @Test
    void unknownChainCodeIsReadableButNotWritable() {
        store.insert(tx("0xnew", State.SUBMITTED).build());
        store.insert(tx("0xold", State.SUBMITTED).build());
        appendField("0xnew", new RecordWriter().putInt(1, 10010));

        Transaction foreign = store.getByTxId(Blockchain.ETHEREUM, "0xnew").orElseThrow();
        assertEquals(Blockchain.UNSPECIFIED, foreign.blockchain());
        assertEquals(2, store.listByWallet(WALLET, null, 10).items().size());
        assertEquals(2, store.listByAddress(ADDRESS, null, 10).items().size());
        assertEquals(2, store.count(TransactionFilter.any()));
        store.verifyIndexes();

        assertThrows(IllegalArgumentException.class, () -> store.record(foreign));
        assertThrows(IllegalArgumentException.class, () -> store.insert(foreign.toBuilder().txId("0xcopy").build()));
    }

    @Test
    void forgetRemovesRecordIndexesAndMeta() {
        store.insert(tx("0xabc", State.SUBMITTED).build());
        store.setMeta(new TransactionMeta(1L, Blockchain.ETHEREUM, "0xabc", "rent", null));

        assertTrue(store.forget(Blockchain.ETHEREUM, "0xabc"));
        assertTrue(store.getByTxId(Blockchain.ETHEREUM, "0xabc").isEmpty());
        assertTrue(store.getMeta(Blockchain.ETHEREUM, "0xabc").isEmpty());
        assertTrue(store.listByWallet(WALLET, null, 10).items().isEmpty());
        assertTrue(store.listSince(0).isEmpty());
        assertEquals(0, store.verifyIndexes());
        assertFalse(store.forget(Blockchain.ETHEREUM, "0xabc"));
    }

    // -------------------- sync feed --------------------

    @Test
    void recordMergesObservations() {
        store.insert(tx("0xabc", State.SUBMITTED).changes(List.of(transfer(WALLET, 1, ADDRESS, "1000"))).build());

        Transaction observed = Transaction.builder()
                .blockchain(Blockchain.ETHEREUM)
                .txId("0xabc")
                .state(State.CONFIRMED)
                .block(B1)
                .confirmTimestamp(1_700_000_100_000L)
                .addChange(transfer("", 0, ADDRESS, "1000"))
                .build();
        Transaction merged = store.record(observed);
        assertEquals(1, merged.version());
        assertEquals(State.CONFIRMED, merged.state());
        assertEquals(1_699_999_000_000L, merged.sinceTimestamp());
        assertEquals(WALLET, merged.changes().get(0).walletId());
        assertEquals(List.of("0xabc"), ids(store.listByWalletEntry(WALLET, 1, null, 10).items()));

        assertEquals(1, store.record(observed).version());
        assertEquals(1.0, metrics.count("walletstate.writes.skipped", TransactionStore.NAME));

        Transaction regress = observed.toBuilder().state(State.PREPARED).block(null).build();
        assertThrows(InvalidTransitionException.class, () -> store.record(regress));
    }

    @Test
    void recordInsertsUnknownTransaction() {
        Transaction first = store.record(tx("0xnew", State.SUBMITTED).build());
        assertEquals(0, first.version());
        assertTrue(store.getByTxId(Blockchain.ETHEREUM, "0xnew").isPresent());
    }

    // -------------------- metadata, remote cursors, counting --------------------

    @Test
    void metadataLatestTimestampWins() {
        assertTrue(store.getMeta(Blockchain.ETHEREUM, "0xabc").isEmpty());
        store.setMeta(new TransactionMeta(1_000L, Blockchain.ETHEREUM, "0xabc", "first", null));
        TransactionMeta kept = store.setMeta(new TransactionMeta(900L, Blockchain.ETHEREUM, "0xabc", "older", null));
        assertEquals("first", kept.label());
        store.setMeta(new TransactionMeta(1_100L, Blockchain.ETHEREUM, "0xabc", "newer", null));
        assertEquals("newer", store.getMeta(Blockchain.ETHEREUM, "0xabc").orElseThrow().label());

        assertThrows(IllegalArgumentException.class,
                () -> store.setMeta(new TransactionMeta(1L, Blockchain.ETHEREUM, "", "x", null)));
    }

    @Test
    void remoteCursorRoundTrip() {
        assertTrue(store.getRemoteCursor(ADDRESS).isEmpty());
        store.setRemoteCursor(ADDRESS, "MTA5MjQ5MS81ODE=");
        Cursor saved = store.getRemoteCursor(ADDRESS).orElseThrow();
        assertEquals("MTA5MjQ5MS81ODE=", saved.value());
        assertEquals(clock.millis(), saved.ts());

        store.setRemoteCursor(ADDRESS, "");
        assertTrue(store.getRemoteCursor(ADDRESS).isEmpty());
    }

    @Test
    void countAppliesEveryCriterion() {
        store.insert(tx("a", State.SUBMITTED).sinceTimestamp(1_000L).build());
        store.insert(tx("b", State.SUBMITTED).sinceTimestamp(2_000L)
                .changes(List.of(transfer(OTHER_WALLET, 3, OTHER_ADDRESS, "5"))).build());
        store.insert(tx("c", State.SUBMITTED).blockchain(Blockchain.ETHEREUM_CLASSIC).sinceTimestamp(3_000L).build());

        assertEquals(3, store.count(TransactionFilter.any()));
        assertEquals(2, store.count(TransactionFilter.builder().blockchain(Blockchain.ETHEREUM).build()));
        assertEquals(2, store.count(TransactionFilter.builder().wallet(WALLET).build()));
        assertEquals(1, store.count(TransactionFilter.builder().walletEntry(OTHER_WALLET, 3).build()));
        assertEquals(0, store.count(TransactionFilter.builder().walletEntry(OTHER_WALLET, 4).build()));
        assertEquals(1, store.count(TransactionFilter.builder().address(OTHER_ADDRESS).build()));
        assertEquals(2, store.count(TransactionFilter.builder().after(2_000L).build()));
        assertEquals(1, store.count(TransactionFilter.builder().after(1_500L).before(2_500L).build()));
    }

    private static List<String> ids(List<Transaction> txs) {
        List<String> out = new ArrayList<>();
        for (Transaction t : txs) {
            out.add(t.txId());
        }
        return out;
    }
}
