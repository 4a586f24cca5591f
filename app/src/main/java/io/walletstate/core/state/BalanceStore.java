package io.walletstate.core.state;

import io.walletstate.core.config.StoreConfig;
import io.walletstate.core.error.ConsistencyViolationException;
import io.walletstate.core.index.KeyCodec;
import io.walletstate.core.metrics.StoreMetrics;
import io.walletstate.core.protocol.Balance;
import io.walletstate.core.protocol.BalanceCodec;
import io.walletstate.core.protocol.Blockchain;
import io.walletstate.core.storage.Batch;
import io.walletstate.core.storage.KeyValueDB;
import io.walletstate.core.storage.ReadView;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/** Latest known balance per (address, blockchain, asset). Older observations never win. */
public final class BalanceStore {
    private static final Logger LOG = Logger.getLogger(BalanceStore.class.getName());
    static final String NAME = "balances";

    private final KeyValueDB db;
    private final StoreMetrics metrics;
    private final KeyLocks locks;

    public BalanceStore(KeyValueDB db, StoreConfig config, StoreMetrics metrics) {
        this.db = db;
        this.metrics = metrics;
        this.locks = new KeyLocks(config.lockStripes);
    }

    /**
     * Stores the balance if none is known or it is strictly newer than the stored one.
     *
     * @return true if written, false if the stored balance is as new or newer
     * @throws ConsistencyViolationException if the UTXO detail does not add up to the amount
     */
    public boolean upsert(Balance balance) {
        validateAddress(balance.address());
        if (balance.blockchain() == Blockchain.UNSPECIFIED) {
            throw new IllegalArgumentException("Missing blockchain");
        }
        if (balance.hasUtxo()) {
            BigInteger total = balance.utxoTotal();
            if (!total.equals(balance.amount())) {
                throw new ConsistencyViolationException("Balance of " + balance.address() + " is "
                        + balance.amount() + " but its UTXO add up to " + total);
            }
        }
        String key = KeyCodec.balanceKey(balance.address(), balance.blockchain(), balance.asset());
        return locks.withLock(key, () -> {
            Optional<Balance> existing = db.get(KeyCodec.bytes(key)).map(BalanceCodec::fromBytes);
            if (existing.isPresent() && existing.get().timestamp() >= balance.timestamp()) {
                metrics.noop(NAME);
                LOG.fine("Ignored older " + balance);
                return false;
            }
            db.write(new Batch().put(key, BalanceCodec.toBytes(balance)));
            metrics.write(NAME);
            return true;
        });
    }

    public Optional<Balance> get(String address, Blockchain blockchain, String asset) {
        return db.get(KeyCodec.bytes(KeyCodec.balanceKey(address, blockchain, asset))).map(BalanceCodec::fromBytes);
    }

    /** All balances of an address, ordered by blockchain then asset. */
    public List<Balance> list(String address) {
        validateAddress(address);
        List<Balance> out = new ArrayList<>();
        try (ReadView view = db.snapshot()) {
            view.scan(KeyCodec.bytes(KeyCodec.balancePrefix(address)), (k, v) -> {
                out.add(BalanceCodec.fromBytes(v));
                return true;
            });
        }
        return out;
    }

    /** @return number of balances removed */
    public int clear(String address) {
        validateAddress(address);
        Batch batch = new Batch();
        try (ReadView view = db.snapshot()) {
            view.scan(KeyCodec.bytes(KeyCodec.balancePrefix(address)), (k, v) -> {
                batch.delete(k);
                return true;
            });
        }
        db.write(batch);
        if (!batch.isEmpty()) {
            metrics.write(NAME);
        }
        return batch.size();
    }

    private static void validateAddress(String address) {
        if (address == null || address.isEmpty()) {
            throw new IllegalArgumentException("Missing address");
        }
        for (int i = 0; i < address.length(); i++) {
            if (address.charAt(i) > 0x7F) {
                throw new IllegalArgumentException("Address must be ASCII: " + address);
            }
        }
    }
}
