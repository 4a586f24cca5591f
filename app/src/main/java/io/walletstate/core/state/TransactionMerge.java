package io.walletstate.core.state;

import io.walletstate.core.protocol.Change;
import io.walletstate.core.protocol.ChangeType;
import io.walletstate.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Folds a sync-feed observation into the stored transaction.
 *
 * Most fields come from the observation, except:
 * <ul>
 *   <li>confirm timestamp: the later of the two while the observation has a block, otherwise
 *   the observed one;</li>
 *   <li>since timestamp and own flag: kept when the observation has none;</li>
 *   <li>transfers: matched by amount, direction, asset and address. A matched transfer takes
 *   the observed fields but keeps the stored wallet id and entry id if the observation has no
 *   wallet. Stored transfers without a match are dropped, observed ones without a match added;</li>
 *   <li>fees: replaced only when the observation carries any, since a later observer may not
 *   know our share of a shared fee.</li>
 * </ul>
 * The result keeps the stored version; the store bumps it on write.
 */
public final class TransactionMerge {
    private TransactionMerge() {}

    public static Transaction merge(Transaction stored, Transaction update) {
        Transaction.Builder merged = update.toBuilder().version(stored.version());
        if (update.block().isPresent() && update.confirmTimestamp() < stored.confirmTimestamp()) {
            merged.confirmTimestamp(stored.confirmTimestamp());
        }
        if (update.sinceTimestamp() == 0) {
            merged.sinceTimestamp(stored.sinceTimestamp());
        }
        if (update.ownFlag().isEmpty()) {
            merged.own(stored.ownFlag().orElse(null));
        }
        merged.changes(mergeChanges(stored.changes(), update.changes()));
        return merged.build();
    }

    static List<Change> mergeChanges(List<Change> existing, List<Change> proposed) {
        List<Change> pool = new ArrayList<>(transfers(proposed));
        List<Change> out = new ArrayList<>();
        for (Change old : transfers(existing)) {
            Iterator<Change> it = pool.iterator();
            while (it.hasNext()) {
                Change candidate = it.next();
                if (isSimilar(old, candidate)) {
                    it.remove();
                    out.add(mergeTransfer(old, candidate));
                    break;
                }
            }
        }
        out.addAll(pool);

        List<Change> fees = fees(proposed);
        out.addAll(fees.isEmpty() ? fees(existing) : fees);
        return out;
    }

    static boolean isSimilar(Change a, Change b) {
        return a.amount().equals(b.amount())
                && a.direction() == b.direction()
                && a.asset().equals(b.asset())
                && a.address().equals(b.address());
    }

    private static Change mergeTransfer(Change old, Change update) {
        if (update.hasWallet()) {
            return update;
        }
        return update.toBuilder().walletId(old.walletId()).entryId(old.entryId()).build();
    }

    // anything not explicitly a fee moves value and is merged like a transfer
    private static List<Change> transfers(List<Change> changes) {
        List<Change> out = new ArrayList<>();
        for (Change c : changes) {
            if (c.changeType() != ChangeType.FEE) out.add(c);
        }
        return out;
    }

    private static List<Change> fees(List<Change> changes) {
        List<Change> out = new ArrayList<>();
        for (Change c : changes) {
            if (c.changeType() == ChangeType.FEE) out.add(c);
        }
        return out;
    }
}
