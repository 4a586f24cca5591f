package io.walletstate.core.state;

import io.walletstate.core.error.InvalidTransitionException;
import io.walletstate.core.protocol.BlockRef;
import io.walletstate.core.protocol.State;
import io.walletstate.core.protocol.Transaction;

import java.util.Optional;

/**
 * Transaction lifecycle rules.
 * <pre>
 *   PREPARED  -> SUBMITTED
 *   SUBMITTED -> CONFIRMED (with block) | REPLACED | DROPPED
 *   CONFIRMED -> DROPPED | SUBMITTED (only when the recorded block was reorged away)
 * </pre>
 * REPLACED and DROPPED are terminal. Same-state updates refresh metadata, except that a
 * CONFIRMED transaction cannot silently move to another block. UNKNOWN (a state written by a
 * newer schema) has no edges at all.
 */
public final class Lifecycle {
    private Lifecycle() {}

    public static boolean isAllowed(State from, State to) {
        if (from == State.UNKNOWN || to == State.UNKNOWN) return false;
        if (from == to) return true;
        switch (from) {
            case PREPARED:
                return to == State.SUBMITTED;
            case SUBMITTED:
                return to == State.CONFIRMED || to == State.REPLACED || to == State.DROPPED;
            case CONFIRMED:
                return to == State.DROPPED || to == State.SUBMITTED;
            default:
                return false;
        }
    }

    /** Throws if {@code next} may not replace {@code stored}. */
    public static void checkTransition(Transaction stored, Transaction next) {
        checkBlock(next);
        State from = stored.state();
        State to = next.state();
        if (!isAllowed(from, to)) {
            throw new InvalidTransitionException(from, to, "not a lifecycle edge");
        }
        if (from == State.CONFIRMED && to == State.CONFIRMED && !sameBlock(stored.block(), next.block())) {
            throw new InvalidTransitionException(from, to, "block changed without a reorg");
        }
        if (from == State.CONFIRMED && to == State.SUBMITTED && sameBlock(stored.block(), next.block())) {
            throw new InvalidTransitionException(from, to, "no evidence of a reorg, block is unchanged");
        }
    }

    /** Block presence must agree with the state. */
    public static void checkBlock(Transaction tx) {
        State s = tx.state();
        if (s == State.UNKNOWN) {
            throw new InvalidTransitionException(s, s, "state is not known to this schema version");
        }
        boolean hasBlock = tx.block().isPresent();
        if (s == State.CONFIRMED && !hasBlock) {
            throw new InvalidTransitionException(s, s, "confirmed transaction without block");
        }
        if ((s == State.PREPARED || s == State.REPLACED || s == State.DROPPED) && hasBlock) {
            throw new InvalidTransitionException(s, s, s + " transaction cannot reference a block");
        }
    }

    static boolean sameBlock(Optional<BlockRef> a, Optional<BlockRef> b) {
        if (a.isEmpty() || b.isEmpty()) return a.isEmpty() && b.isEmpty();
        return a.get().height() == b.get().height() && a.get().blockId().equals(b.get().blockId());
    }
}
