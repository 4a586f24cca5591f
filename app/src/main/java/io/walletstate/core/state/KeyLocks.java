package io.walletstate.core.state;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by record key. Writers to the same record serialize, writers to
 * different records usually do not.
 */
final class KeyLocks {
    private final ReentrantLock[] stripes;

    KeyLocks(int stripes) {
        if (stripes < 1) throw new IllegalArgumentException("stripes must be >= 1");
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripes[index(key)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Locks every stripe the keys map to, in stripe order so concurrent callers cannot deadlock. */
    <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        TreeSet<Integer> order = new TreeSet<>();
        for (String k : keys) {
            order.add(index(k));
        }
        int locked = 0;
        Integer[] idx = order.toArray(new Integer[0]);
        try {
            for (Integer i : idx) {
                stripes[i].lock();
                locked++;
            }
            return action.get();
        } finally {
            for (int i = locked - 1; i >= 0; i--) {
                stripes[idx[i]].unlock();
            }
        }
    }

    private int index(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }
}
