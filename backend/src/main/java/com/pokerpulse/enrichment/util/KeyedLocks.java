package com.pokerpulse.enrichment.util;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of lock stripes addressed by string key. Keys hashing to the same stripe serialize;
 * memory stays bounded no matter how many keys are seen.
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount < 1) throw new IllegalArgumentException("stripeCount must be >= 1");
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripes[indexOf(key)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Acquires the stripes of all keys in ascending stripe order, so two callers can never deadlock. */
    public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String key : keys) {
            if (key != null) indexes.add(indexOf(key));
        }
        int acquired = 0;
        Integer[] ordered = indexes.toArray(new Integer[0]);
        try {
            for (Integer idx : ordered) {
                stripes[idx].lock();
                acquired++;
            }
            return action.get();
        } finally {
            for (int i = acquired - 1; i >= 0; i--) {
                stripes[ordered[i]].unlock();
            }
        }
    }

    int indexOf(String key) {
        return Math.floorMod(key == null ? 0 : key.hashCode(), stripes.length);
    }
}
