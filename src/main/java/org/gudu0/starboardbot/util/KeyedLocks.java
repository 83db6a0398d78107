package org.gudu0.starboardbot.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key. Entries are dropped as soon as nobody holds or waits for them,
 * so the map only ever contains keys that are in use.
 */
public final class KeyedLocks<K> {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final ConcurrentHashMap<K, Entry> locks = new ConcurrentHashMap<>();

    public <R> R call(K key, Supplier<R> action) {
        Entry entry = locks.compute(key, (k, e) -> {
            Entry out = (e == null) ? new Entry() : e;
            out.users++;
            return out;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    public void run(K key, Runnable action) {
        call(key, () -> {
            action.run();
            return null;
        });
    }

    /** Number of keys currently held or waited on. */
    public int activeKeys() {
        return locks.size();
    }
}
