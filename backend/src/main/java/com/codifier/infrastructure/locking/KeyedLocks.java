package com.codifier.infrastructure.locking;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key (ChangeSet id, document id). A key's lock exists only while some thread
 * holds it or waits for it, so the map stays bounded by the number of keys in use.
 */
public class KeyedLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry acquired = existing == null ? new Entry() : existing;
            acquired.users++;
            return acquired;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    /**
     * Number of keys currently locked or waited on.
     */
    int activeKeys() {
        return locks.size();
    }

    private static final class Entry {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map's per-key compute
        private int users;
    }
}
