// file: storage/src/main/java/io/capsulevault/storage/OwnerLocks.java
package io.capsulevault.storage;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read-write lock per owner.
 * <p>
 * Writers for the same owner are serialized; readers share the lock and never see
 * a half-applied mutation. Different owners never contend.
 * <p>
 * A lock lives only while some thread holds or waits for it: entries are counted
 * in and out under the map's per-key atomicity and removed when the count drops to
 * zero, so lookups of owners that never existed leave nothing behind.
 */
public final class OwnerLocks {

    private static final class Entry {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        int users; // guarded by the map's compute for this key
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withWrite(String owner, Supplier<T> action) {
        return with(owner, true, action);
    }

    public <T> T withRead(String owner, Supplier<T> action) {
        return with(owner, false, action);
    }

    /** Number of owners with a live lock entry. */
    int tracked() {
        return locks.size();
    }

    private <T> T with(String owner, boolean write, Supplier<T> action) {
        Entry entry = locks.compute(owner, (o, e) -> {
            Entry next = e == null ? new Entry() : e;
            next.users++;
            return next;
        });
        try {
            Lock lock = write ? entry.lock.writeLock() : entry.lock.readLock();
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            locks.computeIfPresent(owner, (o, e) -> --e.users == 0 ? null : e);
        }
    }
}
