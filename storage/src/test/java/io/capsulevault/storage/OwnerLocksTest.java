// file: storage/src/test/java/io/capsulevault/storage/OwnerLocksTest.java
package io.capsulevault.storage;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OwnerLocksTest {

    @Test
    void lookups_of_many_owners_leave_no_entries_behind() {
        var locks = new OwnerLocks();

        for (int i = 0; i < 1_000; i++) {
            String owner = "never-stored-" + i;
            assertEquals(owner, locks.withRead(owner, () -> owner));
        }

        assertEquals(0, locks.tracked());
    }

    @Test
    void entry_lives_while_held_and_survives_nested_use() {
        var locks = new OwnerLocks();

        int inside = locks.withWrite("Nova", () -> locks.withRead("Nova", locks::tracked));

        assertEquals(1, inside);
        assertEquals(0, locks.tracked());
    }

    @Test
    void entry_is_released_when_the_action_throws() {
        var locks = new OwnerLocks();

        assertThrows(IllegalStateException.class, () -> locks.withWrite("Nova", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, locks.tracked());
    }

    @Test
    void writers_of_one_owner_never_overlap() throws Exception {
        var locks = new OwnerLocks();
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        locks.withWrite("Nova", () -> {
                            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                            active.decrementAndGet();
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxActive.get());
        assertEquals(0, locks.tracked());
    }
}
