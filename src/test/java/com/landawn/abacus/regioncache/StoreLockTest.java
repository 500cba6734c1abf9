/*
 * Copyright (c) 2026, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.regioncache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

public class StoreLockTest {

    private final AtomicLong nanos = new AtomicLong(1);
    private final LocalStore store = new LocalStore(1000, nanos::get);
    private final StoreLock storeLock = new StoreLock(store);

    @Test
    public void test_tryLock() {
        final String token = storeLock.tryLock("k", 1000);

        assertNotNull(token);
        assertTrue(storeLock.isLocked("k"));
        assertNull(storeLock.tryLock("k", 1000));

        assertTrue(storeLock.unlock("k", token));
        assertFalse(storeLock.isLocked("k"));

        final String token2 = storeLock.tryLock("k", 1000);
        assertNotNull(token2);
        assertNotEquals(token, token2);
    }

    @Test
    public void test_unlock_wrongToken() {
        storeLock.tryLock("k", 1000);

        assertFalse(storeLock.unlock("k", "not-the-token"));
        assertTrue(storeLock.isLocked("k"));
    }

    @Test
    public void test_leaseExpiry() {
        final String stale = storeLock.tryLock("k", 1000);

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(2));

        assertFalse(storeLock.isLocked("k"));

        final String token = storeLock.tryLock("k", 1000);
        assertNotNull(token);

        // the expired holder cannot release the new holder's lock
        assertFalse(storeLock.unlock("k", stale));
        assertTrue(storeLock.isLocked("k"));
        assertTrue(storeLock.unlock("k", token));
    }

    @Test
    public void test_lock_timeout() {
        final StoreLock realTimeLock = new StoreLock(new LocalStore());

        realTimeLock.lock("k", 10_000, 0, 10);

        final long startTime = System.currentTimeMillis();

        assertThrows(LockAcquisitionException.class, () -> realTimeLock.lock("k", 10_000, 100, 10));
        assertTrue(System.currentTimeMillis() - startTime >= 100);
    }

    @Test
    public void test_lock_interrupted() throws Exception {
        final StoreLock realTimeLock = new StoreLock(new LocalStore());

        realTimeLock.lock("k", 10_000, 0, 10);

        Thread.currentThread().interrupt();

        try {
            assertThrows(LockAcquisitionException.class, () -> realTimeLock.lock("k", 10_000, 0, 10));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void test_lock_mutualExclusion() throws Exception {
        final StoreLock realTimeLock = new StoreLock(new LocalStore());
        final int threadNum = 8;
        final AtomicInteger holders = new AtomicInteger();
        final AtomicInteger maxHolders = new AtomicInteger();
        final CountDownLatch start = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(threadNum);

        try {
            final Future<?>[] futures = new Future<?>[threadNum];

            for (int i = 0; i < threadNum; i++) {
                futures[i] = executor.submit(() -> {
                    start.await();

                    for (int j = 0; j < 10; j++) {
                        final String token = realTimeLock.lock("k", 10_000, 0, 1);

                        try {
                            maxHolders.accumulateAndGet(holders.incrementAndGet(), Math::max);
                            Thread.sleep(1);
                            holders.decrementAndGet();
                        } finally {
                            realTimeLock.unlock("k", token);
                        }
                    }

                    return null;
                });
            }

            start.countDown();

            for (final Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxHolders.get());
        assertFalse(realTimeLock.isLocked("k"));
    }

    @Test
    public void test_unreachableStore() {
        store.disconnect();

        assertThrows(StoreAccessException.class, () -> storeLock.tryLock("k", 1000));
        assertThrows(StoreAccessException.class, () -> storeLock.lock("k", 1000, 100, 10));
    }

    @Test
    public void test_invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new StoreLock(null));
        assertThrows(IllegalArgumentException.class, () -> storeLock.tryLock(null, 1000));
        assertThrows(IllegalArgumentException.class, () -> storeLock.tryLock("k", 0));
        assertThrows(IllegalArgumentException.class, () -> storeLock.lock("k", 1000, 100, 0));
        assertThrows(IllegalArgumentException.class, () -> storeLock.unlock("k", null));
    }
}
