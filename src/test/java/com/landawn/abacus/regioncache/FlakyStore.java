/*
 * Copyright (c) 2026, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.regioncache;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a {@link LocalStore} and fails every call while {@link #down} is set, counting the calls that reached it.
 */
class FlakyStore extends AbstractRemoteStore {

    final LocalStore delegate = new LocalStore();

    final AtomicBoolean down = new AtomicBoolean();

    final AtomicInteger calls = new AtomicInteger();

    FlakyStore() {
        super("flaky");
    }

    @Override
    public byte[] get(final String key) {
        check();
        return delegate.get(key);
    }

    @Override
    public boolean set(final String key, final byte[] value, final long liveTime) {
        check();
        return delegate.set(key, value, liveTime);
    }

    @Override
    public boolean setIfAbsent(final String key, final byte[] value, final long liveTime) {
        check();
        return delegate.setIfAbsent(key, value, liveTime);
    }

    @Override
    public boolean delete(final String key) {
        check();
        return delegate.delete(key);
    }

    @Override
    public boolean deleteIfEquals(final String key, final byte[] expected) {
        check();
        return delegate.deleteIfEquals(key, expected);
    }

    @Override
    public long incr(final String key, final long delta) {
        check();
        return delegate.incr(key, delta);
    }

    @Override
    public Duration ttl(final String key) {
        check();
        return delegate.ttl(key);
    }

    @Override
    public void disconnect() {
        delegate.disconnect();
    }

    private void check() {
        calls.incrementAndGet();

        if (down.get()) {
            throw new StoreAccessException("Connection refused: flaky");
        }
    }
}
