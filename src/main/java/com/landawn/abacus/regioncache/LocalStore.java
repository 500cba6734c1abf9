/*
 * Copyright (C) 2026 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.regioncache;

import java.time.Duration;
import java.util.Arrays;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * An in-process {@link RemoteStore} backed by a Caffeine cache with per-entry expiration.
 * All clients that share one instance see the same keys, which makes it a drop-in store for
 * single-JVM deployments and for exercising the region protocol without a Redis server.
 *
 * <p>
 * Each entry remembers the ticker time at which it expires; Caffeine's variable expiration evicts it
 * at that point. {@link #incr(String, long)} keeps the expiration of an existing entry, the same way
 * Redis {@code INCRBY} does. Time is read from the {@link Ticker} given at construction, so tests can
 * move time forward explicitly.
 * </p>
 *
 * <p>
 * After {@link #disconnect()} every operation throws {@link StoreAccessException}, which is how an
 * unreachable server looks to the caller.
 * </p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * LocalStore store = new LocalStore();
 * RegionCacheClient client1 = RegionCacheFactory.createClient(store);
 * RegionCacheClient client2 = RegionCacheFactory.createClient(store);   // shares the data of client1
 * }</pre>
 *
 * @see AbstractRemoteStore
 * @see com.github.benmanes.caffeine.cache.Caffeine
 */
public class LocalStore extends AbstractRemoteStore {

    /**
     * Default maximum number of keys held before Caffeine starts evicting.
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 1_000_000;

    private final Cache<String, Entry> cacheImpl;

    private final Ticker ticker;

    private volatile boolean isDisconnected = false;

    /**
     * Creates a store with the default capacity and the system ticker.
     */
    public LocalStore() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    /**
     * Creates a store with the given capacity and time source.
     *
     * @param maximumSize the maximum number of keys
     * @param ticker the time source used for expiration, in nanoseconds
     * @throws IllegalArgumentException if ticker is null
     */
    public LocalStore(final long maximumSize, final Ticker ticker) {
        super(LOCAL);

        if (ticker == null) {
            throw new IllegalArgumentException("Ticker cannot be null");
        }

        this.ticker = ticker;
        this.cacheImpl = Caffeine.newBuilder().maximumSize(maximumSize).ticker(ticker).expireAfter(new EntryExpiry()).build();
    }

    @Override
    public byte[] get(final String key) {
        assertConnected();

        final Entry entry = cacheImpl.getIfPresent(checkKey(key));

        return entry == null ? null : entry.value().clone();
    }

    @Override
    public boolean set(final String key, final byte[] value, final long liveTime) {
        assertConnected();

        cacheImpl.put(checkKey(key), new Entry(value.clone(), expireAt(liveTime)));

        return true;
    }

    @Override
    public boolean setIfAbsent(final String key, final byte[] value, final long liveTime) {
        assertConnected();

        return cacheImpl.asMap().putIfAbsent(checkKey(key), new Entry(value.clone(), expireAt(liveTime))) == null;
    }

    @Override
    public boolean delete(final String key) {
        assertConnected();

        cacheImpl.invalidate(checkKey(key));

        return true;
    }

    @Override
    public boolean deleteIfEquals(final String key, final byte[] expected) {
        assertConnected();

        final Entry entry = cacheImpl.getIfPresent(checkKey(key));

        // remove(key, entry) only succeeds if the mapping is still this exact instance
        return entry != null && Arrays.equals(entry.value(), expected) && cacheImpl.asMap().remove(key, entry);
    }

    @Override
    public long incr(final String key, final long delta) {
        assertConnected();

        final Entry updated = cacheImpl.asMap()
                .compute(checkKey(key), (k, entry) -> entry == null ? new Entry(encodeCounter(delta), 0)
                        : new Entry(encodeCounter(decodeCounter(k, entry.value()) + delta), entry.expireAt()));

        return decodeCounter(key, updated.value());
    }

    @Override
    public Duration ttl(final String key) {
        assertConnected();

        final Entry entry = cacheImpl.getIfPresent(checkKey(key));

        if (entry == null || entry.expireAt() == 0) {
            return null;
        }

        return Duration.ofNanos(Math.max(0, entry.expireAt() - ticker.read()));
    }

    @Override
    public void flushAll() {
        assertConnected();

        cacheImpl.invalidateAll();
    }

    /**
     * Marks this store as unreachable. Stored data is kept but no longer accessible.
     */
    @Override
    public void disconnect() {
        isDisconnected = true;
    }

    /**
     * Returns the number of keys currently held, including entries whose expiration is pending.
     *
     * @return the estimated number of keys
     */
    public long size() {
        return cacheImpl.estimatedSize();
    }

    private long expireAt(final long liveTime) {
        // 0 marks "never expires"; guard the (unlikely) case of a ticker reading that lands on 0
        return liveTime > 0 ? Math.max(1, ticker.read() + liveTime * 1_000_000L) : 0;
    }

    private String checkKey(final String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        return key;
    }

    private void assertConnected() {
        if (isDisconnected) {
            throw new StoreAccessException("Local store has been disconnected");
        }
    }

    record Entry(byte[] value, long expireAt) {
    }

    static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(final String key, final Entry entry, final long currentTime) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterUpdate(final String key, final Entry entry, final long currentTime, final long currentDuration) {
            return remaining(entry, currentTime);
        }

        @Override
        public long expireAfterRead(final String key, final Entry entry, final long currentTime, final long currentDuration) {
            return currentDuration;
        }

        private static long remaining(final Entry entry, final long currentTime) {
            return entry.expireAt() == 0 ? Long.MAX_VALUE : Math.max(0, entry.expireAt() - currentTime);
        }
    }
}
