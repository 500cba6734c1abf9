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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ExceptionUtil;
import com.landawn.abacus.util.N;

/**
 * One named region of a distributed cache, as seen by one client.
 * Items are stored in a shared {@link RemoteStore} under keys that embed the region's current generation, so a
 * {@link #clear()} is a single atomic increment of the generation counter rather than a scan over the region's items.
 * Items written under an older generation become unreachable at once and disappear through their own expiration.
 *
 * <p>Every item operation runs through the {@link GenerationSynchronizer}: it is executed against the key of the
 * generation this client believes current, then the store's generation is re-read, and the operation is repeated
 * under the newer generation if another client cleared the region in the meantime.</p>
 *
 * <p><b>Failure Policy:</b></p>
 * <ul>
 * <li>The store being unreachable never fails a caller: {@code get} returns {@code null}, the other operations return normally</li>
 * <li>Failures are logged at warn level</li>
 * <li>After more than {@code maxFailedNumForRetry} consecutive failures, {@code get}, {@code put} and {@code remove}
 *     skip the store for {@code retryDelay} milliseconds after the last failure</li>
 * <li>A stored value that cannot be decoded is an error of the caller's data and is thrown as {@link SerializationException}</li>
 * <li>Lock acquisition that runs out of time is thrown as {@link LockAcquisitionException}</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RegionCacheClient client = RegionCacheFactory.createClient("Redis(localhost:6379)");
 * RegionCache<Long, Person> people = client.region("people");
 *
 * people.put(42L, new Person("Ann", 31));
 * Person ann = people.get(42L);
 *
 * people.lock(42L);
 * try {
 *     people.put(42L, ann.setAge(32));
 * } finally {
 *     people.unlock(42L);
 * }
 *
 * people.clear();   // every client now misses on every item of the region
 * }</pre>
 *
 * <p>This class is thread-safe. Instances are created with {@link RegionCacheClient#region(String)}.</p>
 *
 * @param <K> the type of the item ids
 * @param <V> the type of the cached values
 * @see RegionCacheClient
 * @see CacheNamespace
 */
public class RegionCache<K, V> {

    static final Logger logger = LoggerFactory.getLogger(RegionCache.class);

    private final CacheNamespace namespace;

    private final GenerationSynchronizer synchronizer;

    private final StoreLock storeLock;

    private final RemoteStore store;

    private final Serializer serializer;

    private final RegionSettings settings;

    private final int maxFailedNumForRetry;

    private final long retryDelay;

    private final Map<String, String> heldLocks = new ConcurrentHashMap<>();

    private final AtomicInteger failedCounter = new AtomicInteger();

    private final AtomicLong lastFailedTime = new AtomicLong(0);

    private volatile boolean isClosed = false;

    RegionCache(final CacheNamespace namespace, final GenerationSynchronizer synchronizer, final StoreLock storeLock, final RemoteStore store,
            final Serializer serializer, final RegionSettings settings, final int maxFailedNumForRetry, final long retryDelay) {
        N.checkArgNotNull(namespace, "namespace");
        N.checkArgNotNull(synchronizer, "synchronizer");
        N.checkArgNotNull(storeLock, "storeLock");
        N.checkArgNotNull(store, "store");
        N.checkArgNotNull(serializer, "serializer");
        N.checkArgNotNull(settings, "settings");

        this.namespace = namespace;
        this.synchronizer = synchronizer;
        this.storeLock = storeLock;
        this.store = store;
        this.serializer = serializer;
        this.settings = settings;
        this.maxFailedNumForRetry = maxFailedNumForRetry;
        this.retryDelay = retryDelay;
    }

    /**
     * Retrieves the value cached for {@code id} under the region's current generation.
     *
     * <p>A value written before the last {@link #clear()}, by any client, is never returned: the lookup is
     * confirmed against the store's generation and repeated under the newer generation if it moved.</p>
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * Person p = people.get(42L);
     * if (p == null) {
     *     // not cached, expired, cleared, or the store is unavailable
     *     p = repository.load(42L);
     *     people.put(42L, p);
     * }
     * }</pre>
     *
     * @param id the item id, must not be null
     * @return the cached value, or {@code null} on a miss or when the store is unavailable
     * @throws IllegalArgumentException if id is null
     * @throws IllegalStateException if this region has been destroyed
     * @throws SerializationException if the stored bytes cannot be decoded
     */
    public V get(final K id) {
        assertNotClosed();
        N.checkArgNotNull(id, "id");

        if (isCircuitOpen()) {
            return null;
        }

        byte[] bytes = null;

        try {
            bytes = synchronizer.execute(namespace, id, store::get);
            onSuccess();
        } catch (final StoreAccessException | GenerationConflictException e) {
            onFailure("get", id, e);
        }

        return bytes == null ? null : serializer.deserialize(bytes);
    }

    /**
     * Caches {@code value} for {@code id} under the region's current generation, replacing any previous value.
     * The entry expires after the region's {@link RegionSettings#expiration() expiration}.
     *
     * <p>If another client clears the region while the write is in flight, the write is repeated under the new
     * generation, so it is never lost to a concurrent clear.</p>
     *
     * @param id the item id, must not be null
     * @param value the value to cache, must not be null
     * @throws IllegalArgumentException if id or value is null
     * @throws IllegalStateException if this region has been destroyed
     * @throws SerializationException if the value cannot be encoded
     */
    public void put(final K id, final V value) {
        assertNotClosed();
        N.checkArgNotNull(id, "id");
        N.checkArgNotNull(value, "value");

        final byte[] bytes = serializer.serialize(value);

        if (isCircuitOpen()) {
            return;
        }

        final long expiration = settings.expiration();

        try {
            synchronizer.execute(namespace, id, key -> {
                store.set(key, bytes, expiration);
                return store.setIfAbsent(namespace.keysKey(), AbstractRemoteStore.encodeCounter(namespace.lastSeenGeneration()), expiration);
            });

            onSuccess();
        } catch (final StoreAccessException | GenerationConflictException e) {
            onFailure("put", id, e);
        }
    }

    /**
     * Removes the value cached for {@code id} under the region's current generation.
     * Removing an id that is not cached is a no-op.
     *
     * @param id the item id, must not be null
     * @throws IllegalArgumentException if id is null
     * @throws IllegalStateException if this region has been destroyed
     */
    public void remove(final K id) {
        assertNotClosed();
        N.checkArgNotNull(id, "id");

        if (isCircuitOpen()) {
            return;
        }

        try {
            synchronizer.execute(namespace, id, store::delete);
            onSuccess();
        } catch (final StoreAccessException | GenerationConflictException e) {
            onFailure("remove", id, e);
        }
    }

    /**
     * Invalidates every item of the region for every client by advancing the region's generation once.
     * No item is enumerated or deleted: entries of the previous generation are left to expire.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * people.put(1L, ann);
     * people.clear();
     * people.get(1L);   // null, here and in every other client
     * }</pre>
     *
     * @throws IllegalStateException if this region has been destroyed
     */
    public void clear() {
        assertNotClosed();

        try {
            final long generation = namespace.advanceGeneration();
            store.delete(namespace.keysKey());

            if (logger.isDebugEnabled()) {
                logger.debug("Cleared region {}, generation is now {}", namespace.regionName(), generation);
            }
        } catch (final StoreAccessException e) {
            onFailure("clear", null, e);
        }
    }

    /**
     * Acquires the distributed lock of {@code id}, waiting up to the region's
     * {@link RegionSettings#lockAcquireTimeout() acquire timeout}.
     * The lock is independent of the generation: clearing the region does not release it.
     *
     * <p>Locks are exclusive between threads sharing this instance as well as between clients.
     * The holder must call {@link #unlock(Object)}; otherwise the lock lapses after the region's
     * {@link RegionSettings#lockLeaseTime() lease time}.</p>
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * people.lock(42L);
     * try {
     *     Person p = people.get(42L);
     *     people.put(42L, p.setAge(p.getAge() + 1));
     * } finally {
     *     people.unlock(42L);
     * }
     * }</pre>
     *
     * @param id the item id, must not be null
     * @throws IllegalArgumentException if id is null
     * @throws IllegalStateException if this region has been destroyed
     * @throws LockAcquisitionException if the lock could not be acquired in time or the thread was interrupted
     */
    public void lock(final K id) {
        assertNotClosed();
        N.checkArgNotNull(id, "id");

        final String lockKey = namespace.lockKey(id);

        try {
            final String token = storeLock.lock(lockKey, settings.lockLeaseTime(), settings.lockAcquireTimeout(), settings.lockRetryInterval());
            heldLocks.put(lockKey, token);
        } catch (final StoreAccessException e) {
            onFailure("lock", id, e);
        }
    }

    /**
     * Releases the distributed lock of {@code id} held through this instance.
     * Unlocking an id this instance does not hold, or whose lease already lapsed, is a no-op.
     *
     * @param id the item id, must not be null
     * @throws IllegalArgumentException if id is null
     * @throws IllegalStateException if this region has been destroyed
     */
    public void unlock(final K id) {
        assertNotClosed();
        N.checkArgNotNull(id, "id");

        final String lockKey = namespace.lockKey(id);
        final String token = heldLocks.remove(lockKey);

        if (token == null) {
            if (logger.isDebugEnabled()) {
                logger.debug("Lock of item {} in region {} is not held by this instance", id, namespace.regionName());
            }

            return;
        }

        try {
            storeLock.unlock(lockKey, token);
        } catch (final StoreAccessException e) {
            onFailure("unlock", id, e);
        }
    }

    /**
     * Releases this client's view of the region. The shared state in the store is left untouched: the region keeps
     * its generation and items, and other clients are not affected.
     * Locks still held through this instance are not released in the store and lapse with their lease.
     */
    public void destroy() {
        if (isClosed) {
            return;
        }

        isClosed = true;
        heldLocks.clear();
    }

    /**
     * @return {@code true} if {@link #destroy()} has been called
     */
    public boolean isClosed() {
        return isClosed;
    }

    /**
     * @return the name of the region
     */
    public String regionName() {
        return namespace.regionName();
    }

    /**
     * @return the namespace deriving the store keys of this region
     */
    public CacheNamespace namespace() {
        return namespace;
    }

    /**
     * @return the settings of this region
     */
    public RegionSettings settings() {
        return settings;
    }

    private boolean isCircuitOpen() {
        return (failedCounter.get() > maxFailedNumForRetry) && ((System.currentTimeMillis() - lastFailedTime.get()) < retryDelay);
    }

    private void onSuccess() {
        failedCounter.set(0);
        lastFailedTime.set(0);
    }

    private void onFailure(final String operation, final Object id, final RuntimeException e) {
        if (e instanceof StoreAccessException) {
            lastFailedTime.set(System.currentTimeMillis());
            failedCounter.incrementAndGet();
        }

        if (logger.isWarnEnabled()) {
            logger.warn("Failed to {} item {} in region {}: {}", operation, id, namespace.regionName(), ExceptionUtil.getErrorMessage(e));
        }
    }

    protected void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("Region " + namespace.regionName() + " has been destroyed");
        }
    }
}
