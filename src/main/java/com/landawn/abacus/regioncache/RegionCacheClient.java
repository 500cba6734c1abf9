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

import java.io.Closeable;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ExceptionUtil;
import com.landawn.abacus.util.N;

/**
 * A client of the distributed region cache. It owns the connection to the shared store and the state every
 * region of this client shares: the last generation observed per region, the generation retry policy and the lock
 * primitive.
 *
 * <p>Two clients are independent even inside one JVM: each keeps its own view of the region generations, exactly
 * as two separate processes would.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RegionCacheConfig config = new RegionCacheConfig().keyPrefix("shop")
 *         .region("orders", new RegionSettings().expiration(99 * 60 * 1000L));
 *
 * try (RegionCacheClient client = RegionCacheFactory.createClient(new JRedisStore("localhost:6379"), config)) {
 *     RegionCache<Long, Order> orders = client.region("orders");
 *     orders.put(7L, order);
 * }
 * }</pre>
 *
 * @see RegionCacheFactory
 */
public class RegionCacheClient implements Closeable {

    static final Logger logger = LoggerFactory.getLogger(RegionCacheClient.class);

    private final RemoteStore store;

    private final Serializer serializer;

    private final RegionCacheConfig config;

    private final GenerationCache generations;

    private final GenerationSynchronizer synchronizer;

    private final StoreLock storeLock;

    private volatile boolean isClosed = false;

    /**
     *
     * @param store the shared store
     * @param serializer the value codec
     * @param config the client configuration
     * @throws IllegalArgumentException if any argument is null
     */
    public RegionCacheClient(final RemoteStore store, final Serializer serializer, final RegionCacheConfig config) {
        N.checkArgNotNull(store, "store");
        N.checkArgNotNull(serializer, "serializer");
        N.checkArgNotNull(config, "config");

        this.store = store;
        this.serializer = serializer;
        this.config = config;
        this.generations = new GenerationCache(config.maxLocalGenerations());
        this.synchronizer = new GenerationSynchronizer(config.maxGenerationRetries());
        this.storeLock = new StoreLock(store);
    }

    /**
     * Creates a view of the region {@code regionName}, configured with the settings registered for it in
     * {@link RegionCacheConfig} or the default settings. Every call returns a new instance; instances of the same
     * region share the data in the store and this client's generation view.
     *
     * @param <K> the type of the item ids
     * @param <V> the type of the cached values
     * @param regionName the region name, must not be null
     * @return a new region cache
     * @throws IllegalArgumentException if regionName is null
     * @throws IllegalStateException if the client has been closed
     */
    public <K, V> RegionCache<K, V> region(final String regionName) {
        assertNotClosed();
        N.checkArgNotNull(regionName, "regionName");

        final CacheNamespace namespace = new CacheNamespace(config.keyPrefix(), regionName, store, generations);

        return new RegionCache<>(namespace, synchronizer, storeLock, store, serializer, config.settingsFor(regionName).copy(),
                config.maxFailedNumForRetry(), config.retryDelay());
    }

    public RemoteStore store() {
        return store;
    }

    public Serializer serializer() {
        return serializer;
    }

    public RegionCacheConfig config() {
        return config;
    }

    public StoreLock storeLock() {
        return storeLock;
    }

    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Disconnects the store. Regions created by this client fail on every operation afterwards, as if the store
     * were unreachable.
     */
    @Override
    public synchronized void close() {
        if (isClosed) {
            return;
        }

        isClosed = true;

        try {
            store.disconnect();
        } catch (final StoreAccessException e) {
            if (logger.isWarnEnabled()) {
                logger.warn("Failed to disconnect from {}: {}", store.serverUrl(), ExceptionUtil.getErrorMessage(e));
            }
        }
    }

    protected void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("This client has been closed");
        }
    }
}
