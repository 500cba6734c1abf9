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

import com.landawn.abacus.util.Charsets;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Derives every physical key of one region and owns the region's generation counter.
 *
 * <p><b>Key layout</b> ({@code <prefix>:} is omitted when the prefix is empty):</p>
 * <ul>
 * <li>generation: {@code <prefix>:<region>:generation}</li>
 * <li>key registry: {@code <prefix>:<region>:keys}</li>
 * <li>item: {@code <prefix>:<region>:<generation>:<base64(id)>}</li>
 * <li>lock: {@code <prefix>:<region>:lock:<base64(id)>}</li>
 * </ul>
 *
 * The id is Base64 encoded, so it never contains {@code ':'} and the generation is always the second to last
 * segment of an item key. Two generations of one region, or two regions, therefore never share an item key,
 * which is what lets a clear skip enumerating the items. Lock keys do not contain the generation: a lock taken
 * before a clear is still released by its holder after the clear.
 *
 * <p>
 * The generation lives only in the store. The value this client last observed is kept in the client's
 * {@link GenerationCache}, and every method that reads or changes the store counter refreshes it.
 * </p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * CacheNamespace namespace = regionCache.namespace();
 * long generation = namespace.currentGeneration();     // e.g. 1
 * String key = namespace.itemKey(generation, 999);     // "abacus-cache:region:1:OTk5"
 * }</pre>
 */
public final class CacheNamespace {

    static final String GENERATION_SUFFIX = "generation";

    static final String KEYS_SUFFIX = "keys";

    static final String LOCK_SEGMENT = "lock";

    private static final byte[] INITIAL_GENERATION = AbstractRemoteStore.encodeCounter(1);

    private final String regionName;

    private final String regionKey;

    private final RemoteStore store;

    private final GenerationCache generations;

    CacheNamespace(final String keyPrefix, final String regionName, final RemoteStore store, final GenerationCache generations) {
        N.checkArgNotNull(regionName, "regionName");

        this.regionName = regionName;
        this.regionKey = Strings.isEmpty(keyPrefix) ? regionName : keyPrefix + ":" + regionName;
        this.store = store;
        this.generations = generations;
    }

    /**
     * @return the name of the region
     */
    public String regionName() {
        return regionName;
    }

    /**
     * @return the store key of the region's generation counter
     */
    public String generationKey() {
        return regionKey + ":" + GENERATION_SUFFIX;
    }

    /**
     * @return the store key of the region key registry, which marks that the region has live items
     */
    public String keysKey() {
        return regionKey + ":" + KEYS_SUFFIX;
    }

    /**
     * Derives the item key of {@code id} under {@code generation}.
     *
     * @param generation the region generation
     * @param id the logical item id
     * @return the store key of the item
     * @throws IllegalArgumentException if id is null
     */
    public String itemKey(final long generation, final Object id) {
        return regionKey + ":" + generation + ":" + encodeId(id);
    }

    /**
     * Derives the item key of {@code id} under the generation this client currently holds for the region.
     *
     * @param id the logical item id
     * @return the store key of the item
     * @throws StoreAccessException if the generation has to be bootstrapped and the store cannot be reached
     */
    public String itemKey(final Object id) {
        return itemKey(localGeneration(), id);
    }

    /**
     * Derives the lock key of {@code id}. It is the same for every generation.
     *
     * @param id the logical item id
     * @return the store key of the lock entry
     */
    public String lockKey(final Object id) {
        return regionKey + ":" + LOCK_SEGMENT + ":" + encodeId(id);
    }

    /**
     * Creates the generation counter with the value {@code 1} if it does not exist yet, then reads it.
     * When several clients race on first use only one conditional write succeeds and all of them read the
     * same value back.
     *
     * @return the generation now in the store
     * @throws StoreAccessException if the store cannot be reached
     */
    public long ensureGeneration() {
        final String generationKey = generationKey();

        store.setIfAbsent(generationKey, INITIAL_GENERATION, 0);

        final byte[] bytes = store.get(generationKey);

        // flushed between the two calls; the counter we just tried to create is the best answer
        final long generation = bytes == null ? 1 : AbstractRemoteStore.decodeCounter(generationKey, bytes);

        generations.put(regionName, generation);

        return generation;
    }

    /**
     * Reads the authoritative generation from the store, bootstrapping it if it is missing.
     * A missing counter after the client has already seen a larger value means the store was reset externally;
     * the client then follows the store back to {@code 1}.
     *
     * @return the generation now in the store
     * @throws StoreAccessException if the store cannot be reached
     */
    public long currentGeneration() {
        final String generationKey = generationKey();
        final byte[] bytes = store.get(generationKey);

        if (bytes == null) {
            return ensureGeneration();
        }

        final long generation = AbstractRemoteStore.decodeCounter(generationKey, bytes);

        generations.put(regionName, generation);

        return generation;
    }

    /**
     * Atomically increments the generation counter. Every item key of the previous generation becomes
     * unreachable at once.
     *
     * @return the new generation
     * @throws StoreAccessException if the store cannot be reached
     */
    public long advanceGeneration() {
        final long generation = store.incr(generationKey(), 1);

        generations.put(regionName, generation);

        return generation;
    }

    /**
     * Returns the generation this client last observed, bootstrapping it from the store on first use.
     *
     * @return the client-local generation
     * @throws StoreAccessException if the generation has to be bootstrapped and the store cannot be reached
     */
    public long localGeneration() {
        final Long generation = generations.get(regionName);

        return generation == null ? ensureGeneration() : generation;
    }

    /**
     * Returns the generation this client last observed without contacting the store.
     *
     * @return the client-local generation, or {@code 0} if this client has not seen the region yet
     */
    public long lastSeenGeneration() {
        final Long generation = generations.get(regionName);

        return generation == null ? 0 : generation;
    }

    private static String encodeId(final Object id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }

        return Strings.base64Encode(N.stringOf(id).getBytes(Charsets.UTF_8));
    }
}
