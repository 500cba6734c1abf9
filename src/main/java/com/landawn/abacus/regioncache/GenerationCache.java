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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * The generation each region had when this client last looked, keyed by region name.
 * One instance per {@link RegionCacheClient}; it is never shared between clients and never persisted.
 * Values are advisory: every operation re-validates them against the store, and an entry evicted because
 * of the size bound is simply read again.
 */
final class GenerationCache {

    private final Cache<String, Long> generations;

    GenerationCache(final int maximumSize) {
        generations = Caffeine.newBuilder().maximumSize(maximumSize).build();
    }

    /**
     * @return the last observed generation, or {@code null} if the region was never seen or was evicted
     */
    Long get(final String regionName) {
        return generations.getIfPresent(regionName);
    }

    void put(final String regionName, final long generation) {
        generations.put(regionName, generation);
    }
}
