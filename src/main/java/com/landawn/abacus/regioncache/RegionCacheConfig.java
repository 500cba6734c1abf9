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

import com.landawn.abacus.util.N;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Client-wide configuration of a {@link RegionCacheClient}: the key prefix shared by all regions,
 * default and per-region {@link RegionSettings}, the bound of the generation retry loop, the failure
 * circuit breaker, and the size of the client-local generation cache.
 *
 * <p><b>Default Values:</b></p>
 * <ul>
 * <li>keyPrefix: "abacus-cache"</li>
 * <li>defaultSettings: {@code new RegionSettings()}</li>
 * <li>maxGenerationRetries: 10</li>
 * <li>maxFailedNumForRetry: 100</li>
 * <li>retryDelay: 1000 ms</li>
 * <li>maxLocalGenerations: 10000 regions</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RegionCacheConfig config = new RegionCacheConfig().keyPrefix("myapp")
 *     .region("users", new RegionSettings().expiration(3600000))
 *     .region("sessions", new RegionSettings().expiration(1800000).lockLeaseTime(5000));
 *
 * RegionCacheClient client = RegionCacheFactory.createClient(new JRedisStore("localhost:6379"), config);
 * }</pre>
 *
 * @see RegionSettings
 * @see RegionCacheClient
 */
@Data
@Accessors(chain = true, fluent = true)
public class RegionCacheConfig {

    public static final String DEFAULT_KEY_PREFIX = "abacus-cache";

    public static final int DEFAULT_MAX_GENERATION_RETRIES = 10;

    /**
     * Default maximum number of consecutive failures before the store is skipped for {@link #retryDelay}.
     */
    public static final int DEFAULT_MAX_FAILED_NUM = 100;

    /**
     * Default delay in milliseconds before the store is tried again once the failure threshold is exceeded.
     */
    public static final long DEFAULT_RETRY_DELAY = 1000;

    public static final int DEFAULT_MAX_LOCAL_GENERATIONS = 10_000;

    /**
     * Prefix of every key written by the client; empty for none.
     */
    private String keyPrefix = DEFAULT_KEY_PREFIX;

    /**
     * Settings of regions without an explicit entry in {@link #regionSettings}.
     */
    private RegionSettings defaultSettings = new RegionSettings();

    private Map<String, RegionSettings> regionSettings = new ConcurrentHashMap<>();

    /**
     * Maximum attempts of one item operation when the region generation keeps moving.
     */
    private int maxGenerationRetries = DEFAULT_MAX_GENERATION_RETRIES;

    private int maxFailedNumForRetry = DEFAULT_MAX_FAILED_NUM;

    private long retryDelay = DEFAULT_RETRY_DELAY;

    /**
     * Number of regions whose last seen generation is remembered by the client.
     */
    private int maxLocalGenerations = DEFAULT_MAX_LOCAL_GENERATIONS;

    /**
     * Registers settings for one region.
     *
     * @param regionName the region name
     * @param settings the settings of that region
     * @return this config
     * @throws IllegalArgumentException if regionName or settings is null
     */
    public RegionCacheConfig region(final String regionName, final RegionSettings settings) {
        N.checkArgNotNull(regionName, "regionName");
        N.checkArgNotNull(settings, "settings");

        regionSettings.put(regionName, settings);

        return this;
    }

    /**
     * Sets the settings of regions without an explicit entry.
     *
     * @param defaultSettings the default settings, must not be null
     * @return this config
     * @throws IllegalArgumentException if defaultSettings is null
     */
    public RegionCacheConfig defaultSettings(final RegionSettings defaultSettings) {
        N.checkArgNotNull(defaultSettings, "defaultSettings");

        this.defaultSettings = defaultSettings;

        return this;
    }

    /**
     * Replaces the per-region settings.
     *
     * @param regionSettings settings by region name, must not be null
     * @return this config
     * @throws IllegalArgumentException if regionSettings is null
     */
    public RegionCacheConfig regionSettings(final Map<String, RegionSettings> regionSettings) {
        N.checkArgNotNull(regionSettings, "regionSettings");

        this.regionSettings = new ConcurrentHashMap<>(regionSettings);

        return this;
    }

    /**
     * Returns the settings that apply to a region: its own entry if registered, the defaults otherwise.
     *
     * @param regionName the region name
     * @return the effective settings, never {@code null}
     */
    public RegionSettings settingsFor(final String regionName) {
        final RegionSettings settings = regionSettings.get(regionName);

        return settings == null ? defaultSettings : settings;
    }
}
