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

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * Per-region settings: item expiration and distributed lock timing. All times are in milliseconds.
 * Accessors are fluent and setters chain, so settings read as a single expression.
 *
 * <p><b>Default Values:</b></p>
 * <ul>
 * <li>expiration: 300000 (5 minutes)</li>
 * <li>lockLeaseTime: 30000 (30 seconds)</li>
 * <li>lockAcquireTimeout: 30000 (30 seconds); zero or less waits until the lock is acquired</li>
 * <li>lockRetryInterval: 10</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RegionSettings settings = new RegionSettings().expiration(99 * 60 * 1000L).lockLeaseTime(10000);
 * }</pre>
 *
 * @see RegionCacheConfig
 */
@Data
@Accessors(chain = true, fluent = true)
public class RegionSettings {

    public static final long DEFAULT_EXPIRATION = 300_000;

    public static final long DEFAULT_LOCK_LEASE_TIME = 30_000;

    public static final long DEFAULT_LOCK_ACQUIRE_TIMEOUT = 30_000;

    public static final long DEFAULT_LOCK_RETRY_INTERVAL = 10;

    /**
     * Time-to-live of every item written to the region.
     */
    private long expiration = DEFAULT_EXPIRATION;

    /**
     * Time-to-live of a lock entry. Must exceed the longest expected critical section.
     */
    private long lockLeaseTime = DEFAULT_LOCK_LEASE_TIME;

    /**
     * Maximum time {@link RegionCache#lock(Object)} waits; zero or less waits indefinitely.
     */
    private long lockAcquireTimeout = DEFAULT_LOCK_ACQUIRE_TIMEOUT;

    /**
     * Pause between two lock acquisition attempts.
     */
    private long lockRetryInterval = DEFAULT_LOCK_RETRY_INTERVAL;

    /**
     * Returns a copy of these settings.
     *
     * @return a new instance with the same values
     */
    public RegionSettings copy() {
        return new RegionSettings().expiration(expiration)
                .lockLeaseTime(lockLeaseTime)
                .lockAcquireTimeout(lockAcquireTimeout)
                .lockRetryInterval(lockRetryInterval);
    }
}
