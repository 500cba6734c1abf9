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

/**
 * Capability set of the shared key/value store that region caches are layered on.
 * Every client process talks to the same store; the store is the only owner of durable state
 * (generation counters, items, lock entries). Implementations must provide each operation
 * atomically with respect to a single key. No operation spans more than one key.
 *
 * <br><br>
 * Contract highlights:
 * <ul>
 * <li>Times are in milliseconds. A {@code liveTime} of zero or less means the key never expires.</li>
 * <li>{@link #setIfAbsent(String, byte[], long)} is the only conditional write and backs both
 *     generation bootstrap and lock acquisition.</li>
 * <li>{@link #incr(String, long)} creates missing counters at {@code delta} and keeps an existing TTL.
 *     Counters are stored as ASCII decimal strings.</li>
 * <li>Any failure to reach the store, or a command the store rejects, is reported as a
 *     {@link StoreAccessException}. No other exception type escapes an implementation.</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RemoteStore store = new JRedisStore("localhost:6379");
 * store.set("greeting", "hello".getBytes(Charsets.UTF_8), 60000);
 * byte[] bytes = store.get("greeting");
 * long hits = store.incr("hits", 1);
 * Duration remaining = store.ttl("greeting");
 * }</pre>
 *
 * @see JRedisStore
 * @see LocalStore
 * @see RegionCacheClient
 */
public interface RemoteStore {

    /**
     * Default timeout for network operations in milliseconds (1000ms).
     */
    long DEFAULT_TIMEOUT = 1000;

    /**
     * Provider name of the Redis backed store.
     */
    String REDIS = "Redis";

    /**
     * Provider name of the in-process store.
     */
    String LOCAL = "Local";

    /**
     * Returns the server address(es) this store was created for.
     *
     * @return the server URL(s), never {@code null}
     */
    String serverUrl();

    /**
     * Reads the bytes stored under {@code key}.
     *
     * @param key the store key, must not be {@code null}
     * @return the stored bytes, or {@code null} if the key does not exist or has expired
     * @throws StoreAccessException if the store cannot be reached
     */
    byte[] get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value and TTL.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * store.set("abacus-cache:users:1:MQ==", bytes, 300000); // expires in 5 minutes
     * store.set("config", bytes, 0);                         // never expires
     * }</pre>
     *
     * @param key the store key, must not be {@code null}
     * @param value the bytes to store, must not be {@code null}
     * @param liveTime time-to-live in milliseconds, zero or negative for no expiration
     * @return {@code true} if the value was stored
     * @throws StoreAccessException if the store cannot be reached
     */
    boolean set(String key, byte[] value, long liveTime);

    /**
     * Atomically stores {@code value} under {@code key} only if the key does not exist.
     * Under concurrent calls for the same absent key exactly one caller gets {@code true}.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * // bootstrap a counter; whoever loses the race reads the winner's value
     * store.setIfAbsent("abacus-cache:users:generation", "1".getBytes(Charsets.UTF_8), 0);
     *
     * // take a lease for 30 seconds
     * boolean held = store.setIfAbsent("abacus-cache:users:lock:MQ==", token, 30000);
     * }</pre>
     *
     * @param key the store key, must not be {@code null}
     * @param value the bytes to store, must not be {@code null}
     * @param liveTime time-to-live in milliseconds, zero or negative for no expiration
     * @return {@code true} if and only if this call created the key
     * @throws StoreAccessException if the store cannot be reached
     */
    boolean setIfAbsent(String key, byte[] value, long liveTime);

    /**
     * Removes {@code key} if present. Removing a missing key is a no-op.
     *
     * @param key the store key, must not be {@code null}
     * @return {@code true} once the command completed
     * @throws StoreAccessException if the store cannot be reached
     */
    boolean delete(String key);

    /**
     * Atomically removes {@code key} only if it currently holds exactly {@code expected}.
     * Used to release a lease without touching a lease that was re-acquired by someone else
     * after the original one expired.
     *
     * @param key the store key, must not be {@code null}
     * @param expected the bytes the key must hold, must not be {@code null}
     * @return {@code true} if the key held {@code expected} and was removed
     * @throws StoreAccessException if the store cannot be reached
     */
    boolean deleteIfEquals(String key, byte[] expected);

    /**
     * Atomically adds {@code delta} to the counter stored under {@code key}.
     * A missing key is created with the value {@code delta} and no expiration;
     * an existing key keeps its TTL.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * long next = store.incr("abacus-cache:users:generation", 1);
     * }</pre>
     *
     * @param key the store key, must not be {@code null}
     * @param delta the amount to add
     * @return the value after the increment
     * @throws StoreAccessException if the store cannot be reached or the key does not hold a counter
     */
    long incr(String key, long delta);

    /**
     * Returns the remaining time-to-live of {@code key}.
     *
     * @param key the store key, must not be {@code null}
     * @return the remaining time-to-live, or {@code null} if the key does not exist or never expires
     * @throws StoreAccessException if the store cannot be reached
     */
    Duration ttl(String key);

    /**
     * Removes every key from the store. This affects all regions and all clients sharing the store.
     *
     * @throws StoreAccessException if the store cannot be reached
     * @throws UnsupportedOperationException if the implementation does not support flushing
     */
    void flushAll();

    /**
     * Releases the connections held by this store. Subsequent operations fail with
     * {@link StoreAccessException}.
     */
    void disconnect();
}
