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

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.Charsets;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * A distributed lock built on the conditional write of a {@link RemoteStore}.
 * A lock is a store key created with {@link RemoteStore#setIfAbsent(String, byte[], long)}; its value is an opaque
 * token identifying one acquisition and its TTL is the lease. Because the store performs the conditional write
 * atomically, at most one acquirer holds a key at any time, whether the acquirers are threads of one process or
 * separate processes.
 *
 * <br><br>
 * Key features:
 * <ul>
 * <li>Blocking acquisition that retries at a fixed interval, with an optional acquire timeout</li>
 * <li>Lease expiry, so a holder that crashed cannot wedge the key forever</li>
 * <li>Token-checked release: a holder whose lease expired cannot release the next holder's lock</li>
 * </ul>
 *
 * <br>
 * Implementation notes:
 * <ul>
 * <li>Not reentrant - the same caller cannot acquire a key twice</li>
 * <li>No queue or fairness guarantees - it's a simple mutex</li>
 * <li>Store failures surface as {@link StoreAccessException}</li>
 * </ul>
 *
 * <br>
 * Example usage:
 * <pre>{@code
 * StoreLock lock = new StoreLock(new JRedisStore("localhost:6379"));
 *
 * String token = lock.lock("orders:42", 30000, 5000, 10);   // 30s lease, wait at most 5s
 * try {
 *     performExclusiveOperation();
 * } finally {
 *     lock.unlock("orders:42", token);
 * }
 * }</pre>
 *
 * <br>
 * Thread Safety: This class is thread-safe. Multiple threads can safely call methods
 * on the same instance.
 *
 * @see RemoteStore#setIfAbsent(String, byte[], long)
 * @see RemoteStore#deleteIfEquals(String, byte[])
 */
public final class StoreLock {

    static final Logger logger = LoggerFactory.getLogger(StoreLock.class);

    private final RemoteStore store;

    /**
     * Creates a lock that coordinates through the given store.
     *
     * @param store the shared store, must not be null
     * @throws IllegalArgumentException if store is null
     */
    public StoreLock(final RemoteStore store) {
        N.checkArgNotNull(store, "store");

        this.store = store;
    }

    /**
     * Makes a single attempt to acquire {@code key}.
     *
     * @param key the lock key, must not be null
     * @param leaseTime the lease in milliseconds, must be positive
     * @return the token of the acquired lock, or {@code null} if the key is held by someone else
     * @throws IllegalArgumentException if key is null or leaseTime is not positive
     * @throws StoreAccessException if the store cannot be reached
     */
    public String tryLock(final String key, final long leaseTime) {
        N.checkArgNotNull(key, "key");
        N.checkArgPositive(leaseTime, "leaseTime");

        final String token = Strings.uuid();

        return store.setIfAbsent(key, token.getBytes(Charsets.UTF_8), leaseTime) ? token : null;
    }

    /**
     * Acquires {@code key}, waiting until it is free.
     * Each failed attempt is followed by a pause of {@code retryInterval} milliseconds (shortened so the
     * timeout is not overshot).
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * // wait up to 5 seconds
     * String token = lock.lock("orders:42", 30000, 5000, 10);
     *
     * // wait as long as it takes
     * String token2 = lock.lock("orders:43", 30000, 0, 10);
     * }</pre>
     *
     * @param key the lock key, must not be null
     * @param leaseTime the lease in milliseconds, must be positive
     * @param acquireTimeout the maximum wait in milliseconds; zero or negative waits indefinitely
     * @param retryInterval the pause between two attempts in milliseconds, must be positive
     * @return the token identifying this acquisition; pass it to {@link #unlock(String, String)}
     * @throws IllegalArgumentException if key is null, or leaseTime or retryInterval is not positive
     * @throws LockAcquisitionException if the timeout elapsed or the thread was interrupted while waiting
     * @throws StoreAccessException if the store cannot be reached
     */
    public String lock(final String key, final long leaseTime, final long acquireTimeout, final long retryInterval) {
        N.checkArgNotNull(key, "key");
        N.checkArgPositive(leaseTime, "leaseTime");
        N.checkArgPositive(retryInterval, "retryInterval");

        final String token = Strings.uuid();
        final byte[] tokenBytes = token.getBytes(Charsets.UTF_8);
        final long deadline = acquireTimeout > 0 ? System.currentTimeMillis() + acquireTimeout : Long.MAX_VALUE;
        int attempts = 0;

        while (true) {
            attempts++;

            if (store.setIfAbsent(key, tokenBytes, leaseTime)) {
                if (attempts > 1 && logger.isDebugEnabled()) {
                    logger.debug("Acquired lock {} after {} attempts", key, attempts);
                }

                return token;
            }

            final long remaining = deadline - System.currentTimeMillis();

            if (remaining <= 0) {
                throw new LockAcquisitionException("Failed to acquire lock: " + key + " within " + acquireTimeout + " ms");
            }

            try {
                Thread.sleep(Math.min(retryInterval, remaining));
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while waiting for lock: " + key, e);
            }
        }
    }

    /**
     * Releases {@code key} if it is still held with {@code token}.
     * Releasing a lock whose lease expired, or that is now held by another acquisition, does nothing.
     *
     * @param key the lock key, must not be null
     * @param token the token returned when the lock was acquired, must not be null
     * @return {@code true} if the lock was held with the token and has been released
     * @throws IllegalArgumentException if key or token is null
     * @throws StoreAccessException if the store cannot be reached
     */
    public boolean unlock(final String key, final String token) {
        N.checkArgNotNull(key, "key");
        N.checkArgNotNull(token, "token");

        final boolean released = store.deleteIfEquals(key, token.getBytes(Charsets.UTF_8));

        if (!released && logger.isDebugEnabled()) {
            logger.debug("Lock {} was no longer held by token {}", key, token);
        }

        return released;
    }

    /**
     * Checks whether anyone currently holds {@code key}.
     *
     * @param key the lock key, must not be null
     * @return {@code true} if the key is held
     * @throws IllegalArgumentException if key is null
     * @throws StoreAccessException if the store cannot be reached
     */
    public boolean isLocked(final String key) {
        N.checkArgNotNull(key, "key");

        return store.get(key) != null;
    }
}
