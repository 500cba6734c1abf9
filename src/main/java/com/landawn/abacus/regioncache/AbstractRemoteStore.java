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

/**
 * Base class for {@link RemoteStore} implementations.
 * Keeps the server URL and provides key/counter encoding shared by all adapters.
 *
 * @see JRedisStore
 * @see LocalStore
 */
public abstract class AbstractRemoteStore implements RemoteStore {

    private final String serverUrl;

    /**
     * Creates a store bound to the given server URL.
     *
     * @param serverUrl the server address(es) of the store
     */
    protected AbstractRemoteStore(final String serverUrl) {
        this.serverUrl = serverUrl;
    }

    @Override
    public String serverUrl() {
        return serverUrl;
    }

    /**
     * Flushing is not supported unless an implementation overrides it.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public void flushAll() throws UnsupportedOperationException {
        throw new UnsupportedOperationException();
    }

    /**
     * Encodes a key as UTF-8 bytes.
     *
     * @param key the key to encode
     * @return the UTF-8 bytes of the key
     * @throws IllegalArgumentException if key is null
     */
    protected byte[] getKeyBytes(final String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        return key.getBytes(Charsets.UTF_8);
    }

    /**
     * Encodes a counter value the way counters are stored: ASCII decimal.
     *
     * @param value the counter value
     * @return the encoded counter
     */
    protected static byte[] encodeCounter(final long value) {
        return String.valueOf(value).getBytes(Charsets.UTF_8);
    }

    /**
     * Decodes a counter stored as ASCII decimal.
     *
     * @param key the key the counter was read from, for error reporting
     * @param bytes the stored bytes
     * @return the counter value
     * @throws StoreAccessException if the bytes are not a decimal integer
     */
    protected static long decodeCounter(final String key, final byte[] bytes) {
        try {
            return Long.parseLong(new String(bytes, Charsets.UTF_8));
        } catch (final NumberFormatException e) {
            throw new StoreAccessException("Value stored under key: " + key + " is not an integer", e);
        }
    }
}
