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

import static com.landawn.abacus.regioncache.RemoteStore.DEFAULT_TIMEOUT;

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Numbers;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.TypeAttrParser;

/**
 * Factory methods for {@link RegionCacheClient}.
 *
 * <p>A client can be built around a store instance, or from a provider specification string:</p>
 * <ul>
 * <li>{@code Redis(url)}, {@code Redis(url, keyPrefix)}, {@code Redis(url, keyPrefix, timeout)}: a {@link JRedisStore}
 *     over one or more space separated {@code host:port} addresses</li>
 * <li>{@code Local}, {@code Local(keyPrefix)}: an in-process {@link LocalStore}</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RegionCacheClient shared = RegionCacheFactory.createClient("Redis(redis1:6379 redis2:6379,shop,3000)");
 * RegionCacheClient embedded = RegionCacheFactory.createClient("Local(shop)");
 * }</pre>
 *
 * <p>Clients created without an explicit {@link Serializer} use {@link KryoSerializer}, which needs the JVM to be
 * started with the {@code --add-opens} flags listed on that class (at least {@code java.base/java.io},
 * {@code java.base/java.lang}, {@code java.base/java.util}, {@code java.base/java.net}, {@code java.base/java.time}
 * and {@code java.sql/java.sql}, each opened to {@code ALL-UNNAMED}).</p>
 */
public final class RegionCacheFactory {

    private RegionCacheFactory() {
    }

    /**
     * Creates a client with the default {@link KryoSerializer} and default configuration.
     *
     * @param store the shared store
     * @return a new client
     */
    public static RegionCacheClient createClient(final RemoteStore store) {
        return createClient(store, new RegionCacheConfig());
    }

    /**
     * Creates a client with the default {@link KryoSerializer}.
     *
     * @param store the shared store
     * @param config the client configuration
     * @return a new client
     */
    public static RegionCacheClient createClient(final RemoteStore store, final RegionCacheConfig config) {
        return createClient(store, new KryoSerializer(), config);
    }

    /**
     *
     * @param store the shared store
     * @param serializer the value codec
     * @param config the client configuration
     * @return a new client
     */
    public static RegionCacheClient createClient(final RemoteStore store, final Serializer serializer, final RegionCacheConfig config) {
        return new RegionCacheClient(store, serializer, config);
    }

    /**
     * Creates a client from a provider specification such as {@code "Redis(localhost:6379,shop,3000)"}.
     *
     * @param provider the provider specification
     * @return a new client
     * @throws IllegalArgumentException if the provider is unknown or its parameters are invalid
     */
    public static RegionCacheClient createClient(final String provider) {
        N.checkArgNotNull(provider, "provider");

        final TypeAttrParser attrResult = TypeAttrParser.parse(provider);
        final String[] parameters = attrResult.getParameters() == null ? new String[0] : attrResult.getParameters();
        final String className = attrResult.getClassName();

        if (RemoteStore.REDIS.equalsIgnoreCase(className)) {
            if (N.isEmpty(parameters)) {
                throw new IllegalArgumentException("Invalid provider specification: missing server url");
            }

            final String url = parameters[0];

            if (parameters.length == 1) {
                return createClient(new JRedisStore(url, DEFAULT_TIMEOUT));
            } else if (parameters.length == 2) {
                return createClient(new JRedisStore(url, DEFAULT_TIMEOUT), new RegionCacheConfig().keyPrefix(parameters[1]));
            } else if (parameters.length == 3) {
                final long timeout;

                try {
                    timeout = Numbers.toLong(parameters[2]);
                } catch (final NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid timeout parameter: " + parameters[2], e);
                }

                return createClient(new JRedisStore(url, timeout), new RegionCacheConfig().keyPrefix(parameters[1]));
            } else {
                throw new IllegalArgumentException("Unsupported parameters: " + Strings.join(parameters));
            }
        } else if (RemoteStore.LOCAL.equalsIgnoreCase(className)) {
            if (N.isEmpty(parameters)) {
                return createClient(new LocalStore());
            } else if (parameters.length == 1) {
                return createClient(new LocalStore(), new RegionCacheConfig().keyPrefix(parameters[0]));
            } else {
                throw new IllegalArgumentException("Unsupported parameters: " + Strings.join(parameters));
            }
        } else {
            throw new IllegalArgumentException("Unsupported cache provider: " + className);
        }
    }
}
