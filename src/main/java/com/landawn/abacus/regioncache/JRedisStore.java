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

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;

import com.landawn.abacus.util.AddrUtil;
import com.landawn.abacus.util.Charsets;
import com.landawn.abacus.util.N;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisShardInfo;
import redis.clients.jedis.ShardedJedis;
import redis.clients.jedis.ShardedJedisPool;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * A Redis-backed {@link RemoteStore} using Jedis with sharding support.
 * Connects to one or more Redis instances; keys are distributed across the shards with consistent hashing,
 * so every single-key primitive (conditional set, increment, compare-and-delete) runs atomically on the
 * shard that owns the key.
 *
 * <p><b>Command mapping:</b></p>
 * <ul>
 *   <li>{@code set} - {@code SET key value PX liveTime}</li>
 *   <li>{@code setIfAbsent} - {@code SET key value NX PX liveTime}</li>
 *   <li>{@code incr} - {@code INCRBY key delta}</li>
 *   <li>{@code ttl} - {@code PTTL key}</li>
 *   <li>{@code deleteIfEquals} - a Lua script comparing the stored value before {@code DEL}</li>
 *   <li>{@code flushAll} - {@code FLUSHALL} on every shard</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> connections are borrowed from a {@link ShardedJedisPool} per command,
 * so one instance can be shared by any number of threads.</p>
 *
 * <p>Every {@link JedisException} (connection refused, socket timeout, pool exhausted, script error)
 * is rethrown as {@link StoreAccessException}.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // Single Redis instance
 * RemoteStore store = new JRedisStore("localhost:6379");
 *
 * // Two shards with a 2 second timeout
 * RemoteStore sharded = new JRedisStore("redis1:6379,redis2:6379", 2000);
 *
 * RegionCacheClient client = RegionCacheFactory.createClient(store);
 * }</pre>
 *
 * @see AbstractRemoteStore
 * @see ShardedJedisPool
 */
@SuppressWarnings("deprecation")
public class JRedisStore extends AbstractRemoteStore {

    private static final byte[] COMPARE_AND_DELETE_SCRIPT = ("if redis.call('get', KEYS[1]) == ARGV[1] then " //
            + "return redis.call('del', KEYS[1]) else return 0 end").getBytes(Charsets.UTF_8);

    private final ShardedJedisPool pool;

    /**
     * Creates a store with the default timeout.
     *
     * @param serverUrl the Redis server URL(s) in format "host1:port1,host2:port2,...", must not be {@code null} or empty
     * @throws IllegalArgumentException if {@code serverUrl} contains no valid server addresses
     * @see #JRedisStore(String, long)
     */
    public JRedisStore(final String serverUrl) {
        this(serverUrl, DEFAULT_TIMEOUT);
    }

    /**
     * Creates a store with the given connection and socket timeout.
     * No connection is opened until the first command.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * RemoteStore store = new JRedisStore("remote-redis:6379", 5000);
     * }</pre>
     *
     * @param serverUrl the Redis server URL(s) in format "host1:port1,host2:port2,...", must not be {@code null} or empty
     * @param timeout connection and socket timeout in milliseconds
     * @throws IllegalArgumentException if {@code serverUrl} contains no valid server addresses
     */
    public JRedisStore(final String serverUrl, final long timeout) {
        super(serverUrl);

        final List<InetSocketAddress> addressList = AddrUtil.getAddressList(serverUrl);

        if (N.isEmpty(addressList)) {
            throw new IllegalArgumentException("No valid server addresses found in: " + serverUrl);
        }

        final List<JedisShardInfo> shards = new ArrayList<>();

        for (final InetSocketAddress addr : addressList) {
            shards.add(new JedisShardInfo(addr.getHostName(), addr.getPort(), (int) timeout));
        }

        pool = new ShardedJedisPool(new GenericObjectPoolConfig<>(), shards);
    }

    @Override
    public byte[] get(final String key) {
        final byte[] keyBytes = getKeyBytes(key);

        return execute(key, jedis -> jedis.get(keyBytes));
    }

    @Override
    public boolean set(final String key, final byte[] value, final long liveTime) {
        final byte[] keyBytes = getKeyBytes(key);

        final String reply = execute(key, jedis -> liveTime > 0 ? jedis.set(keyBytes, value, SetParams.setParams().px(liveTime)) : jedis.set(keyBytes, value));

        return "OK".equals(reply);
    }

    @Override
    public boolean setIfAbsent(final String key, final byte[] value, final long liveTime) {
        final byte[] keyBytes = getKeyBytes(key);
        final SetParams params = liveTime > 0 ? SetParams.setParams().nx().px(liveTime) : SetParams.setParams().nx();

        // a null reply means the key already existed
        return "OK".equals(execute(key, jedis -> jedis.set(keyBytes, value, params)));
    }

    @Override
    public boolean delete(final String key) {
        final byte[] keyBytes = getKeyBytes(key);

        execute(key, jedis -> jedis.del(keyBytes));

        return true;
    }

    @Override
    public boolean deleteIfEquals(final String key, final byte[] expected) {
        final byte[] keyBytes = getKeyBytes(key);

        final Object reply = execute(key, jedis -> {
            final Jedis shard = jedis.getShard(keyBytes);

            return shard.eval(COMPARE_AND_DELETE_SCRIPT, Collections.singletonList(keyBytes), Collections.singletonList(expected));
        });

        return reply instanceof Long && (Long) reply > 0;
    }

    @Override
    public long incr(final String key, final long delta) {
        final byte[] keyBytes = getKeyBytes(key);

        return execute(key, jedis -> jedis.incrBy(keyBytes, delta));
    }

    @Override
    public Duration ttl(final String key) {
        final byte[] keyBytes = getKeyBytes(key);
        final Long millis = execute(key, jedis -> jedis.pttl(keyBytes));

        // -2: no such key, -1: no expiry
        return millis == null || millis < 0 ? null : Duration.ofMillis(millis);
    }

    /**
     * Flushes every shard.
     */
    @Override
    public void flushAll() {
        execute("*", jedis -> {
            for (final Jedis j : jedis.getAllShards()) {
                if (j != null) {
                    j.flushAll();
                }
            }

            return null;
        });
    }

    @Override
    public void disconnect() {
        pool.close();
    }

    /**
     * Borrows a connection, runs {@code action} and returns the connection to the pool.
     *
     * @param key the key the command targets, for error reporting
     * @param action the command to run
     * @return the command reply
     * @throws StoreAccessException if Jedis fails for any reason
     */
    protected <R> R execute(final String key, final Function<ShardedJedis, R> action) {
        try (ShardedJedis jedis = pool.getResource()) {
            return action.apply(jedis);
        } catch (final JedisException e) {
            throw new StoreAccessException("Failed to access Redis at " + serverUrl() + " for key: " + key, e);
        } catch (final IllegalStateException e) {
            // pool already closed
            throw new StoreAccessException("Redis store at " + serverUrl() + " has been disconnected", e);
        }
    }
}
