/*
 * Copyright (c) 2026, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.regioncache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import com.landawn.abacus.util.Charsets;

@Tag("integration")
@Testcontainers(disabledWithoutDocker = true)
public class JRedisStoreTest {

    private static final DockerImageName REDIS_IMAGE = DockerImageName.parse("redis:7-alpine");

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(REDIS_IMAGE).withExposedPorts(6379)
            .waitingFor(Wait.forListeningPort().withStartupTimeout(Duration.ofMinutes(2)));

    private static JRedisStore store;

    @BeforeAll
    public static void setUpStore() {
        store = new JRedisStore(redis.getHost() + ":" + redis.getMappedPort(6379), 3000);
    }

    @AfterAll
    public static void tearDownStore() {
        if (store != null) {
            store.disconnect();
        }
    }

    @BeforeEach
    public void flush() {
        store.flushAll();
    }

    private static byte[] bytes(final String str) {
        return str.getBytes(Charsets.UTF_8);
    }

    @Test
    public void test_set_get_delete() {
        assertNull(store.get("a"));

        assertTrue(store.set("a", bytes("1"), 0));
        assertArrayEquals(bytes("1"), store.get("a"));
        assertNull(store.ttl("a"));

        assertTrue(store.delete("a"));
        assertNull(store.get("a"));
    }

    @Test
    public void test_set_withLiveTime() {
        store.set("a", bytes("1"), 60_000);

        final Duration ttl = store.ttl("a");

        assertNotNull(ttl);
        assertTrue(ttl.toMillis() > 50_000 && ttl.toMillis() <= 60_000);
    }

    @Test
    public void test_setIfAbsent() {
        assertTrue(store.setIfAbsent("a", bytes("1"), 60_000));
        assertFalse(store.setIfAbsent("a", bytes("2"), 60_000));
        assertArrayEquals(bytes("1"), store.get("a"));
    }

    @Test
    public void test_deleteIfEquals() {
        store.set("a", bytes("token"), 0);

        assertFalse(store.deleteIfEquals("a", bytes("other")));
        assertTrue(store.deleteIfEquals("a", bytes("token")));
        assertNull(store.get("a"));
    }

    @Test
    public void test_incr() {
        assertEquals(3, store.incr("c", 3));

        store.setIfAbsent("g", bytes("1"), 60_000);
        assertEquals(101, store.incr("g", 100));
        assertArrayEquals(bytes("101"), store.get("g"));
        assertNotNull(store.ttl("g"));
    }

    @Test
    public void test_regionCache() {
        final RegionCacheClient client = RegionCacheFactory.createClient(store);
        final RegionCache<Long, Person> cache = client.region("people");
        final RegionCache<Long, Person> other = RegionCacheFactory.createClient(store).region("people");

        cache.put(1L, new Person("Ann", 31));
        assertEquals("Ann", other.get(1L).getName());

        final Duration ttl = store.ttl(cache.namespace().itemKey(1, 1L));
        assertTrue(ttl.compareTo(Duration.ofMinutes(4)) >= 0 && ttl.compareTo(Duration.ofMinutes(5)) <= 0);

        store.incr(cache.namespace().generationKey(), 100);
        assertNull(cache.get(1L));
        assertEquals(101, cache.namespace().lastSeenGeneration());

        other.clear();
        assertEquals(102, other.namespace().lastSeenGeneration());
        assertNull(store.get(other.namespace().keysKey()));

        cache.lock(1L);
        assertTrue(client.storeLock().isLocked(cache.namespace().lockKey(1L)));
        cache.unlock(1L);
        assertFalse(client.storeLock().isLocked(cache.namespace().lockKey(1L)));
    }

    @Test
    public void test_flushAll_resynchronizesGeneration() {
        final RegionCache<Long, Person> cache = RegionCacheFactory.createClient(store).region("people");

        cache.put(1L, new Person("Ann", 31));
        cache.clear();

        store.flushAll();

        cache.put(1L, new Person("Ann", 32));

        assertArrayEquals(bytes(String.valueOf(cache.namespace().lastSeenGeneration())), store.get(cache.namespace().generationKey()));
    }

    @Test
    public void test_unreachable() {
        final JRedisStore unreachable = new JRedisStore("localhost:1", 200);

        try {
            assertThrows(StoreAccessException.class, () -> unreachable.get("a"));
            assertThrows(StoreAccessException.class, () -> unreachable.setIfAbsent("a", bytes("1"), 1000));
        } finally {
            unreachable.disconnect();
        }
    }
}
