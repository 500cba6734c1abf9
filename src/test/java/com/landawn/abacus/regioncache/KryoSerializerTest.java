/*
 * Copyright (c) 2026, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.regioncache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class KryoSerializerTest {

    private final Serializer serializer = new KryoSerializer();

    @Test
    public void test_serialize_deserialize() {
        final Person person = new Person("Foo", 10);
        final byte[] bytes = serializer.serialize(person);

        assertTrue(bytes.length > 0);
        assertEquals(person, serializer.deserialize(bytes));
    }

    @Test
    public void test_serialize_collection() {
        final List<String> names = List.of("Ann", "Bob");

        assertEquals(names, serializer.<List<String>> deserialize(serializer.serialize(new ArrayList<>(names))));
    }
}
