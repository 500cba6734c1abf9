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

import com.landawn.abacus.parser.KryoParser;
import com.landawn.abacus.parser.ParserFactory;

/**
 * The default {@link Serializer}, backed by the abacus {@link KryoParser}.
 * Kryo does not require values to implement {@code Serializable} and produces compact payloads,
 * which matters since every cached value crosses the network on each get and put.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * Serializer serializer = new KryoSerializer();
 * byte[] bytes = serializer.serialize(new Person("Foo", 10));
 * Person person = serializer.deserialize(bytes);
 * }</pre>
 *
 * <p><b>Runtime Requirements:</b></p>
 * The underlying Kryo instance accesses JDK internals reflectively. On JDK 17 the JVM must be started with:
 * <pre>
 * --add-opens java.base/java.io=ALL-UNNAMED --add-opens java.base/java.lang=ALL-UNNAMED
 * --add-opens java.base/java.util=ALL-UNNAMED --add-opens java.base/java.util.concurrent=ALL-UNNAMED
 * --add-opens java.base/java.net=ALL-UNNAMED --add-opens java.base/java.math=ALL-UNNAMED
 * --add-opens java.base/java.time=ALL-UNNAMED --add-opens java.sql/java.sql=ALL-UNNAMED
 * </pre>
 * Without them every call fails with {@link SerializationException}. Applications that cannot open these modules
 * can pass their own {@link Serializer} to {@link RegionCacheFactory#createClient(RemoteStore, Serializer, RegionCacheConfig)}.
 *
 * @see KryoParser
 */
public class KryoSerializer implements Serializer {

    private static final KryoParser kryoParser = ParserFactory.createKryoParser();

    @Override
    public byte[] serialize(final Object value) {
        try {
            return kryoParser.encode(value);
        } catch (final RuntimeException e) {
            throw new SerializationException("Failed to serialize value of " + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    @Override
    public <T> T deserialize(final byte[] bytes) {
        try {
            return kryoParser.decode(bytes);
        } catch (final RuntimeException e) {
            throw new SerializationException("Failed to deserialize " + bytes.length + " bytes", e);
        }
    }
}
