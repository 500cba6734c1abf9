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

/**
 * Converts cached values to and from the bytes kept in the {@link RemoteStore}.
 * Implementations must be thread-safe; one instance serves every region of a client.
 *
 * @see KryoSerializer
 */
public interface Serializer {

    /**
     * Encodes a value.
     *
     * @param value the value to encode, never {@code null}
     * @return the encoded bytes
     * @throws SerializationException if the value cannot be encoded
     */
    byte[] serialize(Object value);

    /**
     * Decodes bytes produced by {@link #serialize(Object)}.
     *
     * @param <T> the expected value type
     * @param bytes the stored bytes, never {@code null}
     * @return the decoded value
     * @throws SerializationException if the bytes are malformed
     */
    <T> T deserialize(byte[] bytes);
}
