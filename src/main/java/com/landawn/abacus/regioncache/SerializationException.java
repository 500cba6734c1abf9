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
 * Thrown when a value cannot be encoded, or stored bytes cannot be decoded, by the {@link Serializer}.
 * Unlike {@link StoreAccessException} it reaches the caller of {@link RegionCache#get(Object)}:
 * malformed bytes are a problem with the value contract, not with cache availability.
 */
public class SerializationException extends RuntimeException {

    private static final long serialVersionUID = 6012378431165229842L;

    public SerializationException(final String message) {
        super(message);
    }

    public SerializationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
