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
 * Thrown by a {@link RemoteStore} when the store cannot be reached (connection refused, timeout,
 * disconnected client) or rejects a command. {@link RegionCache} converts it into a cache miss or a
 * no-op, so callers of the region API never see it.
 */
public class StoreAccessException extends RuntimeException {

    private static final long serialVersionUID = -2417863205398810512L;

    public StoreAccessException(final String message) {
        super(message);
    }

    public StoreAccessException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
