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
 * Thrown by {@link GenerationSynchronizer} when every allowed attempt of an item operation observed a newer
 * region generation afterwards. {@link RegionCache} treats it like an unreachable store.
 */
public class GenerationConflictException extends RuntimeException {

    private static final long serialVersionUID = -5372041689914127713L;

    public GenerationConflictException(final String message) {
        super(message);
    }
}
