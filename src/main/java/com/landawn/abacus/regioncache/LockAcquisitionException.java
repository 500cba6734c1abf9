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
 * Thrown when a distributed lock could not be acquired within the acquire timeout, or the waiting thread was
 * interrupted. This is the only lock failure reported to callers; an unreachable store is not.
 *
 * @see StoreLock#lock(String, long, long, long)
 */
public class LockAcquisitionException extends RuntimeException {

    private static final long serialVersionUID = 3810562287794306675L;

    public LockAcquisitionException(final String message) {
        super(message);
    }

    public LockAcquisitionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
