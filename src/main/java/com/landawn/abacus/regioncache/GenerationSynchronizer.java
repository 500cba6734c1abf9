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

import java.util.function.Function;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * Runs item operations so that they end up applied to the generation the store holds when they finish.
 *
 * <p><b>Protocol:</b></p>
 * <ol>
 * <li>take the client-local generation {@code g}, bootstrapping it on first use;</li>
 * <li>run the operation against {@code itemKey(g, id)};</li>
 * <li>read the authoritative generation {@code g'}; if {@code g' == g} the result stands;</li>
 * <li>otherwise adopt {@code g'} and run the operation again against {@code itemKey(g', id)}.</li>
 * </ol>
 *
 * Generations only move forward (a store reset, which sends them back to {@code 1}, is the exception), and
 * they move only when some client clears the region, so in practice an operation runs at most once more per
 * concurrent clear. The loop is still bounded by {@code maxAttempts}; when every attempt saw the generation
 * move a {@link GenerationConflictException} is thrown.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * GenerationSynchronizer synchronizer = new GenerationSynchronizer(10);
 * byte[] bytes = synchronizer.execute(namespace, 999, store::get);
 * }</pre>
 */
public final class GenerationSynchronizer {

    static final Logger logger = LoggerFactory.getLogger(GenerationSynchronizer.class);

    private final int maxAttempts;

    /**
     * @param maxAttempts the maximum number of times one operation is run, must be positive
     * @throws IllegalArgumentException if maxAttempts is not positive
     */
    public GenerationSynchronizer(final int maxAttempts) {
        N.checkArgPositive(maxAttempts, "maxAttempts");

        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs {@code operation} with the item key of {@code id}, retrying it under the newer generation whenever the
     * region's generation changed while it ran.
     *
     * @param <R> the operation result type
     * @param namespace the region namespace
     * @param id the logical item id
     * @param operation the store operation, given the physical item key
     * @return the result of the attempt that was confirmed by the generation check
     * @throws StoreAccessException if the store cannot be reached
     * @throws GenerationConflictException if the generation changed during every attempt
     */
    public <R> R execute(final CacheNamespace namespace, final Object id, final Function<String, R> operation) {
        long generation = namespace.localGeneration();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            final R result = operation.apply(namespace.itemKey(generation, id));
            final long current = namespace.currentGeneration();

            if (current == generation) {
                return result;
            }

            if (logger.isDebugEnabled()) {
                logger.debug("Generation of region {} moved from {} to {} during attempt {}, retrying", namespace.regionName(), generation, current,
                        attempt);
            }

            generation = current;
        }

        throw new GenerationConflictException(
                "Generation of region " + namespace.regionName() + " changed during each of " + maxAttempts + " attempts on item: " + id);
    }

    /**
     * @return the maximum number of times one operation is run
     */
    public int maxAttempts() {
        return maxAttempts;
    }
}
