/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.percell.cellgroups.cluster;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/// Seeded random sources for clustering initializations.
///
/// Every initialization gets its own generator derived from the run seed, so
/// changing the number of initializations never changes the ones before it.
public final class RandomGenerators {

    /// XorShiro256++: fast, 256 bits of state, good statistical properties.
    public static final RandomSource DEFAULT_SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private RandomGenerators() {
    }

    /// Creates a generator for the given seed.
    public static UniformRandomProvider create(long seed) {
        return DEFAULT_SOURCE.create(seed);
    }

    /// Creates the generator for one initialization of a seeded run.
    ///
    /// @param seed the run seed
    /// @param initialization zero-based initialization index
    public static UniformRandomProvider forInitialization(long seed, int initialization) {
        return create(mix(seed, initialization));
    }

    // SplitMix64 finalizer, keeps nearby seeds uncorrelated
    static long mix(long seed, int stream) {
        long z = seed + 0x9E3779B97F4A7C15L * (stream + 1L);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
