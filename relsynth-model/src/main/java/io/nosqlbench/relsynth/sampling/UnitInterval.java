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

package io.nosqlbench.relsynth.sampling;

import org.apache.commons.rng.UniformRandomProvider;

/// Draws and clamps probabilities on the open unit interval.
public final class UnitInterval {

    /// Bound used to keep probabilities away from 0 and 1.
    public static final double EPSILON = 1e-10;

    private UnitInterval() {
        // Utility class
    }

    /// Draws a uniform value strictly inside (0, 1).
    ///
    /// @param rng the random source
    /// @return a value in [2^-54, 1 - 2^-54]
    public static double open(UniformRandomProvider rng) {
        return ((rng.nextLong() >>> 11) + 0.5) * 0x1.0p-53;
    }

    /// Clamps a probability into `[EPSILON, 1 - EPSILON]`.
    public static double clamp(double p) {
        if (Double.isNaN(p)) {
            return 0.5;
        }
        return Math.max(EPSILON, Math.min(1.0 - EPSILON, p));
    }
}
