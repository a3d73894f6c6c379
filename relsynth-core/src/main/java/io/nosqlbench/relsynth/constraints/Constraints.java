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

package io.nosqlbench.relsynth.constraints;

import io.nosqlbench.relsynth.ConfigurationException;

/// Value coercion shared by the numeric constraints.
final class Constraints {

    private Constraints() {
        // Utility class
    }

    /// Returns the value as a double, or null for null.
    ///
    /// @throws ConfigurationException if the value is not a finite number
    static Double toDouble(Object value, String column) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d)) {
                return d;
            }
        }
        throw new ConfigurationException("Column " + column + " holds non-numeric value '" + value + "'");
    }

    /// Returns the value as a double for validity checks: null for null and
    /// NaN for anything that is not a finite number, so comparisons fail.
    static Double lenient(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : Double.NaN;
        }
        return Double.NaN;
    }
}
