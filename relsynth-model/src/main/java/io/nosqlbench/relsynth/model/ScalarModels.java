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

package io.nosqlbench.relsynth.model;

/// Construction of scalar models from their two-parameter form.
///
/// This is the inverse of [ScalarModel#toParameters()]. Scales below
/// [#MIN_SCALE] are raised to it, so a parameter pair read back from a
/// sampled parent row always yields a usable model as long as both values
/// are finite.
public final class ScalarModels {

    /// Smallest scale (standard deviation or width) a marginal may have.
    public static final double MIN_SCALE = 1e-6;

    private ScalarModels() {
        // Utility class
    }

    /// Builds a scalar model of the given type from `{location, log(scale)}`.
    ///
    /// @param modelType the model type identifier
    /// @param location the location parameter (mean or lower bound)
    /// @param logScale the natural log of the scale parameter
    /// @return the reconstructed model
    /// @throws IllegalArgumentException if a parameter is not finite, the scale
    ///     overflows, or the type is unknown
    public static ScalarModel fromParameters(String modelType, double location, double logScale) {
        if (!Double.isFinite(location) || !Double.isFinite(logScale)) {
            throw new IllegalArgumentException(
                "Non-finite parameters for " + modelType + " model: location=" + location + ", logScale=" + logScale);
        }
        double scale = Math.max(Math.exp(logScale), MIN_SCALE);
        if (!Double.isFinite(scale)) {
            throw new IllegalArgumentException("Scale overflow for " + modelType + " model: logScale=" + logScale);
        }
        switch (modelType) {
            case NormalScalarModel.MODEL_TYPE:
                return new NormalScalarModel(location, scale);
            case UniformScalarModel.MODEL_TYPE:
                return new UniformScalarModel(location, location + scale);
            default:
                throw new IllegalArgumentException("Unknown scalar model type: " + modelType);
        }
    }

    /// Builds a near point-mass model of the given type centered on a value.
    ///
    /// @param modelType the model type identifier
    /// @param value the value to concentrate the mass on
    /// @return a model with [#MIN_SCALE] spread around the value
    public static ScalarModel pointMass(String modelType, double value) {
        if (UniformScalarModel.MODEL_TYPE.equals(modelType)) {
            return fromParameters(modelType, value - MIN_SCALE / 2, Math.log(MIN_SCALE));
        }
        return fromParameters(modelType, value, Math.log(MIN_SCALE));
    }
}
