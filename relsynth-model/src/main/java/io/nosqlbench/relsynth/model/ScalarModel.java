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

/// Univariate distribution used as one marginal of a table model.
///
/// ## Purpose
///
/// ScalarModel is the per-column building block of a [TableModel]. Each
/// modeled column of a table owns one ScalarModel describing its marginal
/// distribution; the dependence between columns is carried separately by
/// the table model (for example the correlation matrix of a Gaussian copula).
///
/// ```
///   TableModel (d columns)
///  ┌──────────────────────────────────────────┐
///  │ marginals:  ScalarModel[0..d-1]          │
///  │ dependence: correlation matrix [d][d]    │
///  └──────────────────────────────────────────┘
///          │                    │
///          ▼                    ▼
///   per-column CDF /      joint normal scores
///   quantile via samplers
/// ```
///
/// ## Parameterization
///
/// Every implementation exposes exactly two real parameters through
/// [#toParameters()]: a location and the natural log of a scale. The log
/// keeps the scale unbounded so that the parameters can themselves be
/// modeled as ordinary real-valued columns of a parent table and mapped back
/// with [ScalarModels#fromParameters(String, double, double)].
///
/// ## Models vs Samplers
///
/// ScalarModel is a pure data description. Sampling is handled by
/// [io.nosqlbench.relsynth.sampling.ComponentSampler] implementations, each
/// bound to its specific model type.
///
/// @see NormalScalarModel
/// @see UniformScalarModel
public interface ScalarModel {

    /// Number of entries returned by [#toParameters()].
    int PARAMETER_COUNT = 2;

    /// Returns the model type identifier.
    ///
    /// @return the model type identifier (e.g., "normal", "uniform")
    String getModelType();

    /// Computes the cumulative distribution function at a given value.
    ///
    /// Implementations return values in [0, 1] and are monotonically
    /// non-decreasing.
    ///
    /// @param x the value at which to evaluate the CDF
    /// @return the cumulative probability P(X ≤ x)
    double cdf(double x);

    /// Returns the location and log-scale of this model.
    ///
    /// @return a two element array `{location, log(scale)}`
    double[] toParameters();
}
