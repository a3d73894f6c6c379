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

/// Sampler that produces variates from a bound marginal distribution.
///
/// # Overview
///
/// A ComponentSampler is bound to one scalar model at construction time.
/// All distribution parameters are extracted and stored, so sampling requires
/// only the uniform input value.
///
/// ```text
///   Construction (once)                    Sampling (per value)
///  ┌─────────────────┐                   ┌─────────────────┐
///  │  ScalarModel    │                   │   double u      │
///  │  location,      │ ──► Sampler ◄──── │   ∈ (0,1)       │
///  │  scale, type    │     (bound)       └────────┬────────┘
///  └─────────────────┘                            │
///                                                 ▼
///                                        ┌─────────────────┐
///                                        │  double value   │
///                                        └─────────────────┘
/// ```
///
/// The Gaussian copula feeds `u = Φ(z)` of a correlated normal score `z`
/// into one sampler per column.
///
/// @see ComponentSamplerFactory
@FunctionalInterface
public interface ComponentSampler {

    /// Samples a value from this distribution.
    ///
    /// Uses inverse CDF transform sampling: given a uniform value
    /// u ∈ (0,1), returns the corresponding quantile.
    ///
    /// @param u a value in the open interval (0, 1)
    /// @return a sample from the distribution
    double sample(double u);
}
