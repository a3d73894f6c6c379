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

import io.nosqlbench.relsynth.model.UniformScalarModel;

/// Inverse-CDF sampler for a uniform marginal: `lower + u * (upper - lower)`.
public final class UniformSampler implements ComponentSampler {

    private final double lower;
    private final double width;

    public UniformSampler(UniformScalarModel model) {
        this.lower = model.getLower();
        this.width = model.getUpper() - model.getLower();
    }

    @Override
    public double sample(double u) {
        return lower + u * width;
    }
}
