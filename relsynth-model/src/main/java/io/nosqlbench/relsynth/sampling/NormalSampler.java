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

import io.nosqlbench.relsynth.model.NormalScalarModel;

/// Inverse-CDF sampler for a normal marginal.
public final class NormalSampler implements ComponentSampler {

    private final double mean;
    private final double stdDev;

    public NormalSampler(NormalScalarModel model) {
        this.mean = model.getMean();
        this.stdDev = model.getStdDev();
    }

    @Override
    public double sample(double u) {
        return InverseNormalCDF.quantile(u, mean, stdDev);
    }
}
