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

package io.nosqlbench.relsynth.extract;

import io.nosqlbench.relsynth.model.NormalScalarModel;
import io.nosqlbench.relsynth.model.ScalarModel;
import io.nosqlbench.relsynth.model.ScalarModels;

/**
 * Fits a Normal distribution by maximum likelihood: μ is the sample mean and
 * σ the population standard deviation, floored at {@link ScalarModels#MIN_SCALE}
 * so that constant columns and single observations still produce a model.
 *
 * @see NormalScalarModel
 */
public final class NormalModelFitter extends AbstractParametricFitter {

    @Override
    protected ScalarModel estimateParameters(DimensionStatistics stats, double[] values) {
        double stdDev = Math.max(stats.stdDev(), ScalarModels.MIN_SCALE);
        return new NormalScalarModel(stats.mean(), stdDev);
    }

    @Override
    public String getModelType() {
        return NormalScalarModel.MODEL_TYPE;
    }
}
