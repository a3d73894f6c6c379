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

import io.nosqlbench.relsynth.model.ScalarModel;
import io.nosqlbench.relsynth.model.ScalarModels;
import io.nosqlbench.relsynth.model.UniformScalarModel;

/**
 * Fits a Uniform distribution over the observed range.
 *
 * <p>The K-S score is adjusted by how close the observed kurtosis is to the
 * uniform value of 1.8, which separates uniform from normal data better than
 * the K-S distance alone on small samples.
 *
 * @see UniformScalarModel
 */
public final class UniformModelFitter extends AbstractParametricFitter {

    /// Expected raw kurtosis for uniform distribution: 1.8 (excess kurtosis = -1.2)
    private static final double UNIFORM_KURTOSIS = 1.8;

    /// Tolerance for kurtosis-based scoring adjustment
    private static final double KURTOSIS_TOLERANCE = 0.5;

    @Override
    protected ScalarModel estimateParameters(DimensionStatistics stats, double[] values) {
        double lower = stats.min();
        double width = Math.max(stats.range(), ScalarModels.MIN_SCALE);
        return new UniformScalarModel(lower, lower + width);
    }

    @Override
    public FitResult fit(DimensionStatistics stats, double[] values) {
        ScalarModel model = estimateParameters(stats, values);
        double ksScore = computeKSStatistic(model, values);

        double kurtosis = stats.kurtosis();
        double kurtosisDistance = Math.abs(kurtosis - UNIFORM_KURTOSIS);

        double kurtosisAdjustment;
        if (kurtosisDistance < KURTOSIS_TOLERANCE) {
            kurtosisAdjustment = -0.2 * ksScore * (1.0 - kurtosisDistance / KURTOSIS_TOLERANCE);
        } else if (kurtosis > 2.5) {
            double normalDistance = Math.min(Math.abs(kurtosis - 3.0), 1.0);
            kurtosisAdjustment = 0.2 * ksScore * (1.0 - normalDistance);
        } else {
            kurtosisAdjustment = 0;
        }

        double adjustedScore = Math.max(0, ksScore + kurtosisAdjustment);
        return new FitResult(model, adjustedScore, getModelType());
    }

    @Override
    public String getModelType() {
        return UniformScalarModel.MODEL_TYPE;
    }
}
