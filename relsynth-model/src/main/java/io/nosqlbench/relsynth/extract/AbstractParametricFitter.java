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

import java.util.Arrays;
import java.util.Objects;

/**
 * Base class for parametric fitters scored with the Kolmogorov-Smirnov
 * D-statistic.
 *
 * <p>Subclasses only estimate parameters; scoring is shared so that scores
 * of different distribution types are comparable.
 */
public abstract class AbstractParametricFitter implements ComponentModelFitter {

    protected AbstractParametricFitter() {}

    /**
     * Estimates the distribution parameters from statistics and values.
     *
     * @param stats column statistics
     * @param values the observed values
     * @return the estimated model
     */
    protected abstract ScalarModel estimateParameters(DimensionStatistics stats, double[] values);

    @Override
    public FitResult fit(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        DimensionStatistics stats = DimensionStatistics.compute(0, values);
        return fit(stats, values);
    }

    @Override
    public FitResult fit(DimensionStatistics stats, double[] values) {
        Objects.requireNonNull(stats, "stats cannot be null");

        ScalarModel model = estimateParameters(stats, values);
        double goodnessOfFit = computeKSStatistic(model, values);

        return new FitResult(model, goodnessOfFit, getModelType());
    }

    /**
     * Computes the K-S D-statistic: the largest distance between the empirical
     * CDF of the values and the model CDF.
     *
     * @param model the fitted model
     * @param values the observed values
     * @return D in [0, 1]
     */
    protected double computeKSStatistic(ScalarModel model, double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        int n = sorted.length;
        double maxD = 0.0;

        for (int i = 0; i < n; i++) {
            double modelCdf = model.cdf(sorted[i]);
            double d1 = Math.abs((double) (i + 1) / n - modelCdf);
            double d2 = Math.abs((double) i / n - modelCdf);
            maxD = Math.max(maxD, Math.max(d1, d2));
        }

        return maxD;
    }
}
