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

import java.util.Objects;

/**
 * Normal (Gaussian) marginal N(μ, σ²).
 *
 * <p>Parameterized as {@code {mean, log(stdDev)}} for extension into parent
 * tables.
 *
 * @see ScalarModel
 * @see io.nosqlbench.relsynth.sampling.NormalSampler
 */
public final class NormalScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "normal";

    private final double mean;
    private final double stdDev;

    /**
     * Constructs a normal scalar model.
     *
     * @param mean the mean (μ) of the normal distribution
     * @param stdDev the standard deviation (σ); must be positive and finite
     * @throws IllegalArgumentException if mean is not finite or stdDev is not positive and finite
     */
    public NormalScalarModel(double mean, double stdDev) {
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite, got: " + mean);
        }
        if (!(stdDev > 0) || !Double.isFinite(stdDev)) {
            throw new IllegalArgumentException("Standard deviation must be positive and finite, got: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    /**
     * Returns the mean of this normal distribution.
     * @return the mean (μ)
     */
    public double getMean() {
        return mean;
    }

    /**
     * Returns the standard deviation of this normal distribution.
     * @return the standard deviation (σ)
     */
    public double getStdDev() {
        return stdDev;
    }

    /**
     * Computes the probability density function (PDF) at a given value.
     * @param x the value at which to evaluate the PDF
     * @return the probability density at x
     */
    public double pdf(double x) {
        double z = (x - mean) / stdDev;
        return Math.exp(-0.5 * z * z) / (stdDev * Math.sqrt(2 * Math.PI));
    }

    @Override
    public double cdf(double x) {
        return NormalCDF.cdf(x, mean, stdDev);
    }

    @Override
    public double[] toParameters() {
        return new double[]{mean, Math.log(stdDev)};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalScalarModel)) return false;
        NormalScalarModel that = (NormalScalarModel) o;
        return Double.compare(that.mean, mean) == 0 &&
               Double.compare(that.stdDev, stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev);
    }

    @Override
    public String toString() {
        return "NormalScalarModel[mean=" + mean + ", stdDev=" + stdDev + "]";
    }
}
