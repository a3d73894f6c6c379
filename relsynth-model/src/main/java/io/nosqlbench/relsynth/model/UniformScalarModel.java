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
 * Uniform marginal over a bounded range [lower, upper].
 *
 * <h2>Properties</h2>
 *
 * <ul>
 *   <li><b>Mean</b>: (lower + upper) / 2</li>
 *   <li><b>CDF</b>: (x - lower) / (upper - lower) for x in [lower, upper]</li>
 *   <li><b>Parameters</b>: {@code {lower, log(upper - lower)}}</li>
 * </ul>
 *
 * @see ScalarModel
 * @see io.nosqlbench.relsynth.sampling.UniformSampler
 */
public final class UniformScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "uniform";

    private final double lower;
    private final double upper;

    /**
     * Constructs a uniform scalar model over [lower, upper].
     *
     * @param lower the lower bound of the interval
     * @param upper the upper bound of the interval
     * @throws IllegalArgumentException if lower &gt;= upper or a bound is not finite
     */
    public UniformScalarModel(double lower, double upper) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new IllegalArgumentException("Bounds must be finite: [" + lower + ", " + upper + "]");
        }
        if (lower >= upper) {
            throw new IllegalArgumentException("Lower bound must be less than upper: " + lower + " >= " + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public double getMean() {
        return (lower + upper) / 2.0;
    }

    @Override
    public double cdf(double x) {
        if (x <= lower) return 0.0;
        if (x >= upper) return 1.0;
        return (x - lower) / (upper - lower);
    }

    @Override
    public double[] toParameters() {
        return new double[]{lower, Math.log(upper - lower)};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UniformScalarModel)) return false;
        UniformScalarModel that = (UniformScalarModel) o;
        return Double.compare(that.lower, lower) == 0 &&
               Double.compare(that.upper, upper) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return "UniformScalarModel[lower=" + lower + ", upper=" + upper + "]";
    }
}
