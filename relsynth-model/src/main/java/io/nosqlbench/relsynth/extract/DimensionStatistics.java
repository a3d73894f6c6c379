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

import java.util.Objects;

/**
 * Descriptive statistics of one model column.
 *
 * <h2>Statistics Included</h2>
 *
 * <ul>
 *   <li><b>count</b> - number of observations</li>
 *   <li><b>min/max</b> - observed range</li>
 *   <li><b>mean</b> - arithmetic mean</li>
 *   <li><b>variance/stdDev</b> - population spread measures</li>
 *   <li><b>skewness</b> - asymmetry measure (0 = symmetric)</li>
 *   <li><b>kurtosis</b> - raw tail heaviness (3 = normal)</li>
 * </ul>
 *
 * @see ComponentModelFitter
 * @see BestFitSelector
 */
public final class DimensionStatistics {

    private final int dimension;
    private final long count;
    private final double min;
    private final double max;
    private final double mean;
    private final double variance;
    private final double skewness;
    private final double kurtosis;

    public DimensionStatistics(int dimension, long count, double min, double max,
                               double mean, double variance, double skewness, double kurtosis) {
        this.dimension = dimension;
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.variance = variance;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    /**
     * Computes statistics from an array of values.
     *
     * @param dimension the column index
     * @param values the observed values for this column
     * @return computed statistics
     * @throws IllegalArgumentException if values is empty
     * @throws ArithmeticException if any value is not finite
     */
    public static DimensionStatistics compute(int dimension, double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        long count = values.length;

        // First pass: min, max, mean
        double min = values[0];
        double max = values[0];
        double sum = 0;

        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new ArithmeticException("Non-finite value in column " + dimension + ": " + v);
            }
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }

        double mean = sum / count;

        // Second pass: central moments
        double m2 = 0;
        double m3 = 0;
        double m4 = 0;

        for (double v : values) {
            double diff = v - mean;
            double diff2 = diff * diff;
            m2 += diff2;
            m3 += diff2 * diff;
            m4 += diff2 * diff2;
        }

        double variance = m2 / count;
        double stdDev = Math.sqrt(variance);

        double skewness = 0;
        double kurtosis = 3;

        if (stdDev > 0) {
            skewness = (m3 / count) / (stdDev * stdDev * stdDev);
            kurtosis = (m4 / count) / (variance * variance);
        }

        return new DimensionStatistics(dimension, count, min, max, mean, variance, skewness, kurtosis);
    }

    public int dimension() {
        return dimension;
    }

    public long count() {
        return count;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    /**
     * Returns the range (max - min).
     */
    public double range() {
        return max - min;
    }

    public double mean() {
        return mean;
    }

    /**
     * Returns the population variance.
     */
    public double variance() {
        return variance;
    }

    /**
     * Returns the population standard deviation.
     */
    public double stdDev() {
        return Math.sqrt(variance);
    }

    public double skewness() {
        return skewness;
    }

    /**
     * Returns the raw kurtosis (3 for a normal distribution).
     */
    public double kurtosis() {
        return kurtosis;
    }

    @Override
    public String toString() {
        return String.format("DimensionStatistics[dim=%d, n=%d, mean=%.4f, stdDev=%.4f, min=%.4f, max=%.4f]",
            dimension, count, mean, stdDev(), min, max);
    }
}
