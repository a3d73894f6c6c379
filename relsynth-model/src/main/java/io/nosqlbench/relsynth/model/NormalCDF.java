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

/**
 * Normal cumulative distribution function.
 *
 * <p>Uses the Abramowitz and Stegun approximation 7.1.26 of the error
 * function, accurate to about 1.5 × 10⁻⁷ absolute error.
 */
public final class NormalCDF {

    private static final double P = 0.3275911;
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;

    private NormalCDF() {
        // Utility class
    }

    /**
     * Standard normal CDF Φ(z).
     *
     * @param z the standardized value
     * @return P(Z ≤ z) for Z ~ N(0, 1)
     */
    public static double standardNormalCDF(double z) {
        if (Double.isNaN(z)) {
            return Double.NaN;
        }
        if (z < -40) return 0.0;
        if (z > 40) return 1.0;
        double x = Math.abs(z) / Math.sqrt(2.0);
        double t = 1.0 / (1.0 + P * x);
        double erf = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-x * x);
        double result = 0.5 * (1.0 + Math.copySign(erf, z));
        return Math.max(0.0, Math.min(1.0, result));
    }

    /**
     * Normal CDF for N(mean, stdDev²).
     *
     * @param x the value
     * @param mean the mean
     * @param stdDev the standard deviation
     * @return P(X ≤ x)
     */
    public static double cdf(double x, double mean, double stdDev) {
        return standardNormalCDF((x - mean) / stdDev);
    }

    /**
     * Standard normal density φ(z).
     *
     * @param z the standardized value
     * @return the density at z
     */
    public static double standardNormalPDF(double z) {
        return Math.exp(-0.5 * z * z) / Math.sqrt(2 * Math.PI);
    }
}
