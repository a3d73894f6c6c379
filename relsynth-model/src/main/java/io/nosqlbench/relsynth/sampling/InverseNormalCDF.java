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

import io.nosqlbench.relsynth.model.NormalCDF;

/**
 * Inverse Normal CDF (quantile function).
 *
 * <h2>The Inverse Transform Method</h2>
 *
 * <pre>{@code
 *   Uniform input u ∈ (0,1)              Normal output x
 *         │                                    │
 *         │  u=0.95 ─────────────────────►     │ x=1.645
 *         │                                    │
 *         │  u=0.50 ────────────────►          │ x=0.000 (median)
 *         │                                    │
 *         │  u=0.05 ──────►                    │ x=-1.645
 *         │                                    │
 *      0 ─┼─ 1                            -∞ ──┼── +∞
 * }</pre>
 *
 * <h2>Algorithm</h2>
 *
 * <p>Starts from the Abramowitz and Stegun rational approximation (formula
 * 26.2.23) and applies one Newton step against {@link NormalCDF}, which
 * makes the quantile consistent with the CDF used to compute normal scores.
 */
public final class InverseNormalCDF {

    // Coefficients for rational approximation (Abramowitz and Stegun 26.2.23)
    private static final double C0 = 2.515517;
    private static final double C1 = 0.802853;
    private static final double C2 = 0.010328;
    private static final double D1 = 1.432788;
    private static final double D2 = 0.189269;
    private static final double D3 = 0.001308;

    private InverseNormalCDF() {
        // Utility class, no instantiation
    }

    /**
     * Computes the quantile of the standard normal distribution.
     *
     * <pre>{@code
     *   p=0.025 → x≈-1.96
     *   p=0.50  → x=0.00
     *   p=0.975 → x≈+1.96
     * }</pre>
     *
     * @param p the probability value in the open interval (0, 1)
     * @return the standard normal quantile
     * @throws IllegalArgumentException if p is not in (0, 1)
     */
    public static double standardNormalQuantile(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new IllegalArgumentException("Probability must be in (0, 1), got: " + p);
        }

        double x;
        if (p < 0.5) {
            x = -rationalApproximation(Math.sqrt(-2.0 * Math.log(p)));
        } else {
            x = rationalApproximation(Math.sqrt(-2.0 * Math.log(1.0 - p)));
        }

        double density = NormalCDF.standardNormalPDF(x);
        if (density > 1e-300) {
            x -= (NormalCDF.standardNormalCDF(x) - p) / density;
        }
        return x;
    }

    /**
     * Computes the quantile for a normal distribution with the given mean and stdDev.
     *
     * @param p the probability value in the open interval (0, 1)
     * @param mean the mean of the distribution
     * @param stdDev the standard deviation of the distribution
     * @return the quantile value
     */
    public static double quantile(double p, double mean, double stdDev) {
        return mean + stdDev * standardNormalQuantile(p);
    }

    private static double rationalApproximation(double t) {
        double numerator = C0 + t * (C1 + t * C2);
        double denominator = 1.0 + t * (D1 + t * (D2 + t * D3));
        return t - numerator / denominator;
    }
}
