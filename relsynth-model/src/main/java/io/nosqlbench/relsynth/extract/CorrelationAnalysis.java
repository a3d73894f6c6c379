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

/**
 * Correlation matrix utilities for the Gaussian copula.
 *
 * <p>All matrices are dense {@code double[d][d]} arrays. A correlation
 * matrix handed to {@link #cholesky(double[][])} must be symmetric positive
 * definite; {@link #repair(double[][])} brings a matrix rebuilt from
 * sampled parameters back into that set.
 */
public final class CorrelationAnalysis {

    /// Shrinkage steps toward the identity tried by [#repair(double[][])]
    private static final double[] SHRINKAGE = {0.0, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0};

    private CorrelationAnalysis() {
        // Utility class
    }

    /**
     * Computes the full correlation matrix of a set of rows.
     *
     * <p>With fewer than 3 rows the identity is returned, as is any pair
     * involving a constant column.
     *
     * @param rows array of rows [numRows][numColumns]
     * @param dims the number of columns
     * @return correlation matrix [dims][dims]
     */
    public static double[][] computeCorrelationMatrix(double[][] rows, int dims) {
        double[][] corr = identity(dims);
        int n = rows.length;
        if (n < 3 || dims < 2) {
            return corr;
        }

        // Compute means
        double[] means = new double[dims];
        for (double[] row : rows) {
            for (int d = 0; d < dims; d++) {
                means[d] += row[d];
            }
        }
        for (int d = 0; d < dims; d++) {
            means[d] /= n;
        }

        // Compute standard deviations
        double[] stdDevs = new double[dims];
        for (double[] row : rows) {
            for (int d = 0; d < dims; d++) {
                double diff = row[d] - means[d];
                stdDevs[d] += diff * diff;
            }
        }
        for (int d = 0; d < dims; d++) {
            stdDevs[d] = Math.sqrt(stdDevs[d] / (n - 1));
        }

        for (int i = 0; i < dims; i++) {
            for (int j = i + 1; j < dims; j++) {
                double cov = 0;
                for (double[] row : rows) {
                    cov += (row[i] - means[i]) * (row[j] - means[j]);
                }
                cov /= (n - 1);

                double r = (stdDevs[i] > 1e-12 && stdDevs[j] > 1e-12)
                    ? cov / (stdDevs[i] * stdDevs[j])
                    : 0;

                // Clamp to [-1, 1]
                r = Math.max(-1.0, Math.min(1.0, r));
                if (!Double.isFinite(r)) {
                    r = 0;
                }

                corr[i][j] = r;
                corr[j][i] = r;
            }
        }

        return corr;
    }

    /**
     * Returns the d x d identity matrix.
     */
    public static double[][] identity(int dims) {
        double[][] m = new double[dims][dims];
        for (int i = 0; i < dims; i++) {
            m[i][i] = 1.0;
        }
        return m;
    }

    /**
     * Computes the lower-triangular Cholesky factor L with {@code L L^T = m}.
     *
     * @param m a symmetric matrix
     * @return the lower-triangular factor
     * @throws IllegalArgumentException if m is not positive definite
     */
    public static double[][] cholesky(double[][] m) {
        int n = m.length;
        double[][] l = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = m[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= l[i][k] * l[j][k];
                }
                if (i == j) {
                    if (!(sum > 1e-10)) {
                        throw new IllegalArgumentException(
                            "Matrix is not positive definite at pivot " + i + ": " + sum);
                    }
                    l[i][i] = Math.sqrt(sum);
                } else {
                    l[i][j] = sum / l[j][j];
                }
            }
        }
        return l;
    }

    /**
     * Solves {@code m x = b} given the Cholesky factor of m.
     *
     * @param l lower-triangular factor from {@link #cholesky(double[][])}
     * @param b right-hand side
     * @return the solution x
     */
    public static double[] choleskySolve(double[][] l, double[] b) {
        int n = l.length;
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = b[i];
            for (int k = 0; k < i; k++) {
                sum -= l[i][k] * y[k];
            }
            y[i] = sum / l[i][i];
        }
        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = y[i];
            for (int k = i + 1; k < n; k++) {
                sum -= l[k][i] * x[k];
            }
            x[i] = sum / l[i][i];
        }
        return x;
    }

    /**
     * Returns a valid correlation matrix close to the given one.
     *
     * <p>Entries are clamped to [-1, 1] and symmetrized, the diagonal is
     * set to 1, and the matrix is shrunk toward the identity in growing
     * steps until it factors. A matrix that already factors is returned
     * unchanged apart from the clamping.
     *
     * @param m a square matrix, possibly invalid
     * @return a symmetric positive definite matrix with unit diagonal
     */
    public static double[][] repair(double[][] m) {
        int n = m.length;
        double[][] base = new double[n][n];
        for (int i = 0; i < n; i++) {
            base[i][i] = 1.0;
            for (int j = 0; j < i; j++) {
                double r = 0.5 * (m[i][j] + m[j][i]);
                r = Double.isFinite(r) ? Math.max(-1.0, Math.min(1.0, r)) : 0.0;
                base[i][j] = r;
                base[j][i] = r;
            }
        }
        for (double lambda : SHRINKAGE) {
            double[][] candidate = shrink(base, lambda);
            if (isPositiveDefinite(candidate)) {
                return candidate;
            }
        }
        return identity(n);
    }

    /**
     * Tests whether a symmetric matrix has a Cholesky factor.
     */
    public static boolean isPositiveDefinite(double[][] m) {
        try {
            cholesky(m);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static double[][] shrink(double[][] m, double lambda) {
        int n = m.length;
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = i == j ? 1.0 : (1.0 - lambda) * m[i][j];
            }
        }
        return out;
    }
}
