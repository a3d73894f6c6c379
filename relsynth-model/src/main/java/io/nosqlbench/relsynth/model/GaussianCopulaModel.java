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

import io.nosqlbench.relsynth.extract.CorrelationAnalysis;
import io.nosqlbench.relsynth.sampling.ComponentSampler;
import io.nosqlbench.relsynth.sampling.ComponentSamplerFactory;
import io.nosqlbench.relsynth.sampling.InverseNormalCDF;
import io.nosqlbench.relsynth.sampling.UnitInterval;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Gaussian copula over parametric marginals.
///
/// ## Sampling
///
/// ```
///   z ~ N(0, I) ──► L·z ──► Φ ──► u ∈ (0,1)^d ──► marginal quantiles ──► row
///                   │
///                   └── L = cholesky(correlation)
/// ```
///
/// Conditional sampling fixes some columns, maps them to normal scores and
/// draws the remaining scores from the partitioned Gaussian
/// `N(Σ_rf Σ_ff⁻¹ z_f, Σ_rr - Σ_rf Σ_ff⁻¹ Σ_fr)`.
public final class GaussianCopulaModel implements TableModel {

    public static final String MODEL_TYPE = "gaussian_copula";

    private final GaussianCopulaFamily family;
    private final ScalarModel[] marginals;
    private final double[][] correlation;
    private final double[][] choleskyFactor;
    private final ComponentSampler[] samplers;

    /// Creates a model from fitted or reconstructed components.
    ///
    /// @param family the owning family
    /// @param marginals one marginal per family column
    /// @param correlation a valid correlation matrix
    /// @throws IllegalArgumentException if the correlation matrix is not positive definite
    public GaussianCopulaModel(GaussianCopulaFamily family, ScalarModel[] marginals, double[][] correlation) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        if (marginals.length != family.columns().size() || correlation.length != marginals.length) {
            throw new IllegalArgumentException("Marginals and correlation must match " + family.columns().size() + " columns");
        }
        this.marginals = marginals.clone();
        this.correlation = correlation;
        this.choleskyFactor = CorrelationAnalysis.cholesky(correlation);
        this.samplers = ComponentSamplerFactory.forModels(this.marginals);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public List<String> columns() {
        return family.columns();
    }

    public ScalarModel[] marginals() {
        return marginals.clone();
    }

    /// Returns a copy of the correlation matrix.
    public double[][] correlation() {
        double[][] copy = new double[correlation.length][];
        for (int i = 0; i < correlation.length; i++) {
            copy[i] = correlation[i].clone();
        }
        return copy;
    }

    @Override
    public ModelData sample(int count, UniformRandomProvider rng) {
        checkCount(count);
        int d = marginals.length;
        double[][] rows = new double[count][];
        double[] z = new double[d];
        for (int r = 0; r < count; r++) {
            for (int c = 0; c < d; c++) {
                z[c] = InverseNormalCDF.standardNormalQuantile(UnitInterval.open(rng));
            }
            double[] row = new double[d];
            for (int i = 0; i < d; i++) {
                double x = 0;
                for (int k = 0; k <= i; k++) {
                    x += choleskyFactor[i][k] * z[k];
                }
                row[i] = samplers[i].sample(UnitInterval.clamp(NormalCDF.standardNormalCDF(x)));
            }
            rows[r] = row;
        }
        return new ModelData(columns(), rows);
    }

    @Override
    public ModelData sampleConditional(int count, Map<String, Double> fixed, UniformRandomProvider rng) {
        checkCount(count);
        Objects.requireNonNull(fixed, "fixed cannot be null");
        if (fixed.isEmpty()) {
            return sample(count, rng);
        }

        List<String> columns = columns();
        int d = columns.size();
        List<Integer> fixedIdx = new ArrayList<>();
        List<Integer> freeIdx = new ArrayList<>();
        for (String name : fixed.keySet()) {
            if (!columns.contains(name)) {
                throw new IllegalArgumentException("Cannot condition on unknown column: " + name);
            }
        }
        for (int c = 0; c < d; c++) {
            if (fixed.containsKey(columns.get(c))) {
                fixedIdx.add(c);
            } else {
                freeIdx.add(c);
            }
        }

        int f = fixedIdx.size();
        int m = freeIdx.size();
        double[] zFixed = new double[f];
        for (int i = 0; i < f; i++) {
            int c = fixedIdx.get(i);
            zFixed[i] = GaussianCopulaFamily.normalScore(marginals[c], fixed.get(columns.get(c)));
        }

        double[][] sigmaFF = submatrix(fixedIdx, fixedIdx);
        double[][] sigmaRF = submatrix(freeIdx, fixedIdx);
        double[][] sigmaRR = submatrix(freeIdx, freeIdx);
        double[][] lFF = CorrelationAnalysis.cholesky(sigmaFF);

        // Conditional mean and the rows of Σ_rf Σ_ff⁻¹
        double[] alpha = CorrelationAnalysis.choleskySolve(lFF, zFixed);
        double[] condMean = new double[m];
        double[][] weights = new double[m][];
        for (int i = 0; i < m; i++) {
            for (int k = 0; k < f; k++) {
                condMean[i] += sigmaRF[i][k] * alpha[k];
            }
            weights[i] = CorrelationAnalysis.choleskySolve(lFF, sigmaRF[i]);
        }
        double[][] condCov = new double[m][m];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                double reduction = 0;
                for (int k = 0; k < f; k++) {
                    reduction += weights[i][k] * sigmaRF[j][k];
                }
                condCov[i][j] = sigmaRR[i][j] - reduction;
            }
        }
        double[][] lCond = stableCholesky(condCov);

        double[][] rows = new double[count][];
        double[] z = new double[m];
        for (int r = 0; r < count; r++) {
            double[] row = new double[d];
            for (int i = 0; i < f; i++) {
                int c = fixedIdx.get(i);
                row[c] = fixed.get(columns.get(c));
            }
            for (int i = 0; i < m; i++) {
                z[i] = InverseNormalCDF.standardNormalQuantile(UnitInterval.open(rng));
            }
            for (int i = 0; i < m; i++) {
                double x = condMean[i];
                for (int k = 0; k <= i; k++) {
                    x += lCond[i][k] * z[k];
                }
                int c = freeIdx.get(i);
                row[c] = samplers[c].sample(UnitInterval.clamp(NormalCDF.standardNormalCDF(x)));
            }
            rows[r] = row;
        }
        return new ModelData(columns, rows);
    }

    @Override
    public double[] parameterVector() {
        int d = marginals.length;
        double[] parameters = new double[family.parameterCount()];
        for (int c = 0; c < d; c++) {
            double[] marginal = marginals[c].toParameters();
            parameters[c * ScalarModel.PARAMETER_COUNT] = marginal[0];
            parameters[c * ScalarModel.PARAMETER_COUNT + 1] = marginal[1];
        }
        int p = d * ScalarModel.PARAMETER_COUNT;
        for (int i = 1; i < d; i++) {
            for (int j = 0; j < i; j++) {
                parameters[p++] = correlation[i][j];
            }
        }
        return parameters;
    }

    private double[][] submatrix(List<Integer> rowIdx, List<Integer> colIdx) {
        double[][] sub = new double[rowIdx.size()][colIdx.size()];
        for (int i = 0; i < rowIdx.size(); i++) {
            for (int j = 0; j < colIdx.size(); j++) {
                sub[i][j] = correlation[rowIdx.get(i)][colIdx.get(j)];
            }
        }
        return sub;
    }

    /// Factors a covariance matrix, adding diagonal jitter until it factors.
    private static double[][] stableCholesky(double[][] cov) {
        double jitter = 0;
        for (int attempt = 0; attempt < 12; attempt++) {
            double[][] candidate = new double[cov.length][];
            for (int i = 0; i < cov.length; i++) {
                candidate[i] = cov[i].clone();
                candidate[i][i] = Math.max(candidate[i][i], 0) + jitter;
            }
            if (CorrelationAnalysis.isPositiveDefinite(candidate)) {
                return CorrelationAnalysis.cholesky(candidate);
            }
            jitter = jitter == 0 ? 1e-9 : jitter * 10;
        }
        throw new IllegalStateException("Conditional covariance could not be factored");
    }

    private static void checkCount(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
    }

    @Override
    public String toString() {
        return "GaussianCopulaModel[columns=" + columns() + "]";
    }
}
