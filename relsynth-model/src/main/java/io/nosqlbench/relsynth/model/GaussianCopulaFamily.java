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

import io.nosqlbench.relsynth.extract.BestFitSelector;
import io.nosqlbench.relsynth.extract.ComponentModelFitter;
import io.nosqlbench.relsynth.extract.CorrelationAnalysis;
import io.nosqlbench.relsynth.extract.NormalModelFitter;
import io.nosqlbench.relsynth.sampling.InverseNormalCDF;
import io.nosqlbench.relsynth.sampling.UnitInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Gaussian copula family: one parametric marginal per column joined by a
/// correlation matrix over normal scores.
///
/// ## Parameter layout
///
/// ```
/// [ c0__loc, c0__log_scale, c1__loc, c1__log_scale, ... ,
///   c1__c0__corr, c2__c0__corr, c2__c1__corr, ... ]
/// ```
///
/// Two entries per column, followed by the strict lower triangle of the
/// correlation matrix in row order. The marginal type of every column is
/// fixed when the family is created, so every fit and every reconstruction
/// uses the same layout.
///
/// @see GaussianCopulaModel
public final class GaussianCopulaFamily implements TableModelFamily {

    private final List<String> columns;
    private final List<ComponentModelFitter> fitters;
    private final List<String> marginalTypes;
    private final List<String> parameterNames;

    /// Creates a family with one fitter per column.
    ///
    /// @param columns the modeled columns
    /// @param fitters the marginal fitter of each column
    public GaussianCopulaFamily(List<String> columns, List<ComponentModelFitter> fitters) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(fitters, "fitters cannot be null");
        if (columns.size() != fitters.size()) {
            throw new IllegalArgumentException(
                "Expected one fitter per column, got " + fitters.size() + " for " + columns.size() + " columns");
        }
        this.columns = List.copyOf(columns);
        this.fitters = List.copyOf(fitters);
        List<String> types = new ArrayList<>(fitters.size());
        for (ComponentModelFitter fitter : fitters) {
            types.add(fitter.getModelType());
        }
        this.marginalTypes = Collections.unmodifiableList(types);
        this.parameterNames = buildParameterNames(this.columns);
    }

    /// Creates a family with normal marginals on every column.
    public static GaussianCopulaFamily normal(List<String> columns) {
        List<ComponentModelFitter> fitters = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            fitters.add(new NormalModelFitter());
        }
        return new GaussianCopulaFamily(columns, fitters);
    }

    /// Creates a family whose marginal types are chosen per column on the
    /// given data. Columns of an empty matrix default to normal.
    ///
    /// @param data the full table the family will be used for
    /// @param selector the candidate fitters
    /// @return a family over the data's columns
    public static GaussianCopulaFamily bestFit(ModelData data, BestFitSelector selector) {
        List<ComponentModelFitter> fitters = new ArrayList<>(data.columnCount());
        for (int c = 0; c < data.columnCount(); c++) {
            if (data.rowCount() == 0) {
                fitters.add(new NormalModelFitter());
            } else {
                fitters.add(selector.selectBestFitter(data.column(c)));
            }
        }
        return new GaussianCopulaFamily(data.columns(), fitters);
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    /// Returns the marginal type of each column.
    public List<String> marginalTypes() {
        return marginalTypes;
    }

    @Override
    public TableModel fit(ModelData data) {
        Objects.requireNonNull(data, "data cannot be null");
        if (!columns.equals(data.columns())) {
            throw new IllegalArgumentException("Data columns " + data.columns() + " do not match family " + columns);
        }
        if (data.rowCount() == 0) {
            throw new IllegalArgumentException("Cannot fit a copula to zero rows");
        }

        int d = columns.size();
        ScalarModel[] marginals = new ScalarModel[d];
        for (int c = 0; c < d; c++) {
            marginals[c] = fitters.get(c).fit(data.column(c)).model();
        }

        int n = data.rowCount();
        double[][] scores = new double[n][d];
        for (int r = 0; r < n; r++) {
            double[] row = data.row(r);
            for (int c = 0; c < d; c++) {
                scores[r][c] = normalScore(marginals[c], row[c]);
            }
        }
        double[][] correlation = CorrelationAnalysis.repair(
            CorrelationAnalysis.computeCorrelationMatrix(scores, d));
        return new GaussianCopulaModel(this, marginals, correlation);
    }

    @Override
    public TableModel fromParameters(double[] parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        if (parameters.length != parameterNames.size()) {
            throw new IllegalArgumentException(
                "Expected " + parameterNames.size() + " parameters, got " + parameters.length);
        }
        for (int i = 0; i < parameters.length; i++) {
            if (!Double.isFinite(parameters[i])) {
                throw new IllegalArgumentException(
                    "Non-finite parameter " + parameterNames.get(i) + ": " + parameters[i]);
            }
        }

        int d = columns.size();
        ScalarModel[] marginals = new ScalarModel[d];
        for (int c = 0; c < d; c++) {
            marginals[c] = ScalarModels.fromParameters(
                marginalTypes.get(c),
                parameters[c * ScalarModel.PARAMETER_COUNT],
                parameters[c * ScalarModel.PARAMETER_COUNT + 1]);
        }

        double[][] correlation = CorrelationAnalysis.identity(d);
        int p = d * ScalarModel.PARAMETER_COUNT;
        for (int i = 1; i < d; i++) {
            for (int j = 0; j < i; j++) {
                correlation[i][j] = parameters[p];
                correlation[j][i] = parameters[p];
                p++;
            }
        }
        return new GaussianCopulaModel(this, marginals, CorrelationAnalysis.repair(correlation));
    }

    @Override
    public double[] pointMassParameters(double[] center) {
        if (center.length != columns.size()) {
            throw new IllegalArgumentException(
                "Expected " + columns.size() + " center values, got " + center.length);
        }
        double[] parameters = new double[parameterNames.size()];
        for (int c = 0; c < center.length; c++) {
            double[] marginal = ScalarModels.pointMass(marginalTypes.get(c), center[c]).toParameters();
            parameters[c * ScalarModel.PARAMETER_COUNT] = marginal[0];
            parameters[c * ScalarModel.PARAMETER_COUNT + 1] = marginal[1];
        }
        return parameters;
    }

    @Override
    public List<String> parameterNames() {
        return parameterNames;
    }

    /// Maps a value to its standard normal score under a marginal.
    static double normalScore(ScalarModel marginal, double value) {
        return InverseNormalCDF.standardNormalQuantile(UnitInterval.clamp(marginal.cdf(value)));
    }

    private static List<String> buildParameterNames(List<String> columns) {
        List<String> names = new ArrayList<>();
        for (String column : columns) {
            names.add(column + "__loc");
            names.add(column + "__log_scale");
        }
        for (int i = 1; i < columns.size(); i++) {
            for (int j = 0; j < i; j++) {
                names.add(columns.get(i) + "__" + columns.get(j) + "__corr");
            }
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public String toString() {
        return "GaussianCopulaFamily[columns=" + columns + ", marginals=" + marginalTypes + "]";
    }
}
