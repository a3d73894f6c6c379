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

import io.nosqlbench.relsynth.extract.ComponentModelFitter.FitResult;
import io.nosqlbench.relsynth.model.ScalarModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Selects the best-fitting marginal distribution type for a column.
 *
 * <h2>Selection Algorithm</h2>
 *
 * <pre>{@code
 * For each column:
 *   1. Compute column statistics
 *   2. For each fitter in the candidate list:
 *      a. Fit the model to data
 *      b. Compute goodness-of-fit score
 *   3. Select the model with the lowest (best) score
 * }</pre>
 *
 * <p>Ties go to the fitter listed first, so the normal fitter wins for
 * columns with too few distinct values to tell the types apart.
 *
 * @see ComponentModelFitter
 */
public final class BestFitSelector {

    private final List<ComponentModelFitter> fitters;

    /**
     * Creates a selector with specified fitters.
     *
     * @param fitters the list of fitters to consider, in order of preference
     */
    public BestFitSelector(List<ComponentModelFitter> fitters) {
        Objects.requireNonNull(fitters, "fitters cannot be null");
        if (fitters.isEmpty()) {
            throw new IllegalArgumentException("fitters cannot be empty");
        }
        this.fitters = new ArrayList<>(fitters);
    }

    /**
     * Creates a selector with only the normal fitter.
     */
    public static BestFitSelector normalOnly() {
        return new BestFitSelector(List.of(new NormalModelFitter()));
    }

    /**
     * Creates a selector over the parametric fitters this library ships.
     *
     * @return a BestFitSelector with Normal and Uniform fitters
     */
    public static BestFitSelector parametricOnly() {
        return new BestFitSelector(List.of(
            new NormalModelFitter(),
            new UniformModelFitter()
        ));
    }

    /**
     * Selects the best-fitting model for the given data.
     *
     * @param values the observed values for one column
     * @return the best-fitting scalar model
     */
    public ScalarModel selectBest(double[] values) {
        return selectBestResult(values).model();
    }

    /**
     * Selects the best-fitting model and returns the full result.
     *
     * @param values the observed values for one column
     * @return the FitResult for the best model
     */
    public FitResult selectBestResult(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values cannot be empty");
        }

        DimensionStatistics stats = DimensionStatistics.compute(0, values);
        return selectBestResult(stats, values);
    }

    /**
     * Selects the best-fitting model using pre-computed statistics.
     *
     * @param stats pre-computed column statistics
     * @param values the observed values
     * @return the FitResult for the best model
     */
    public FitResult selectBestResult(DimensionStatistics stats, double[] values) {
        FitResult best = null;
        for (ComponentModelFitter fitter : fitters) {
            FitResult result = fitter.fit(stats, values);
            if (best == null || result.goodnessOfFit() < best.goodnessOfFit()) {
                best = result;
            }
        }
        return best;
    }

    /**
     * Returns the fitter that produced the best result, so that later fits of
     * the same column can reuse its distribution type.
     *
     * @param values the observed values for one column
     * @return the winning fitter
     */
    public ComponentModelFitter selectBestFitter(double[] values) {
        String bestType = selectBestResult(values).modelType();
        for (ComponentModelFitter fitter : fitters) {
            if (fitter.getModelType().equals(bestType)) {
                return fitter;
            }
        }
        throw new IllegalStateException("No fitter for model type " + bestType);
    }

    /**
     * Fits all candidate distributions and returns all results.
     *
     * @param values the observed values for one column
     * @return list of all fit results, in fitter order
     */
    public List<FitResult> fitAll(double[] values) {
        DimensionStatistics stats = DimensionStatistics.compute(0, values);
        List<FitResult> results = new ArrayList<>(fitters.size());
        for (ComponentModelFitter fitter : fitters) {
            results.add(fitter.fit(stats, values));
        }
        return results;
    }

    /**
     * Returns the list of fitters used by this selector.
     */
    public List<ComponentModelFitter> getFitters() {
        return new ArrayList<>(fitters);
    }
}
