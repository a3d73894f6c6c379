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

/// Fits one marginal distribution type to the values of a column.
///
/// ## Fitting Process
///
/// ```
/// Observed Data ──► Fitter ──► ScalarModel
///                      │
///                      └── Also computes goodness-of-fit score
/// ```
///
/// Lower goodness-of-fit scores indicate a better fit; [BestFitSelector]
/// compares them to choose a marginal type per column.
///
/// @see NormalModelFitter
/// @see UniformModelFitter
public interface ComponentModelFitter {

    /// Result of fitting a distribution to data.
    ///
    /// @param model the fitted scalar model
    /// @param goodnessOfFit score indicating fit quality (lower is better)
    /// @param modelType the type identifier for this model
    record FitResult(ScalarModel model, double goodnessOfFit, String modelType) {

        public FitResult {
            if (model == null) {
                throw new IllegalArgumentException("model cannot be null");
            }
            if (Double.isNaN(goodnessOfFit)) {
                throw new IllegalArgumentException("goodnessOfFit cannot be NaN");
            }
        }
    }

    /// Fits this distribution type to the observed data.
    ///
    /// @param values the observed values for one column
    /// @return the fit result containing the model and goodness-of-fit score
    FitResult fit(double[] values);

    /// Fits this distribution type using pre-computed statistics.
    ///
    /// @param stats pre-computed column statistics
    /// @param values the observed values
    /// @return the fit result
    FitResult fit(DimensionStatistics stats, double[] values);

    /// Returns the model type identifier produced by this fitter.
    String getModelType();
}
