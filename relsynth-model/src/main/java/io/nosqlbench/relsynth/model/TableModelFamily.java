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

import java.util.List;

/// A family of table models over a fixed set of columns.
///
/// The family fixes everything that must stay constant across fits so that
/// parameter vectors of different fits line up: the column list, the
/// marginal type of each column and therefore the parameter layout.
public interface TableModelFamily {

    /// Returns the modeled columns, in order.
    List<String> columns();

    /// Fits a model to the given rows.
    ///
    /// @param data rows over [#columns()], at least one
    /// @return the fitted model
    /// @throws IllegalArgumentException if the data does not match the family or is empty
    /// @throws ArithmeticException if the data yields non-finite statistics
    TableModel fit(ModelData data);

    /// Rebuilds a model from a parameter vector without refitting.
    ///
    /// @param parameters values in the layout of [#parameterNames()]
    /// @return the reconstructed model
    /// @throws IllegalArgumentException if the vector has the wrong length or non-finite entries
    TableModel fromParameters(double[] parameters);

    /// Returns a parameter vector describing near point masses at the given values.
    ///
    /// @param center one value per column
    /// @return parameters in the layout of [#parameterNames()]
    double[] pointMassParameters(double[] center);

    /// Returns the names of the entries of a parameter vector.
    List<String> parameterNames();

    default int parameterCount() {
        return parameterNames().size();
    }
}
