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

import org.apache.commons.rng.UniformRandomProvider;

import java.util.List;
import java.util.Map;

/// Fitted generative model over the numeric columns of one table.
///
/// ## Capability contract
///
/// ```
///   TableModelFamily ──fit(ModelData)──────────► TableModel
///          ▲                                        │
///          └──fromParameters(double[])◄──parameterVector()
/// ```
///
/// A TableModel samples rows, samples rows conditioned on fixed column
/// values, and reports a parameter vector of fixed length for its family.
/// The family can rebuild an equivalent model from such a vector without
/// refitting, which is what lets the relational layer aggregate a child
/// table's per-parent models into parent columns and invert them later.
///
/// Each instance is owned by a single table and is never shared.
///
/// @see TableModelFamily
/// @see GaussianCopulaModel
/// @see DegenerateTableModel
public interface TableModel {

    /// Returns the model type identifier.
    String getModelType();

    /// Returns the modeled columns, in order.
    List<String> columns();

    /// Draws rows from the model.
    ///
    /// @param count the number of rows, at least 0
    /// @param rng the random source
    /// @return the sampled rows over [#columns()]
    ModelData sample(int count, UniformRandomProvider rng);

    /// Draws rows with some columns held at fixed values.
    ///
    /// @param count the number of rows, at least 0
    /// @param fixed column name to model-space value
    /// @param rng the random source
    /// @return the sampled rows; fixed columns carry exactly the given values
    /// @throws IllegalArgumentException if a fixed column is not modeled
    ModelData sampleConditional(int count, Map<String, Double> fixed, UniformRandomProvider rng);

    /// Returns the model's parameters in the layout of
    /// [TableModelFamily#parameterNames()].
    double[] parameterVector();
}
