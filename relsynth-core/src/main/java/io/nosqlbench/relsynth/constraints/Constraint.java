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

package io.nosqlbench.relsynth.constraints;

import io.nosqlbench.relsynth.table.Table;

import java.util.List;

/// A declarative rule over columns of one table with a reversible transform.
///
/// ## Lifecycle
///
/// ```
///   raw ──fit──► (learned state)
///   raw ──transform──► unconstrained ──(modeling, sampling)──► sampled
///   sampled ──reverseTransform──► raw space ──isValid──► accept / resample
/// ```
///
/// [#transform(Table)] raises a
/// [io.nosqlbench.relsynth.ConfigurationException] when raw rows violate
/// the rule. Reverse transformation never fails; rows it cannot make valid
/// are caught by [#isValid(Table)].
public interface Constraint {

    /// Returns the constraint kind as written in metadata.
    String getConstraintType();

    /// Returns every column the constraint reads or writes.
    List<String> columns();

    /// Columns whose values the transform replaces by unbounded floats.
    default List<String> rewrittenColumns() {
        return List.of();
    }

    /// Columns the transform removes and the reverse transform restores.
    default List<String> droppedColumns() {
        return List.of();
    }

    /// True when a row's validity depends on the rows before it.
    default boolean isTableWide() {
        return false;
    }

    /// Learns state from the table as it reaches this constraint.
    void fit(Table table);

    Table transform(Table table);

    Table reverseTransform(Table table);

    /// Evaluates every row. Table-wide constraints judge each row against
    /// the rows before it.
    ///
    /// @param table rows in raw space
    /// @return one flag per row
    boolean[] isValid(Table table);
}
