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

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.metadata.ConstraintSpec;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.table.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The ordered constraints of one table.
///
/// ```
///   fitTransform:     raw ──C1.fit/transform──► ... ──Cn.fit/transform──► transformed
///   reverseTransform: sampled ──Cn.reverse──► ... ──C1.reverse──► raw space
/// ```
///
/// Each constraint is fitted on the table as the constraints before it
/// left it.
public final class ConstraintPipeline {

    private static final Logger logger = LogManager.getLogger(ConstraintPipeline.class);

    private final String table;
    private final List<Constraint> constraints;

    public ConstraintPipeline(String table, List<Constraint> constraints) {
        this.table = table;
        this.constraints = List.copyOf(constraints);
    }

    /// Builds the pipeline a table declares.
    ///
    /// @throws ConfigurationException if a declaration is invalid
    public static ConstraintPipeline forTable(TableSpec spec) {
        List<Constraint> constraints = new ArrayList<>();
        for (ConstraintSpec constraint : spec.getConstraints()) {
            constraints.add(ConstraintFactory.create(constraint, spec));
        }
        return new ConstraintPipeline(spec.getName(), constraints);
    }

    public List<Constraint> constraints() {
        return constraints;
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    public boolean hasTableWideConstraints() {
        return constraints.stream().anyMatch(Constraint::isTableWide);
    }

    /// Columns that no longer hold raw values after the transform.
    public Set<String> rewrittenColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (Constraint constraint : constraints) {
            columns.addAll(constraint.rewrittenColumns());
            columns.addAll(constraint.droppedColumns());
        }
        return Collections.unmodifiableSet(columns);
    }

    /// Fits every constraint and transforms the raw table.
    ///
    /// @throws ConfigurationException if raw rows violate a constraint or a
    ///     constraint column is missing
    public Table fitTransform(Table raw) {
        Table current = raw;
        for (Constraint constraint : constraints) {
            try {
                constraint.fit(current);
                current = constraint.transform(current);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Cannot apply " + constraint + " to table " + table + ": " +
                    e.getMessage(), e);
            }
            logger.debug("Applied {} to table {}", constraint, table);
        }
        return current;
    }

    /// Transforms a table with already fitted constraints.
    public Table transform(Table raw) {
        Table current = raw;
        for (Constraint constraint : constraints) {
            current = constraint.transform(current);
        }
        return current;
    }

    public Table reverseTransform(Table transformed) {
        Table current = transformed;
        for (int i = constraints.size() - 1; i >= 0; i--) {
            current = constraints.get(i).reverseTransform(current);
        }
        return current;
    }

    /// Evaluates every constraint on rows in raw space.
    ///
    /// @return one flag per row, true when the row satisfies all constraints
    public boolean[] isValid(Table raw) {
        boolean[] valid = new boolean[raw.rowCount()];
        Arrays.fill(valid, true);
        for (Constraint constraint : constraints) {
            boolean[] flags = constraint.isValid(raw);
            for (int r = 0; r < valid.length; r++) {
                valid[r] &= flags[r];
            }
        }
        return valid;
    }

    @Override
    public String toString() {
        return "ConstraintPipeline[" + table + ", " + constraints + "]";
    }
}
