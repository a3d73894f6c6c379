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
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.FieldType;
import io.nosqlbench.relsynth.metadata.TableSpec;

import java.util.List;

/// Builds constraints from their metadata declarations.
public final class ConstraintFactory {

    private ConstraintFactory() {
        // Factory class, no instantiation
    }

    /// Creates the constraint a declaration describes and checks its columns
    /// against the table.
    ///
    /// @param spec the declaration
    /// @param table the declaring table
    /// @return the unfitted constraint
    /// @throws ConfigurationException if the kind is unknown, a parameter is
    ///     missing, or a column is undeclared, a key, or of the wrong type
    public static Constraint create(ConstraintSpec spec, TableSpec table) {
        String kind = spec.getConstraint();
        if (kind == null) {
            throw new ConfigurationException("Constraint of table " + table.getName() + " has no \"constraint\" kind");
        }
        Constraint constraint;
        boolean numerical = true;
        switch (kind) {
            case ConstraintSpec.BETWEEN:
                if (spec.getLow() == null || spec.getHigh() == null) {
                    throw new ConfigurationException("between on " + table.getName() + " needs low and high");
                }
                constraint = new Between(required(spec.getColumn(), "column", table), spec.getLow(), spec.getHigh());
                break;
            case ConstraintSpec.INEQUALITY:
                constraint = new Inequality(
                    required(spec.getLowColumn(), "low_column", table),
                    required(spec.getHighColumn(), "high_column", table),
                    spec.isStrict());
                break;
            case ConstraintSpec.UNIQUE:
                constraint = new Unique(spec.getColumns());
                numerical = false;
                break;
            case ConstraintSpec.COLUMN_FORMULA:
                constraint = new ColumnFormula(required(spec.getColumn(), "column", table),
                    spec.getTerms(), spec.getIntercept());
                break;
            default:
                throw new ConfigurationException("Unknown constraint kind '" + kind + "' on table " + table.getName());
        }
        for (String column : constraint.columns()) {
            FieldSpec field = table.field(column).orElseThrow(() -> new ConfigurationException(
                "Constraint " + kind + " references unknown column " + table.getName() + "." + column));
            if (field.isKey()) {
                throw new ConfigurationException("Constraint " + kind + " cannot reference key column " +
                    table.getName() + "." + column);
            }
        }
        if (numerical) {
            requireNumerical(table, constraint.columns());
        }
        return constraint;
    }

    private static String required(String value, String key, TableSpec table) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Constraint on table " + table.getName() + " is missing " + key);
        }
        return value;
    }

    private static void requireNumerical(TableSpec table, List<String> columns) {
        for (String column : columns) {
            table.field(column).ifPresent(field -> {
                if (field.getType() != FieldType.NUMERICAL) {
                    throw new ConfigurationException("Column " + table.getName() + "." + column +
                        " must be numerical, is " + field.getType());
                }
            });
        }
    }
}
