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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Row-major numeric matrix with named columns.
///
/// ModelData is what table models are fitted on and what they sample: every
/// value is a double in model space (already encoded by the field
/// transformers of the relational layer). Rows are `[rowCount][columnCount]`.
///
/// Instances are treated as immutable; the row arrays are not copied on
/// construction, so callers must not modify them afterwards.
///
/// @param columns the column names, in order
/// @param rows the values, one array per row
public record ModelData(List<String> columns, double[][] rows) {

    public ModelData {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        columns = List.copyOf(columns);
        for (int r = 0; r < rows.length; r++) {
            if (rows[r] == null || rows[r].length != columns.size()) {
                throw new IllegalArgumentException(
                    "Row " + r + " has " + (rows[r] == null ? "no" : rows[r].length) +
                    " values, expected " + columns.size());
            }
        }
    }

    /// Creates an empty matrix with the given columns.
    ///
    /// @param columns the column names
    /// @return a matrix with no rows
    public static ModelData empty(List<String> columns) {
        return new ModelData(columns, new double[0][]);
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns.size();
    }

    /// Returns the position of a column, or -1 when absent.
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    /// Returns a copy of one column's values.
    public double[] column(int index) {
        double[] values = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            values[r] = rows[r][index];
        }
        return values;
    }

    public double[] row(int index) {
        return rows[index];
    }

    /// Returns the rows at the given positions, in the given order.
    public ModelData selectRows(List<Integer> indices) {
        double[][] selected = new double[indices.size()][];
        for (int i = 0; i < selected.length; i++) {
            selected[i] = rows[indices.get(i)];
        }
        return new ModelData(columns, selected);
    }

    /// Returns a projection onto the named columns.
    ///
    /// @throws IllegalArgumentException if a column is absent
    public ModelData selectColumns(List<String> names) {
        int[] positions = new int[names.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = indexOf(names.get(i));
            if (positions[i] < 0) {
                throw new IllegalArgumentException("Unknown column: " + names.get(i));
            }
        }
        double[][] projected = new double[rows.length][positions.length];
        for (int r = 0; r < rows.length; r++) {
            for (int i = 0; i < positions.length; i++) {
                projected[r][i] = rows[r][positions[i]];
            }
        }
        return new ModelData(names, projected);
    }

    /// Appends a block of columns; `block` must have one row per row of this matrix.
    public ModelData appendColumns(List<String> names, double[][] block) {
        if (block.length != rows.length) {
            throw new IllegalArgumentException(
                "Column block has " + block.length + " rows, expected " + rows.length);
        }
        List<String> combined = new ArrayList<>(columns);
        combined.addAll(names);
        double[][] merged = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            double[] row = new double[combined.size()];
            System.arraycopy(rows[r], 0, row, 0, columns.size());
            System.arraycopy(block[r], 0, row, columns.size(), names.size());
            merged[r] = row;
        }
        return new ModelData(combined, merged);
    }

    /// Appends the rows of another matrix with identical columns.
    public ModelData appendRows(ModelData other) {
        if (!columns.equals(other.columns)) {
            throw new IllegalArgumentException("Column mismatch: " + columns + " vs " + other.columns);
        }
        double[][] merged = new double[rows.length + other.rows.length][];
        System.arraycopy(rows, 0, merged, 0, rows.length);
        System.arraycopy(other.rows, 0, merged, rows.length, other.rows.length);
        return new ModelData(columns, merged);
    }

    @Override
    public String toString() {
        return "ModelData[columns=" + columns + ", rows=" + rows.length + "]";
    }
}
