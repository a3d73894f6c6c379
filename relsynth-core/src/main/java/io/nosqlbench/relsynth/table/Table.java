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

package io.nosqlbench.relsynth.table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An in-memory relation: a name, an ordered column list and ordered rows of
 * boxed values.
 *
 * <p>Values are {@code Long}, {@code Double}, {@code String},
 * {@code Boolean}, {@code java.time} values or {@code null}. Tables are
 * immutable; every operation that changes shape returns a new table.
 *
 * <pre>{@code
 * Table users = Table.builder("users", "id", "age")
 *     .row(1L, 34L)
 *     .row(2L, 51L)
 *     .build();
 * }</pre>
 */
public final class Table {

    private final String name;
    private final List<String> columns;
    private final List<Object[]> rows;

    public Table(String name, List<String> columns, List<Object[]> rows) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.columns = List.copyOf(columns);
        if (this.columns.stream().distinct().count() != this.columns.size()) {
            throw new IllegalArgumentException("Duplicate column in table " + name + ": " + this.columns);
        }
        List<Object[]> copy = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            if (row.length != this.columns.size()) {
                throw new IllegalArgumentException("Row of table " + name + " has " + row.length +
                    " values, expected " + this.columns.size());
            }
            copy.add(row.clone());
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder(String name, String... columns) {
        return new Builder(name, Arrays.asList(columns));
    }

    public static Builder builder(String name, List<String> columns) {
        return new Builder(name, columns);
    }

    /**
     * Returns an empty table with the given columns.
     */
    public static Table empty(String name, List<String> columns) {
        return new Table(name, columns, List.of());
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Returns the position of a column.
     *
     * @throws IllegalArgumentException if the column is absent
     */
    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Table " + name + " has no column " + column);
        }
        return index;
    }

    /**
     * Returns a copy of one row.
     */
    public Object[] row(int index) {
        return rows.get(index).clone();
    }

    public Object get(int row, String column) {
        return rows.get(row)[columnIndex(column)];
    }

    public List<Object> column(String column) {
        int index = columnIndex(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            values.add(row[index]);
        }
        return values;
    }

    /**
     * Returns the table with one column's values replaced, or appended when
     * the column does not exist yet.
     */
    public Table withColumn(String column, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Column " + column + " has " + values.size() +
                " values, table " + name + " has " + rows.size() + " rows");
        }
        int index = columns.indexOf(column);
        List<String> newColumns = new ArrayList<>(columns);
        if (index < 0) {
            newColumns.add(column);
            index = columns.size();
        }
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            Object[] row = Arrays.copyOf(rows.get(r), newColumns.size());
            row[index] = values.get(r);
            newRows.add(row);
        }
        return new Table(name, newColumns, newRows);
    }

    public Table withoutColumn(String column) {
        int index = columnIndex(column);
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.remove(index);
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Object[] copy = new Object[row.length - 1];
            System.arraycopy(row, 0, copy, 0, index);
            System.arraycopy(row, index + 1, copy, index, row.length - index - 1);
            newRows.add(copy);
        }
        return new Table(name, newColumns, newRows);
    }

    /**
     * Returns the table with its columns in the given order. Columns not
     * listed are dropped.
     *
     * @throws IllegalArgumentException if a listed column is absent
     */
    public Table project(List<String> order) {
        int[] positions = new int[order.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = columnIndex(order.get(i));
        }
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            Object[] copy = new Object[positions.length];
            for (int i = 0; i < positions.length; i++) {
                copy[i] = row[positions[i]];
            }
            newRows.add(copy);
        }
        return new Table(name, order, newRows);
    }

    public Table selectRows(List<Integer> indices) {
        List<Object[]> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(rows.get(index));
        }
        return new Table(name, columns, selected);
    }

    /**
     * Appends the rows of a table with the same columns.
     */
    public Table appendRows(Table other) {
        if (!columns.equals(other.columns)) {
            throw new IllegalArgumentException("Column mismatch: " + columns + " vs " + other.columns);
        }
        List<Object[]> merged = new ArrayList<>(rows.size() + other.rows.size());
        merged.addAll(rows);
        merged.addAll(other.rows);
        return new Table(name, columns, merged);
    }

    public Table renamed(String newName) {
        return new Table(newName, columns, rows);
    }

    /**
     * Normalizes a key value for comparison: integral numbers become
     * {@code Long}, everything else is returned as is.
     *
     * @param value a raw key value
     * @return the normalized value, or null
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
            return d;
        }
        return value;
    }

    @Override
    public String toString() {
        return "Table[" + name + ", columns=" + columns + ", rows=" + rows.size() + "]";
    }

    /**
     * Accumulates rows for a new table.
     */
    public static final class Builder {
        private final String name;
        private final List<String> columns;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(String name, List<String> columns) {
            this.name = name;
            this.columns = List.copyOf(columns);
        }

        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + values.length);
            }
            rows.add(values.clone());
            return this;
        }

        public Table build() {
            return new Table(name, columns, rows);
        }
    }
}
