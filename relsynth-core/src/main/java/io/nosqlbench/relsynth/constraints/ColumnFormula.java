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
import io.nosqlbench.relsynth.table.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A column derived from others: {@code column = intercept + Σ coefficient × term}.
 *
 * <p>The derived column carries no information of its own, so the
 * transform drops it and the reverse transform recomputes it, rounded to
 * the column's learned precision. A row with a null term is not checked.
 */
public final class ColumnFormula implements Constraint {

    public static final String TYPE = "column_formula";

    static final double RELATIVE_TOLERANCE = 1e-9;

    private final String column;
    private final Map<String, Double> terms;
    private final double intercept;
    private RoundingScheme rounding;

    public ColumnFormula(String column, Map<String, Double> terms, double intercept) {
        if (terms == null || terms.isEmpty()) {
            throw new ConfigurationException("column_formula on " + column + " needs at least one term");
        }
        if (terms.containsKey(column)) {
            throw new ConfigurationException("column_formula on " + column + " cannot reference itself");
        }
        for (Map.Entry<String, Double> term : terms.entrySet()) {
            if (term.getValue() == null || !Double.isFinite(term.getValue())) {
                throw new ConfigurationException("column_formula on " + column + " has invalid coefficient for " +
                    term.getKey());
            }
        }
        this.column = column;
        this.terms = new LinkedHashMap<>(terms);
        this.intercept = intercept;
    }

    @Override
    public String getConstraintType() {
        return TYPE;
    }

    @Override
    public List<String> columns() {
        List<String> columns = new ArrayList<>();
        columns.add(column);
        columns.addAll(terms.keySet());
        return columns;
    }

    @Override
    public List<String> droppedColumns() {
        return List.of(column);
    }

    @Override
    public void fit(Table table) {
        rounding = RoundingScheme.learn(table.column(column));
    }

    @Override
    public Table transform(Table table) {
        if (rounding == null) {
            fit(table);
        }
        List<Object> values = table.column(column);
        for (int r = 0; r < values.size(); r++) {
            Double expected = expected(table, r, false);
            Double actual = Constraints.toDouble(values.get(r), column);
            if (expected != null && (actual == null || !matches(actual, expected))) {
                throw new ConfigurationException("Row " + r + " of " + table.name() + " violates " + this +
                    ": expected " + expected + ", got " + actual);
            }
        }
        return table.withoutColumn(column);
    }

    @Override
    public Table reverseTransform(Table table) {
        if (rounding == null) {
            throw new IllegalStateException("column_formula on " + column + " has not been fitted");
        }
        List<Object> values = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            Double expected = expected(table, r, false);
            values.add(expected == null ? null : rounding.apply(expected));
        }
        return table.withColumn(column, values);
    }

    @Override
    public boolean[] isValid(Table table) {
        List<Object> values = table.column(column);
        boolean[] valid = new boolean[values.size()];
        for (int r = 0; r < valid.length; r++) {
            Double expected = expected(table, r, true);
            Double actual = Constraints.lenient(values.get(r));
            valid[r] = expected == null || (actual != null && matches(actual, expected));
        }
        return valid;
    }

    private Double expected(Table table, int row, boolean lenient) {
        double sum = intercept;
        for (Map.Entry<String, Double> term : terms.entrySet()) {
            Object raw = table.get(row, term.getKey());
            Double value = lenient ? Constraints.lenient(raw) : Constraints.toDouble(raw, term.getKey());
            if (value == null) {
                return null;
            }
            sum += term.getValue() * value;
        }
        return sum;
    }

    private boolean matches(double actual, double expected) {
        double tolerance = Math.max(RELATIVE_TOLERANCE * Math.max(1.0, Math.abs(expected)),
            rounding == null ? 0.0 : rounding.halfStep() * (1 + 1e-9));
        return Math.abs(actual - expected) <= tolerance;
    }

    @Override
    public String toString() {
        return "ColumnFormula[" + column + " = " + intercept + " + " + terms + "]";
    }
}
