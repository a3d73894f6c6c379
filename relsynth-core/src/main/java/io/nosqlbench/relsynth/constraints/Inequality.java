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
import java.util.List;

/**
 * Keeps {@code low_column <= high_column}, or {@code <} when strict.
 *
 * <p>The high column is replaced by {@code log(high - low + 1)} and rebuilt
 * as {@code low + exp(diff) - 1}. A null on either side leaves the row
 * unconstrained.
 */
public final class Inequality implements Constraint {

    public static final String TYPE = "inequality";

    private final String lowColumn;
    private final String highColumn;
    private final boolean strict;
    private RoundingScheme rounding;

    public Inequality(String lowColumn, String highColumn, boolean strict) {
        if (lowColumn.equals(highColumn)) {
            throw new ConfigurationException("inequality needs two distinct columns, got " + lowColumn + " twice");
        }
        this.lowColumn = lowColumn;
        this.highColumn = highColumn;
        this.strict = strict;
    }

    @Override
    public String getConstraintType() {
        return TYPE;
    }

    @Override
    public List<String> columns() {
        return List.of(lowColumn, highColumn);
    }

    @Override
    public List<String> rewrittenColumns() {
        return List.of(highColumn);
    }

    @Override
    public void fit(Table table) {
        rounding = RoundingScheme.learn(table.column(highColumn));
    }

    @Override
    public Table transform(Table table) {
        List<Object> lows = table.column(lowColumn);
        List<Object> highs = table.column(highColumn);
        List<Object> diffs = new ArrayList<>(lows.size());
        for (int r = 0; r < lows.size(); r++) {
            Double l = Constraints.toDouble(lows.get(r), lowColumn);
            Double h = Constraints.toDouble(highs.get(r), highColumn);
            if (l == null || h == null) {
                diffs.add(null);
                continue;
            }
            if (!holds(l, h)) {
                throw new ConfigurationException("Row " + r + " of " + table.name() + " violates " + this +
                    ": " + l + ", " + h);
            }
            diffs.add(Math.log(h - l + 1.0));
        }
        return table.withColumn(highColumn, diffs);
    }

    @Override
    public Table reverseTransform(Table table) {
        if (rounding == null) {
            throw new IllegalStateException("inequality constraint on " + highColumn + " has not been fitted");
        }
        List<Object> lows = table.column(lowColumn);
        List<Object> diffs = table.column(highColumn);
        List<Object> highs = new ArrayList<>(lows.size());
        for (int r = 0; r < lows.size(); r++) {
            Double l = Constraints.toDouble(lows.get(r), lowColumn);
            Double x = Constraints.toDouble(diffs.get(r), highColumn);
            if (l == null || x == null) {
                highs.add(null);
                continue;
            }
            double diff = Math.max(0.0, Math.expm1(x));
            highs.add(rounding.apply(l + diff));
        }
        return table.withColumn(highColumn, highs);
    }

    @Override
    public boolean[] isValid(Table table) {
        List<Object> lows = table.column(lowColumn);
        List<Object> highs = table.column(highColumn);
        boolean[] valid = new boolean[lows.size()];
        for (int r = 0; r < valid.length; r++) {
            Double l = Constraints.lenient(lows.get(r));
            Double h = Constraints.lenient(highs.get(r));
            valid[r] = l == null || h == null || holds(l, h);
        }
        return valid;
    }

    private boolean holds(double low, double high) {
        return strict ? high > low : high >= low;
    }

    @Override
    public String toString() {
        return "Inequality[" + lowColumn + (strict ? " < " : " <= ") + highColumn + "]";
    }
}
