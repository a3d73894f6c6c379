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
 * Keeps a numeric column inside {@code [low, high]}.
 *
 * <pre>{@code
 * transform:  v ──► s = (v - low) / (high - low) ──► clamp(s, ε, 1-ε) ──► logit(s)
 * reverse:    x ──► sigmoid(x) ──► low + s (high - low) ──► clamp ──► round
 * }</pre>
 *
 * <p>The logit is evaluated in two forms with the same value. In the middle
 * half of the range it is {@code 2 atanh(t)} of the offset from the midpoint,
 * {@code t = (v - mid) / half}; towards the bounds it is
 * {@code log((v - low) / (high - v))}. Either form keeps the relative precision
 * of the small quantity it starts from, so a value comes back to within a few
 * ulps of itself. The clamp ε is an absolute distance, at most a quarter of the
 * learned rounding step, so values on a bound round back onto it.
 */
public final class Between implements Constraint {

    public static final String TYPE = "between";

    static final double EPSILON = 1e-12;

    /// |x| at which the transform switches between its two forms, logit(3/4).
    private static final double MIDDLE = Math.log(3.0);

    private final String column;
    private final double low;
    private final double high;
    private RoundingScheme rounding;
    private double epsilon;

    public Between(String column, double low, double high) {
        if (!(low < high)) {
            throw new ConfigurationException("between on " + column + " needs low < high, got " + low + ", " + high);
        }
        this.column = column;
        this.low = low;
        this.high = high;
    }

    @Override
    public String getConstraintType() {
        return TYPE;
    }

    @Override
    public List<String> columns() {
        return List.of(column);
    }

    @Override
    public List<String> rewrittenColumns() {
        return List.of(column);
    }

    @Override
    public void fit(Table table) {
        rounding = RoundingScheme.learn(table.column(column));
        epsilon = Math.min(EPSILON * (high - low), rounding.halfStep() / 4);
    }

    @Override
    public Table transform(Table table) {
        requireFitted();
        List<Object> values = table.column(column);
        List<Object> transformed = new ArrayList<>(values.size());
        for (int r = 0; r < values.size(); r++) {
            Double v = Constraints.toDouble(values.get(r), column);
            if (v == null) {
                transformed.add(null);
                continue;
            }
            if (v < low || v > high) {
                throw new ConfigurationException("Value " + v + " of " + table.name() + "." + column + " in row " + r +
                    " lies outside [" + low + ", " + high + "]");
            }
            transformed.add(logit(v));
        }
        return table.withColumn(column, transformed);
    }

    @Override
    public Table reverseTransform(Table table) {
        requireFitted();
        List<Object> values = table.column(column);
        List<Object> restored = new ArrayList<>(values.size());
        for (Object value : values) {
            Double x = Constraints.toDouble(value, column);
            if (x == null) {
                restored.add(null);
                continue;
            }
            double v = Math.max(low, Math.min(high, expit(x)));
            restored.add(rounding.apply(v));
        }
        return table.withColumn(column, restored);
    }

    @Override
    public boolean[] isValid(Table table) {
        List<Object> values = table.column(column);
        boolean[] valid = new boolean[values.size()];
        for (int r = 0; r < valid.length; r++) {
            Double v = Constraints.lenient(values.get(r));
            valid[r] = v == null || (v >= low && v <= high);
        }
        return valid;
    }

    double logit(double v) {
        double half = (high - low) / 2;
        double t = (v - (low + half)) / half;
        if (Math.abs(t) < 0.5) {
            return Math.log1p(2 * t / (1 - t));
        }
        double below = Math.max(epsilon, v - low);
        double above = Math.max(epsilon, high - v);
        return Math.log(below / above);
    }

    double expit(double x) {
        double half = (high - low) / 2;
        if (Math.abs(x) < MIDDLE) {
            return low + half + half * Math.tanh(x / 2);
        }
        if (x < 0) {
            return low + (high - low) * sigmoid(x);
        }
        return high - (high - low) * sigmoid(-x);
    }

    static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double e = Math.exp(x);
        return e / (1.0 + e);
    }

    private void requireFitted() {
        if (rounding == null) {
            throw new IllegalStateException("between constraint on " + column + " has not been fitted");
        }
    }

    @Override
    public String toString() {
        return "Between[" + column + " in [" + low + ", " + high + "]]";
    }
}
