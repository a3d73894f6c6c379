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
import java.util.Objects;

/// Zero-variance fallback model: replays the observed rows in order.
///
/// Substituted for a table whose data is too small or too ill-conditioned
/// for its family. Sampling `n` rows cycles through the observed rows, so a
/// one-row table always yields copies of that row. The parameter vector is
/// the family's point mass at the column means, which keeps the layout the
/// relational layer expects.
public final class DegenerateTableModel implements TableModel {

    public static final String MODEL_TYPE = "degenerate";

    private final TableModelFamily family;
    private final double[][] observed;
    private final double[] center;

    /// @param family the family whose parameter layout this model reports
    /// @param data the observed rows; when empty, rows of zeros are produced
    public DegenerateTableModel(TableModelFamily family, ModelData data) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (!family.columns().equals(data.columns())) {
            throw new IllegalArgumentException("Data columns " + data.columns() + " do not match " + family.columns());
        }
        int d = data.columnCount();
        this.center = new double[d];
        for (int r = 0; r < data.rowCount(); r++) {
            for (int c = 0; c < d; c++) {
                center[c] += data.row(r)[c] / data.rowCount();
            }
        }
        this.observed = data.rowCount() == 0 ? new double[][]{center.clone()} : data.rows().clone();
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    @Override
    public List<String> columns() {
        return family.columns();
    }

    @Override
    public ModelData sample(int count, UniformRandomProvider rng) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got: " + count);
        }
        double[][] rows = new double[count][];
        for (int r = 0; r < count; r++) {
            rows[r] = observed[r % observed.length].clone();
        }
        return new ModelData(columns(), rows);
    }

    @Override
    public ModelData sampleConditional(int count, Map<String, Double> fixed, UniformRandomProvider rng) {
        ModelData sampled = sample(count, rng);
        List<String> columns = columns();
        for (Map.Entry<String, Double> entry : fixed.entrySet()) {
            int c = columns.indexOf(entry.getKey());
            if (c < 0) {
                throw new IllegalArgumentException("Cannot condition on unknown column: " + entry.getKey());
            }
            for (double[] row : sampled.rows()) {
                row[c] = entry.getValue();
            }
        }
        return sampled;
    }

    @Override
    public double[] parameterVector() {
        return family.pointMassParameters(center);
    }

    @Override
    public String toString() {
        return "DegenerateTableModel[columns=" + columns() + ", rows=" + observed.length + "]";
    }
}
