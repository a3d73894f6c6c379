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

package io.nosqlbench.relsynth.transform;

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encodes the non-key columns of a constraint-transformed table as
 * {@link ModelData} and decodes sampled model rows back.
 *
 * <p>One {@link FieldTransformer} per model column, chosen from the
 * declared field type. Columns rewritten by a constraint hold unbounded
 * floats and always get a float {@link NumericalTransformer}.
 */
public final class TableTransformer {

    private final String table;
    private final List<String> columns;
    private final Map<String, FieldTransformer> transformers;

    private TableTransformer(String table, Map<String, FieldTransformer> transformers) {
        this.table = table;
        this.columns = Collections.unmodifiableList(new ArrayList<>(transformers.keySet()));
        this.transformers = transformers;
    }

    /**
     * Fits one transformer per model column of a transformed table.
     *
     * @param spec the table declaration
     * @param transformed the table after the constraint pipeline
     * @param rewritten columns whose values a constraint replaced
     * @return the fitted transformer
     */
    public static TableTransformer fit(TableSpec spec, Table transformed, Set<String> rewritten) {
        Map<String, FieldTransformer> transformers = new LinkedHashMap<>();
        for (String column : transformed.columns()) {
            FieldSpec field = spec.field(column).orElseThrow(() ->
                new ConfigurationException("Column " + spec.getName() + "." + column + " is not declared"));
            if (field.isKey()) {
                continue;
            }
            FieldTransformer transformer = rewritten.contains(column)
                ? new NumericalTransformer(column, false)
                : forField(field);
            transformer.fit(transformed.column(column));
            transformers.put(column, transformer);
        }
        return new TableTransformer(spec.getName(), transformers);
    }

    static FieldTransformer forField(FieldSpec field) {
        switch (field.getType()) {
            case NUMERICAL:
                return new NumericalTransformer(field.getName(), field.isIntegerNumerical());
            case CATEGORICAL:
                return new CategoricalTransformer();
            case BOOLEAN:
                return new BooleanTransformer(field.getName());
            case DATETIME:
                return new DatetimeTransformer(field.getName(), field.getFormat());
            default:
                throw new IllegalArgumentException("No transformer for field type " + field.getType());
        }
    }

    /**
     * Returns the model columns, in table order.
     */
    public List<String> columns() {
        return columns;
    }

    public boolean isModeled(String column) {
        return transformers.containsKey(column);
    }

    /**
     * Encodes one value of a model column.
     *
     * @throws IllegalArgumentException if the column is not modeled
     */
    public double encode(String column, Object value) {
        FieldTransformer transformer = transformers.get(column);
        if (transformer == null) {
            throw new IllegalArgumentException("Column " + table + "." + column + " is not modeled");
        }
        return transformer.encode(value);
    }

    public ModelData encode(Table transformed) {
        double[][] rows = new double[transformed.rowCount()][columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            String column = columns.get(c);
            FieldTransformer transformer = transformers.get(column);
            List<Object> values = transformed.column(column);
            for (int r = 0; r < rows.length; r++) {
                rows[r][c] = transformer.encode(values.get(r));
            }
        }
        return new ModelData(columns, rows);
    }

    /**
     * Decodes the model columns of sampled rows; extra columns are ignored.
     *
     * @param data sampled rows containing at least the model columns
     * @return a table over the model columns in transformed space
     */
    public Table decode(ModelData data) {
        int[] positions = new int[columns.size()];
        for (int c = 0; c < positions.length; c++) {
            positions[c] = data.indexOf(columns.get(c));
            if (positions[c] < 0) {
                throw new IllegalArgumentException("Sampled data lacks column " + columns.get(c));
            }
        }
        List<Object[]> rows = new ArrayList<>(data.rowCount());
        for (int r = 0; r < data.rowCount(); r++) {
            double[] source = data.row(r);
            Object[] row = new Object[positions.length];
            for (int c = 0; c < positions.length; c++) {
                row[c] = transformers.get(columns.get(c)).decode(source[positions[c]]);
            }
            rows.add(row);
        }
        return new Table(table, columns, rows);
    }
}
