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

package io.nosqlbench.relsynth.modeler;

import io.nosqlbench.relsynth.constraints.ConstraintPipeline;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.table.Table;
import io.nosqlbench.relsynth.transform.TableTransformer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A raw table after the constraint pipeline and field encoding, ready for
 * extension and fitting.
 *
 * @param spec the declaration
 * @param constraints the fitted constraint pipeline
 * @param transformer the fitted field transformers
 * @param keyValues normalized values of each key column, in row order
 * @param data the encoded model columns
 */
public record PreparedTable(TableSpec spec, ConstraintPipeline constraints, TableTransformer transformer,
                            Map<String, List<Object>> keyValues, ModelData data) {

    /**
     * Runs a validated raw table through its constraints and field transformers.
     *
     * @throws io.nosqlbench.relsynth.ConfigurationException if a constraint is
     *     invalid or violated by the raw rows
     */
    public static PreparedTable prepare(TableSpec spec, Table raw) {
        Table declared = raw.project(spec.columnNames());
        ConstraintPipeline constraints = ConstraintPipeline.forTable(spec);
        Table transformed = constraints.fitTransform(declared);
        TableTransformer transformer = TableTransformer.fit(spec, transformed, constraints.rewrittenColumns());

        Map<String, List<Object>> keys = new LinkedHashMap<>();
        for (String column : spec.keyColumns()) {
            List<Object> values = new ArrayList<>(declared.rowCount());
            for (Object value : declared.column(column)) {
                values.add(Table.normalizeKey(value));
            }
            keys.put(column, Collections.unmodifiableList(values));
        }
        return new PreparedTable(spec, constraints, transformer, Collections.unmodifiableMap(keys),
            transformer.encode(transformed));
    }

    public String name() {
        return spec.getName();
    }
}
