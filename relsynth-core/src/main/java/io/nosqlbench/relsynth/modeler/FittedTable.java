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
import io.nosqlbench.relsynth.metadata.ForeignKey;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.model.DegenerateTableModel;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.model.TableModel;
import io.nosqlbench.relsynth.model.TableModelFamily;
import io.nosqlbench.relsynth.transform.TableTransformer;

import java.util.List;
import java.util.Map;

/**
 * Everything the sampler needs about one fitted table.
 *
 * <p>{@code extendedData} holds the table's model rows followed by one
 * {@link ExtensionBlock} per child relationship; {@code model} was fitted
 * on it and {@code family} is its family.
 */
public final class FittedTable {

    private final TableSpec spec;
    private final ConstraintPipeline constraints;
    private final TableTransformer transformer;
    private final Map<String, List<Object>> keyValues;
    private final ModelData extendedData;
    private final List<ExtensionBlock> blocks;
    private final TableModelFamily family;
    private final TableModel model;
    private final List<String> warnings;

    public FittedTable(PreparedTable prepared, ModelData extendedData, List<ExtensionBlock> blocks,
                       TableModelFamily family, TableModel model, List<String> warnings) {
        this.spec = prepared.spec();
        this.constraints = prepared.constraints();
        this.transformer = prepared.transformer();
        this.keyValues = prepared.keyValues();
        this.extendedData = extendedData;
        this.blocks = List.copyOf(blocks);
        this.family = family;
        this.model = model;
        this.warnings = List.copyOf(warnings);
    }

    public String name() {
        return spec.getName();
    }

    public TableSpec spec() {
        return spec;
    }

    public ConstraintPipeline constraints() {
        return constraints;
    }

    public TableTransformer transformer() {
        return transformer;
    }

    /**
     * Returns the normalized values of a key column, in row order.
     */
    public List<Object> keyValues(String column) {
        List<Object> values = keyValues.get(column);
        if (values == null) {
            throw new IllegalArgumentException("Table " + name() + " has no key column " + column);
        }
        return values;
    }

    public List<Object> primaryKeys() {
        return keyValues(spec.getPrimaryKey());
    }

    public ModelData extendedData() {
        return extendedData;
    }

    public int rowCount() {
        return extendedData.rowCount();
    }

    public List<ExtensionBlock> blocks() {
        return blocks;
    }

    /**
     * Returns the block of one child relationship.
     *
     * @throws IllegalArgumentException if the relationship is not a child of this table
     */
    public ExtensionBlock block(ForeignKey relationship) {
        for (ExtensionBlock block : blocks) {
            if (block.relationship().equals(relationship)) {
                return block;
            }
        }
        throw new IllegalArgumentException("Table " + name() + " has no child relationship " + relationship);
    }

    public TableModelFamily family() {
        return family;
    }

    public TableModel model() {
        return model;
    }

    public boolean isDegenerate() {
        return model instanceof DegenerateTableModel;
    }

    public List<String> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "FittedTable[" + name() + ", rows=" + rowCount() + ", columns=" + extendedData.columnCount() +
            ", model=" + model.getModelType() + "]";
    }
}
