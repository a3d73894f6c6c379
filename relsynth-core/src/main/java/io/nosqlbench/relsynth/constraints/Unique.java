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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * No two rows share the same values in the given columns.
 *
 * <p>The transform is the identity. Validity is table-wide: a row is valid
 * when its tuple did not occur in an earlier row.
 */
public final class Unique implements Constraint {

    public static final String TYPE = "unique";

    private final List<String> columns;

    public Unique(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("unique constraint needs at least one column");
        }
        this.columns = List.copyOf(columns);
    }

    @Override
    public String getConstraintType() {
        return TYPE;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public boolean isTableWide() {
        return true;
    }

    @Override
    public void fit(Table table) {
        for (String column : columns) {
            table.columnIndex(column);
        }
    }

    @Override
    public Table transform(Table table) {
        boolean[] valid = isValid(table);
        for (int r = 0; r < valid.length; r++) {
            if (!valid[r]) {
                throw new ConfigurationException("Row " + r + " of " + table.name() + " repeats " + columns +
                    " = " + tuple(table, r));
            }
        }
        return table;
    }

    @Override
    public Table reverseTransform(Table table) {
        return table;
    }

    @Override
    public boolean[] isValid(Table table) {
        boolean[] valid = new boolean[table.rowCount()];
        Set<List<Object>> seen = new HashSet<>();
        for (int r = 0; r < valid.length; r++) {
            valid[r] = seen.add(tuple(table, r));
        }
        return valid;
    }

    private List<Object> tuple(Table table, int row) {
        List<Object> tuple = new ArrayList<>(columns.size());
        for (String column : columns) {
            tuple.add(Table.normalizeKey(table.get(row, column)));
        }
        return tuple;
    }

    @Override
    public String toString() {
        return "Unique" + columns;
    }
}
