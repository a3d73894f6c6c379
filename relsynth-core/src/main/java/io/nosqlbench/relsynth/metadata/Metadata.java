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

package io.nosqlbench.relsynth.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarations of every table of a database, in declaration order.
 *
 * <p>Table order matters: it breaks ties in the topological orders of the
 * relationship graph.
 *
 * @see MetadataLoader
 * @see MetadataValidator
 */
public final class Metadata {

    private final Map<String, TableSpec> tables;

    public Metadata(List<TableSpec> tables) {
        Map<String, TableSpec> byName = new LinkedHashMap<>();
        for (TableSpec table : tables) {
            if (!table.isUsed()) {
                continue;
            }
            if (byName.put(table.getName(), table) != null) {
                throw new IllegalArgumentException("Duplicate table: " + table.getName());
            }
        }
        this.tables = Collections.unmodifiableMap(byName);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns all used tables in declaration order.
     */
    public List<TableSpec> tables() {
        return new ArrayList<>(tables.values());
    }

    public List<String> tableNames() {
        return new ArrayList<>(tables.keySet());
    }

    public boolean hasTable(String name) {
        return tables.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the table is unknown
     */
    public TableSpec table(String name) {
        TableSpec table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table: " + name);
        }
        return table;
    }

    public List<ForeignKey> foreignKeys(String table) {
        return table(table).foreignKeys();
    }

    public List<ConstraintSpec> constraints(String table) {
        return table(table).getConstraints();
    }

    @Override
    public String toString() {
        return "Metadata" + tables.keySet();
    }

    public static final class Builder {
        private final List<TableSpec> tables = new ArrayList<>();

        public Builder table(TableSpec table) {
            tables.add(table);
            return this;
        }

        public Metadata build() {
            return new Metadata(tables);
        }
    }
}
