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

import io.nosqlbench.relsynth.SynthesizerConfig;
import io.nosqlbench.relsynth.graph.RelationshipGraph;
import io.nosqlbench.relsynth.metadata.Metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of a fit: the graph and one {@link FittedTable} per table.
 */
public final class FittedDatabase {

    private final Metadata metadata;
    private final RelationshipGraph graph;
    private final SynthesizerConfig config;
    private final Map<String, FittedTable> tables;

    public FittedDatabase(Metadata metadata, RelationshipGraph graph, SynthesizerConfig config,
                          Map<String, FittedTable> tables) {
        this.metadata = metadata;
        this.graph = graph;
        this.config = config;
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public Metadata metadata() {
        return metadata;
    }

    public RelationshipGraph graph() {
        return graph;
    }

    public SynthesizerConfig config() {
        return config;
    }

    /**
     * @throws IllegalArgumentException if the table is unknown
     */
    public FittedTable table(String name) {
        FittedTable table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown table: " + name);
        }
        return table;
    }

    public Map<String, FittedTable> tables() {
        return tables;
    }

    /**
     * Returns the fit warnings of every table, keyed by table.
     */
    public Map<String, List<String>> warnings() {
        Map<String, List<String>> warnings = new LinkedHashMap<>();
        for (FittedTable table : tables.values()) {
            if (!table.warnings().isEmpty()) {
                warnings.put(table.name(), table.warnings());
            }
        }
        return warnings;
    }

    public List<String> allWarnings() {
        List<String> all = new ArrayList<>();
        for (FittedTable table : tables.values()) {
            all.addAll(table.warnings());
        }
        return all;
    }
}
