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

package io.nosqlbench.relsynth.sampler;

import io.nosqlbench.relsynth.table.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synthetic tables of one sampling call, in sampling order, with the
 * degradations that occurred per table.
 */
public final class SampleResult {

    private final Map<String, Table> tables;
    private final Map<String, List<String>> warnings;

    public SampleResult(Map<String, Table> tables, Map<String, List<String>> warnings) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        warnings.forEach((table, list) -> {
            if (!list.isEmpty()) {
                copy.put(table, List.copyOf(list));
            }
        });
        this.warnings = Collections.unmodifiableMap(copy);
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    /**
     * @throws IllegalArgumentException if the table was not sampled
     */
    public Table table(String name) {
        Table table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Table " + name + " was not sampled");
        }
        return table;
    }

    public Map<String, Table> tables() {
        return tables;
    }

    public List<String> warnings(String table) {
        return warnings.getOrDefault(table, List.of());
    }

    public Map<String, List<String>> warnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> allWarnings() {
        List<String> all = new ArrayList<>();
        warnings.values().forEach(all::addAll);
        return all;
    }

    /**
     * Combines two results; tables of the other result come after this one's.
     */
    public SampleResult merge(SampleResult other) {
        Map<String, Table> mergedTables = new LinkedHashMap<>(tables);
        mergedTables.putAll(other.tables);
        Map<String, List<String>> mergedWarnings = new LinkedHashMap<>();
        warnings.forEach((k, v) -> mergedWarnings.put(k, new ArrayList<>(v)));
        other.warnings.forEach((k, v) -> mergedWarnings.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v));
        return new SampleResult(mergedTables, mergedWarnings);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SampleResult[");
        tables.forEach((name, table) -> sb.append(name).append('=').append(table.rowCount()).append(' '));
        sb.append("warnings=").append(allWarnings().size()).append(']');
        return sb.toString();
    }
}
