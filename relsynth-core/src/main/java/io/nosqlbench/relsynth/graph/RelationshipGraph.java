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

package io.nosqlbench.relsynth.graph;

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.metadata.ForeignKey;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.TableSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/// Directed acyclic graph of tables with an edge parent → child per foreign key.
///
/// ## Orders
///
/// ```
///        users                topologicalOrder():        users, sessions, transactions
///          │                  reverseTopologicalOrder(): transactions, sessions, users
///       sessions              levels():                  [transactions], [sessions], [users]
///          │
///     transactions
/// ```
///
/// The topological order is the sampling order (parents first); its
/// reverse is the extension and fit order. Ties are broken by table
/// declaration order, so both orders are deterministic. [#levels()] groups
/// tables by height above the leaves: every child of a table sits in a
/// strictly lower level.
public final class RelationshipGraph {

    private final List<String> tables;
    private final Map<String, List<ForeignKey>> parents;
    private final Map<String, List<ForeignKey>> children;
    private final List<String> order;

    /// Builds the graph and checks that it is acyclic.
    ///
    /// @param metadata the table declarations
    /// @throws ConfigurationException if the foreign keys form a cycle
    public RelationshipGraph(Metadata metadata) {
        this.tables = metadata.tableNames();
        Map<String, List<ForeignKey>> parentMap = new LinkedHashMap<>();
        Map<String, List<ForeignKey>> childMap = new LinkedHashMap<>();
        for (String table : tables) {
            parentMap.put(table, new ArrayList<>());
            childMap.put(table, new ArrayList<>());
        }
        for (TableSpec spec : metadata.tables()) {
            for (ForeignKey fk : spec.foreignKeys()) {
                if (!childMap.containsKey(fk.parentTable())) {
                    throw new ConfigurationException("Foreign key " + fk + " references unknown table");
                }
                parentMap.get(fk.table()).add(fk);
                childMap.get(fk.parentTable()).add(fk);
            }
        }
        parentMap.replaceAll((k, v) -> Collections.unmodifiableList(v));
        childMap.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.parents = Collections.unmodifiableMap(parentMap);
        this.children = Collections.unmodifiableMap(childMap);
        this.order = Collections.unmodifiableList(sort());
    }

    /// Kahn's algorithm, taking the first ready table in declaration order.
    private List<String> sort() {
        Map<String, Integer> pending = new HashMap<>();
        for (String table : tables) {
            Set<String> distinctParents = new LinkedHashSet<>();
            for (ForeignKey fk : parents.get(table)) {
                distinctParents.add(fk.parentTable());
            }
            pending.put(table, distinctParents.size());
        }
        List<String> sorted = new ArrayList<>(tables.size());
        Set<String> done = new LinkedHashSet<>();
        while (sorted.size() < tables.size()) {
            String next = null;
            for (String table : tables) {
                if (!done.contains(table) && pending.get(table) == 0) {
                    next = table;
                    break;
                }
            }
            if (next == null) {
                List<String> remaining = new ArrayList<>(tables);
                remaining.removeAll(done);
                throw new ConfigurationException("Foreign keys form a cycle among tables " + remaining);
            }
            sorted.add(next);
            done.add(next);
            Set<String> released = new LinkedHashSet<>();
            for (ForeignKey fk : children.get(next)) {
                released.add(fk.table());
            }
            for (String child : released) {
                pending.merge(child, -1, Integer::sum);
            }
        }
        return sorted;
    }

    public List<String> tables() {
        return tables;
    }

    /// Tables with every parent before its children.
    public Stream<String> topologicalOrder() {
        return order.stream();
    }

    /// Tables with every child before its parents.
    public Stream<String> reverseTopologicalOrder() {
        List<String> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return reversed.stream();
    }

    /// Groups tables into dependency levels, leaves first.
    ///
    /// @return levels in fitting order; tables within a level follow declaration order
    public List<List<String>> levels() {
        Map<String, Integer> height = new HashMap<>();
        reverseTopologicalOrder().forEach(table -> {
            int h = 0;
            for (ForeignKey fk : children.get(table)) {
                h = Math.max(h, height.get(fk.table()) + 1);
            }
            height.put(table, h);
        });
        int max = height.values().stream().mapToInt(Integer::intValue).max().orElse(-1);
        List<List<String>> levels = new ArrayList<>();
        for (int h = 0; h <= max; h++) {
            List<String> level = new ArrayList<>();
            for (String table : tables) {
                if (height.get(table) == h) {
                    level.add(table);
                }
            }
            levels.add(Collections.unmodifiableList(level));
        }
        return Collections.unmodifiableList(levels);
    }

    /// Returns the relationships in which the table is the parent.
    public List<ForeignKey> childrenOf(String table) {
        return require(children, table);
    }

    /// Returns the table's own foreign keys, in declaration order.
    public List<ForeignKey> parentsOf(String table) {
        return require(parents, table);
    }

    /// Resolves the table referenced by one foreign-key column.
    ///
    /// @throws IllegalArgumentException if the column is not a foreign key of the table
    public String parentOf(String table, String foreignKeyColumn) {
        for (ForeignKey fk : parentsOf(table)) {
            if (fk.column().equals(foreignKeyColumn)) {
                return fk.parentTable();
            }
        }
        throw new IllegalArgumentException("Table " + table + " has no foreign key " + foreignKeyColumn);
    }

    /// The relationship that drives sampling of a child: its first foreign key.
    public Optional<ForeignKey> primaryParent(String table) {
        List<ForeignKey> fks = parentsOf(table);
        return fks.isEmpty() ? Optional.empty() : Optional.of(fks.get(0));
    }

    public boolean isRoot(String table) {
        return parentsOf(table).isEmpty();
    }

    /// Tables without foreign keys, in declaration order.
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String table : tables) {
            if (parents.get(table).isEmpty()) {
                roots.add(table);
            }
        }
        return roots;
    }

    /// Returns the tables reachable from the given ones whose parents are all
    /// reachable as well, in topological order.
    ///
    /// @param start the tables to start from
    /// @return the closed set of tables, parents first
    public List<String> closure(List<String> start) {
        Set<String> included = new LinkedHashSet<>(start);
        List<String> result = new ArrayList<>();
        for (String table : order) {
            if (included.contains(table)) {
                result.add(table);
                continue;
            }
            List<ForeignKey> fks = parents.get(table);
            if (!fks.isEmpty() && fks.stream().allMatch(fk -> included.contains(fk.parentTable()))) {
                included.add(table);
                result.add(table);
            }
        }
        return result;
    }

    private static List<ForeignKey> require(Map<String, List<ForeignKey>> map, String table) {
        List<ForeignKey> fks = map.get(table);
        if (fks == null) {
            throw new IllegalArgumentException("Unknown table: " + table);
        }
        return fks;
    }

    @Override
    public String toString() {
        return "RelationshipGraph" + order;
    }
}
