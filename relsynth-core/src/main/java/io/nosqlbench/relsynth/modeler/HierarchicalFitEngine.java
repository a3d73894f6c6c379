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
import io.nosqlbench.relsynth.WorkerPool;
import io.nosqlbench.relsynth.extract.BestFitSelector;
import io.nosqlbench.relsynth.graph.RelationshipGraph;
import io.nosqlbench.relsynth.metadata.ForeignKey;
import io.nosqlbench.relsynth.model.DegenerateTableModel;
import io.nosqlbench.relsynth.model.GaussianCopulaFamily;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.model.Outcome;
import io.nosqlbench.relsynth.model.TableModel;
import io.nosqlbench.relsynth.model.TableModelFamily;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Fits one model per table, leaves first.
///
/// ## Worklist
///
/// ```
/// for level in graph.levels():            // leaves → roots
///     for table in level (concurrently):
///         data = encoded rows
///         for child relationship: data += extension block
///         model = family(data).fit(data)  // or degenerate
/// ```
///
/// A level starts only after the previous one completed, so every child is
/// fitted before its parent is extended.
public final class HierarchicalFitEngine {

    private static final Logger logger = LogManager.getLogger(HierarchicalFitEngine.class);

    private final SynthesizerConfig config;
    private final WorkerPool workers;
    private final ExtensionEngine extension;

    public HierarchicalFitEngine(SynthesizerConfig config, WorkerPool workers) {
        this.config = config;
        this.workers = workers;
        this.extension = new ExtensionEngine(workers);
    }

    /// Extends and fits every table.
    ///
    /// @param graph the relationship graph
    /// @param prepared encoded tables by name
    /// @return fitted tables in graph declaration order
    public Map<String, FittedTable> fit(RelationshipGraph graph, Map<String, PreparedTable> prepared) {
        Map<String, FittedTable> fitted = new HashMap<>();
        for (List<String> level : graph.levels()) {
            List<Callable<FittedTable>> tasks = new ArrayList<>(level.size());
            for (String table : level) {
                tasks.add(() -> fitTable(graph, prepared.get(table), fitted));
            }
            for (FittedTable table : workers.invokeAll(tasks)) {
                fitted.put(table.name(), table);
            }
        }
        Map<String, FittedTable> ordered = new LinkedHashMap<>();
        for (String table : graph.tables()) {
            ordered.put(table, fitted.get(table));
        }
        return ordered;
    }

    private FittedTable fitTable(RelationshipGraph graph, PreparedTable table, Map<String, FittedTable> fitted) {
        ModelData data = table.data();
        List<ExtensionBlock> blocks = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Object> primaryKeys = table.keyValues().get(table.spec().getPrimaryKey());

        for (ForeignKey relationship : graph.childrenOf(table.name())) {
            FittedTable child = fitted.get(relationship.table());
            Outcome<ModelData> extended = extension.extend(data, primaryKeys, relationship, child);
            data = extended.value();
            warnings.addAll(extended.warnings());
            blocks.add(new ExtensionBlock(relationship, child.family().parameterNames()));
        }

        TableModelFamily family = config.getMarginals() == SynthesizerConfig.Marginals.BEST_FIT
            ? GaussianCopulaFamily.bestFit(data, BestFitSelector.parametricOnly())
            : GaussianCopulaFamily.normal(data.columns());

        TableModel model;
        if (data.rowCount() < config.getMinRowsToFit()) {
            String warning = "Table " + table.name() + " has " + data.rowCount() + " rows, fewer than " +
                config.getMinRowsToFit() + "; using a degenerate model";
            logger.warn(warning);
            warnings.add(warning);
            model = new DegenerateTableModel(family, data);
        } else {
            try {
                model = family.fit(data);
            } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
                String warning = "Cannot fit table " + table.name() + " (" + e.getMessage() +
                    "); using a degenerate model";
                logger.warn(warning);
                warnings.add(warning);
                model = new DegenerateTableModel(family, data);
            }
        }

        logger.info("Fitted table {}: {} rows, {} model columns, {} child relationships, model {}",
            table.name(), data.rowCount(), data.columnCount(), blocks.size(), model.getModelType());
        return new FittedTable(table, data, blocks, family, model, warnings);
    }
}
