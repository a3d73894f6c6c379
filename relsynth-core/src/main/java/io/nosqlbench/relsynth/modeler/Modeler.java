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

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.SynthesizerConfig;
import io.nosqlbench.relsynth.WorkerPool;
import io.nosqlbench.relsynth.graph.RelationshipGraph;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.MetadataValidator;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.table.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validates, transforms and fits a database.
 *
 * <pre>{@code
 * metadata + raw tables
 *   ──► MetadataValidator (declarations, graph, data)
 *   ──► PreparedTable per table (constraints, field encoding)
 *   ──► HierarchicalFitEngine (extension + one model per table)
 *   ──► FittedDatabase
 * }</pre>
 *
 * <p>Every configuration problem surfaces as a
 * {@link ConfigurationException} before the first model is fitted.
 */
public final class Modeler {

    private static final Logger logger = LogManager.getLogger(Modeler.class);

    private final SynthesizerConfig config;
    private final WorkerPool workers;

    public Modeler(SynthesizerConfig config, WorkerPool workers) {
        this.config = config;
        this.workers = workers;
    }

    public FittedDatabase fit(Metadata metadata, Map<String, Table> tables) {
        MetadataValidator.validate(metadata);
        RelationshipGraph graph = new RelationshipGraph(metadata);
        MetadataValidator.validateData(metadata, tables);

        Map<String, PreparedTable> prepared = new LinkedHashMap<>();
        for (TableSpec spec : metadata.tables()) {
            prepared.put(spec.getName(), PreparedTable.prepare(spec, tables.get(spec.getName())));
        }
        logger.info("Prepared {} tables; fit order {}", prepared.size(), graph.levels());

        Map<String, FittedTable> fitted = new HierarchicalFitEngine(config, workers).fit(graph, prepared);
        FittedDatabase database = new FittedDatabase(metadata, graph, config, fitted);
        if (!database.allWarnings().isEmpty()) {
            logger.warn("Fit completed with {} warnings", database.allWarnings().size());
        }
        return database;
    }
}
