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

import io.nosqlbench.relsynth.WorkerPool;
import io.nosqlbench.relsynth.metadata.ForeignKey;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.model.Outcome;
import io.nosqlbench.relsynth.model.TableModelFamily;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Aggregates a fitted child table into its parent.
 *
 * <h2>Per parent row</h2>
 *
 * <pre>{@code
 *   child rows with fk = parent key ──► count
 *                                  └──► child family fitted on the group ──► parameter vector
 * }</pre>
 *
 * <p>A parent without children gets count 0 and the child's whole-table
 * parameter vector. A group whose fit fails or yields non-finite
 * parameters gets the whole-table vector too, with a warning. Child rows
 * with a null foreign key belong to no group.
 */
public final class ExtensionEngine {

    private static final Logger logger = LogManager.getLogger(ExtensionEngine.class);

    private final WorkerPool workers;

    public ExtensionEngine(WorkerPool workers) {
        this.workers = workers;
    }

    private record GroupSummary(double[] values, String warning) {
    }

    /**
     * Appends the summary block of one child relationship to the parent's rows.
     *
     * @param parentData the parent's model rows so far
     * @param parentKeys the parent's normalized primary keys, aligned with parentData
     * @param relationship the child's foreign key
     * @param child the fitted child table
     * @return the widened parent rows, with a warning per degraded group
     */
    public Outcome<ModelData> extend(ModelData parentData, List<Object> parentKeys,
                                     ForeignKey relationship, FittedTable child) {
        ExtensionBlock block = new ExtensionBlock(relationship, child.family().parameterNames());
        Map<Object, List<Integer>> groups = group(child.keyValues(relationship.column()));
        double[] marginal = child.model().parameterVector();

        List<Callable<GroupSummary>> tasks = new ArrayList<>(parentKeys.size());
        for (Object parentKey : parentKeys) {
            List<Integer> rows = groups.getOrDefault(parentKey, List.of());
            tasks.add(() -> summarize(relationship, parentKey, rows, child, marginal));
        }
        List<GroupSummary> summaries = workers.invokeAll(tasks);

        double[][] blockRows = new double[summaries.size()][];
        List<String> warnings = new ArrayList<>();
        for (int r = 0; r < blockRows.length; r++) {
            GroupSummary summary = summaries.get(r);
            blockRows[r] = summary.values();
            if (summary.warning() != null) {
                warnings.add(summary.warning());
            }
        }
        logger.debug("Extended {} with {} ({} groups, {} degraded)",
            relationship.parentTable(), block.countColumn(), groups.size(), warnings.size());
        return new Outcome<>(parentData.appendColumns(block.columns(), blockRows), warnings);
    }

    private static Map<Object, List<Integer>> group(List<Object> foreignKeys) {
        Map<Object, List<Integer>> groups = new LinkedHashMap<>();
        for (int r = 0; r < foreignKeys.size(); r++) {
            Object key = foreignKeys.get(r);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
            }
        }
        return groups;
    }

    private static GroupSummary summarize(ForeignKey relationship, Object parentKey, List<Integer> rows,
                                          FittedTable child, double[] marginal) {
        double[] values = new double[marginal.length + 1];
        values[0] = rows.size();
        if (rows.isEmpty()) {
            System.arraycopy(marginal, 0, values, 1, marginal.length);
            return new GroupSummary(values, null);
        }
        TableModelFamily family = child.family();
        String warning = null;
        double[] parameters;
        try {
            parameters = family.fit(child.extendedData().selectRows(rows)).parameterVector();
            for (double p : parameters) {
                if (!Double.isFinite(p)) {
                    warning = "Non-finite parameters for " + relationship + " group " + parentKey +
                        "; using whole-table parameters";
                    parameters = marginal;
                    break;
                }
            }
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            warning = "Cannot fit " + relationship + " group " + parentKey + " (" + e.getMessage() +
                "); using whole-table parameters";
            parameters = marginal;
        }
        if (warning != null) {
            logger.warn(warning);
        }
        System.arraycopy(parameters, 0, values, 1, parameters.length);
        return new GroupSummary(values, warning);
    }
}
