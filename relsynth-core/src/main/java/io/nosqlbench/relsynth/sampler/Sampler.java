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

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.WorkerPool;
import io.nosqlbench.relsynth.constraints.ConstraintPipeline;
import io.nosqlbench.relsynth.graph.RelationshipGraph;
import io.nosqlbench.relsynth.metadata.FieldSpec;
import io.nosqlbench.relsynth.metadata.ForeignKey;
import io.nosqlbench.relsynth.metadata.TableSpec;
import io.nosqlbench.relsynth.model.ModelData;
import io.nosqlbench.relsynth.model.Outcome;
import io.nosqlbench.relsynth.model.TableModel;
import io.nosqlbench.relsynth.modeler.ExtensionBlock;
import io.nosqlbench.relsynth.modeler.FittedDatabase;
import io.nosqlbench.relsynth.modeler.FittedTable;
import io.nosqlbench.relsynth.table.Table;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.GuideTableDiscreteSampler;
import org.apache.commons.rng.sampling.distribution.SharedStateDiscreteSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Generates synthetic tables from a fitted database, root to leaves.
 *
 * <h2>Per table</h2>
 *
 * <pre>{@code
 *   root:   model.sample(n) ──► decode ──► reverse constraints ──► retry invalid rows
 *   child:  for each sampled parent row
 *             round(count) + parameter block ──► family.fromParameters ──► sample(count)
 *           merge in parent order ──► fk = parent key ──► secondary fks ──► fresh pks
 * }</pre>
 *
 * <p>The sampled rows of every table are kept in model space as well, so
 * that its own children can read their blocks from them. Counts are
 * rounded half up and floored at 0. A parent row whose count or
 * parameters cannot be used gets no children for that relationship and
 * the omission is recorded as a warning.
 *
 * <p>Each parent row samples from its own generator, seeded from the run
 * generator in parent order, so the result does not depend on whether the
 * rows are processed concurrently. Tables with table-wide constraints
 * are processed sequentially, each group validated against the rows
 * accepted before it.
 *
 * <p>Secondary foreign keys pick a row of their parent at random,
 * weighted by the parent's sampled child count for that relationship.
 */
public final class Sampler {

    private static final Logger logger = LogManager.getLogger(Sampler.class);

    private final FittedDatabase database;
    private final RelationshipGraph graph;
    private final KeyAllocator keys;
    private final WorkerPool workers;
    private final int retryBudget;

    public Sampler(FittedDatabase database, KeyAllocator keys, WorkerPool workers) {
        this.database = database;
        this.graph = database.graph();
        this.keys = keys;
        this.workers = workers;
        this.retryBudget = database.config().getRetryBudget();
    }

    /// Rows of one table sampled in this run: raw rows in declared column
    /// order, their model-space rows, and their primary keys.
    private record SampledTable(Table table, ModelData modelRows, List<Object> primaryKeys) {
    }

    /// Rows drawn for one model, with the number kept despite failing validation.
    private record Batch(ModelData modelRows, Table rawRows, int bestEffort) {
        static Batch empty(List<String> modelColumns, String table, List<String> rawColumns) {
            return new Batch(ModelData.empty(modelColumns), Table.empty(table, rawColumns), 0);
        }
    }

    private final class Run {
        private final UniformRandomProvider rng;
        private final Map<String, SampledTable> sampled = new LinkedHashMap<>();
        private final Map<String, List<String>> warnings = new LinkedHashMap<>();

        private Run(UniformRandomProvider rng) {
            this.rng = rng;
        }

        private void warn(String table, String message) {
            logger.warn(message);
            warnings.computeIfAbsent(table, t -> new ArrayList<>()).add(message);
        }

        private SampleResult result() {
            Map<String, Table> tables = new LinkedHashMap<>();
            sampled.forEach((name, table) -> tables.put(name, table.table()));
            return new SampleResult(tables, warnings);
        }
    }

    /**
     * Samples a root table and, optionally, every table that descends from it.
     *
     * @param table a root table
     * @param numRows rows to generate, or null for the fitted row count
     * @param sampleChildren whether to sample descendant tables
     * @param rng the run's random source
     * @return the sampled tables, parents first
     * @throws IllegalArgumentException if the table is unknown or not a root, or numRows is negative
     */
    public SampleResult sample(String table, Integer numRows, boolean sampleChildren, UniformRandomProvider rng) {
        return sampleConditional(table, numRows, Map.of(), sampleChildren, rng);
    }

    /**
     * Samples every table, starting from each root.
     *
     * @param numRows rows per root table, or null for each root's fitted row count
     */
    public SampleResult sampleAll(Integer numRows, UniformRandomProvider rng) {
        checkRowCount(numRows);
        Run run = new Run(rng);
        for (String root : graph.roots()) {
            sampleRoot(run, database.table(root), numRows, Map.of());
        }
        sampleDescendants(run, graph.closure(graph.roots()));
        return run.result();
    }

    /**
     * Samples a root table with some of its columns held at fixed values.
     *
     * @param conditions raw column values to hold fixed
     * @throws IllegalArgumentException if a condition names a column that is unknown,
     *     a key, or rewritten by a constraint, or holds a value that cannot be encoded
     */
    public SampleResult sampleConditional(String table, Integer numRows, Map<String, Object> conditions,
                                          boolean sampleChildren, UniformRandomProvider rng) {
        FittedTable fitted = database.table(table);
        if (!graph.isRoot(table)) {
            throw new IllegalArgumentException("Table " + table + " is not a root table; sample its parent " +
                graph.primaryParent(table).map(ForeignKey::parentTable).orElse("") + " instead");
        }
        checkRowCount(numRows);
        Map<String, Double> fixed = encodeConditions(fitted, conditions);

        Run run = new Run(rng);
        sampleRoot(run, fitted, numRows, fixed);
        if (sampleChildren) {
            sampleDescendants(run, graph.closure(List.of(table)));
        }
        return run.result();
    }

    private static void checkRowCount(Integer numRows) {
        if (numRows != null && numRows < 0) {
            throw new IllegalArgumentException("Number of rows cannot be negative: " + numRows);
        }
    }

    private static Map<String, Double> encodeConditions(FittedTable fitted, Map<String, Object> conditions) {
        TableSpec spec = fitted.spec();
        Map<String, Double> fixed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            String column = condition.getKey();
            FieldSpec field = spec.field(column).orElseThrow(() ->
                new IllegalArgumentException("Table " + spec.getName() + " has no column " + column));
            if (field.isKey()) {
                throw new IllegalArgumentException("Cannot condition on key column " + spec.getName() + "." + column);
            }
            if (fitted.constraints().rewrittenColumns().contains(column) || !fitted.transformer().isModeled(column)) {
                throw new IllegalArgumentException("Cannot condition on column " + spec.getName() + "." + column +
                    ", it is rewritten by a constraint");
            }
            try {
                fixed.put(column, fitted.transformer().encode(column, condition.getValue()));
            } catch (ConfigurationException e) {
                throw new IllegalArgumentException("Cannot use " + condition.getValue() + " as a value of " +
                    spec.getName() + "." + column + ": " + e.getMessage(), e);
            }
        }
        return fixed;
    }

    private void sampleRoot(Run run, FittedTable fitted, Integer numRows, Map<String, Double> fixed) {
        int count = numRows == null ? fitted.rowCount() : numRows;
        Batch batch = draw(fitted, fitted.model(), count, fixed, run.rng, emptyRaw(fitted));
        if (batch.bestEffort() > 0) {
            run.warn(fitted.name(), exhausted(fitted, batch.bestEffort()));
        }
        finish(run, fitted, batch, Map.of());
    }

    private void sampleDescendants(Run run, List<String> tables) {
        for (String table : tables) {
            if (!run.sampled.containsKey(table)) {
                sampleChild(run, database.table(table));
            }
        }
    }

    private void sampleChild(Run run, FittedTable child) {
        ForeignKey primary = graph.primaryParent(child.name()).orElseThrow();
        SampledTable parent = run.sampled.get(primary.parentTable());
        ExtensionBlock block = database.table(primary.parentTable()).block(primary);
        int countIndex = parent.modelRows().indexOf(block.countColumn());
        int[] parameterIndex = block.parameterColumns().stream().mapToInt(parent.modelRows()::indexOf).toArray();

        int parents = parent.modelRows().rowCount();
        long[] seeds = new long[parents];
        for (int i = 0; i < parents; i++) {
            seeds[i] = run.rng.nextLong();
        }

        List<Outcome<Batch>> groups;
        if (child.constraints().hasTableWideConstraints()) {
            groups = new ArrayList<>(parents);
            Table accepted = emptyRaw(child);
            for (int i = 0; i < parents; i++) {
                Outcome<Batch> group = sampleGroup(child, primary, parent.modelRows().row(i), countIndex,
                    parameterIndex, parent.primaryKeys().get(i), seeds[i], accepted);
                if (group.hasValue()) {
                    accepted = accepted.appendRows(group.value().rawRows());
                }
                groups.add(group);
            }
        } else {
            List<Callable<Outcome<Batch>>> tasks = new ArrayList<>(parents);
            Table none = emptyRaw(child);
            for (int i = 0; i < parents; i++) {
                double[] parentRow = parent.modelRows().row(i);
                Object parentKey = parent.primaryKeys().get(i);
                long seed = seeds[i];
                tasks.add(() -> sampleGroup(child, primary, parentRow, countIndex, parameterIndex,
                    parentKey, seed, none));
            }
            groups = workers.invokeAll(tasks);
        }

        List<double[]> modelRows = new ArrayList<>();
        List<Object[]> rawRows = new ArrayList<>();
        List<Object> foreignKeys = new ArrayList<>();
        int bestEffort = 0;
        for (int i = 0; i < groups.size(); i++) {
            Outcome<Batch> group = groups.get(i);
            group.warnings().forEach(warning -> run.warn(child.name(), warning));
            if (!group.hasValue()) {
                continue;
            }
            Batch batch = group.value();
            modelRows.addAll(Arrays.asList(batch.modelRows().rows()));
            for (int r = 0; r < batch.rawRows().rowCount(); r++) {
                rawRows.add(batch.rawRows().row(r));
                foreignKeys.add(parent.primaryKeys().get(i));
            }
            bestEffort += batch.bestEffort();
        }
        Batch merged = new Batch(
            new ModelData(child.extendedData().columns(), modelRows.toArray(new double[0][])),
            new Table(child.name(), dataColumns(child), rawRows), bestEffort);
        if (bestEffort > 0) {
            run.warn(child.name(), exhausted(child, bestEffort));
        }

        Map<String, List<Object>> keyColumns = new HashMap<>();
        keyColumns.put(primary.column(), foreignKeys);
        List<ForeignKey> secondary = graph.parentsOf(child.name());
        for (ForeignKey fk : secondary.subList(1, secondary.size())) {
            SampledTable other = run.sampled.get(fk.parentTable());
            if (other.primaryKeys().isEmpty()) {
                if (merged.rawRows().rowCount() > 0) {
                    run.warn(child.name(), "Table " + child.name() + ": dropped " + merged.rawRows().rowCount() +
                        " rows, parent " + fk.parentTable() + " of " + fk.column() + " has no sampled rows");
                }
                merged = Batch.empty(merged.modelRows().columns(), child.name(), dataColumns(child));
                keyColumns.values().forEach(List::clear);
                continue;
            }
            keyColumns.put(fk.column(), assignSecondary(run.rng, fk, other, merged.rawRows().rowCount()));
        }
        finish(run, child, merged, keyColumns);
    }

    private Outcome<Batch> sampleGroup(FittedTable child, ForeignKey relationship, double[] parentRow,
                                       int countIndex, int[] parameterIndex, Object parentKey, long seed,
                                       Table accepted) {
        double expected = parentRow[countIndex];
        if (!Double.isFinite(expected)) {
            return Outcome.skipped("Skipped " + relationship + " children of " + parentKey +
                ": non-finite child count");
        }
        double rounded = Math.max(0.0, Math.floor(expected + 0.5));
        if (rounded > Integer.MAX_VALUE) {
            return Outcome.skipped("Skipped " + relationship + " children of " + parentKey +
                ": child count " + expected + " out of range");
        }
        int count = (int) rounded;
        if (count == 0) {
            return Outcome.of(Batch.empty(child.extendedData().columns(), child.name(), dataColumns(child)));
        }
        double[] parameters = new double[parameterIndex.length];
        for (int p = 0; p < parameters.length; p++) {
            parameters[p] = parentRow[parameterIndex[p]];
        }
        try {
            TableModel model = child.family().fromParameters(parameters);
            UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
            Batch batch = draw(child, model, count, Map.of(), rng, accepted);
            logger.debug("Sampled {} {} rows for parent key {}", count, child.name(), parentKey);
            return Outcome.of(batch);
        } catch (IllegalArgumentException | IllegalStateException | ArithmeticException
                 | ConfigurationException e) {
            return Outcome.skipped("Skipped " + relationship + " children of " + parentKey + ": " + e.getMessage());
        }
    }

    /**
     * Draws rows from a model until all of them pass the table's constraints
     * or the retry budget is spent.
     *
     * @param accepted raw rows already accepted for the table, used by table-wide constraints
     */
    private Batch draw(FittedTable fitted, TableModel model, int count, Map<String, Double> fixed,
                       UniformRandomProvider rng, Table accepted) {
        ConstraintPipeline constraints = fitted.constraints();
        List<String> rawColumns = dataColumns(fitted);
        List<double[]> keptModel = new ArrayList<>(count);
        List<Object[]> keptRaw = new ArrayList<>(count);
        Table context = constraints.hasTableWideConstraints() ? accepted : emptyRaw(fitted);

        ModelData rejectedModel = ModelData.empty(fitted.extendedData().columns());
        Table rejectedRaw = Table.empty(fitted.name(), rawColumns);
        int missing = count;
        for (int round = 0; missing > 0 && round <= retryBudget; round++) {
            ModelData candidates = fixed.isEmpty()
                ? model.sample(missing, rng)
                : model.sampleConditional(missing, fixed, rng);
            Table raw = decode(fitted, candidates);
            if (constraints.isEmpty()) {
                keptModel.addAll(Arrays.asList(candidates.rows()));
                for (int r = 0; r < raw.rowCount(); r++) {
                    keptRaw.add(raw.row(r));
                }
                missing = 0;
                break;
            }

            Table checked = context.appendRows(raw);
            boolean[] valid = constraints.isValid(checked);
            int offset = context.rowCount();
            List<Integer> passed = new ArrayList<>();
            List<Integer> failed = new ArrayList<>();
            for (int r = 0; r < raw.rowCount(); r++) {
                (valid[offset + r] ? passed : failed).add(r);
            }
            for (int r : passed) {
                keptModel.add(candidates.row(r));
                keptRaw.add(raw.row(r));
            }
            if (constraints.hasTableWideConstraints()) {
                context = context.appendRows(raw.selectRows(passed));
            }
            rejectedModel = candidates.selectRows(failed);
            rejectedRaw = raw.selectRows(failed);
            missing -= passed.size();
            if (!failed.isEmpty()) {
                logger.debug("Table {}: {} of {} sampled rows violate constraints (round {})",
                    fitted.name(), failed.size(), raw.rowCount(), round);
            }
        }

        int bestEffort = 0;
        if (missing > 0) {
            bestEffort = missing;
            keptModel.addAll(Arrays.asList(rejectedModel.rows()));
            for (int r = 0; r < rejectedRaw.rowCount(); r++) {
                keptRaw.add(rejectedRaw.row(r));
            }
        }
        ModelData modelRows = new ModelData(fitted.extendedData().columns(), keptModel.toArray(new double[0][]));
        return new Batch(modelRows, new Table(fitted.name(), rawColumns, keptRaw), bestEffort);
    }

    private static Table decode(FittedTable fitted, ModelData candidates) {
        Table transformed = fitted.transformer().decode(candidates);
        return fitted.constraints().reverseTransform(transformed).project(dataColumns(fitted));
    }

    private List<Object> assignSecondary(UniformRandomProvider rng, ForeignKey fk, SampledTable parent, int rows) {
        ExtensionBlock block = database.table(fk.parentTable()).block(fk);
        double[] counts = parent.modelRows().column(parent.modelRows().indexOf(block.countColumn()));
        double total = 0;
        for (int i = 0; i < counts.length; i++) {
            counts[i] = Double.isFinite(counts[i]) ? Math.max(0.0, counts[i]) : 0.0;
            total += counts[i];
        }
        if (total <= 0) {
            Arrays.fill(counts, 1.0);
        }
        SharedStateDiscreteSampler choice = GuideTableDiscreteSampler.of(rng, counts);
        List<Object> values = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            values.add(parent.primaryKeys().get(choice.sample()));
        }
        return values;
    }

    private void finish(Run run, FittedTable fitted, Batch batch, Map<String, List<Object>> foreignKeys) {
        TableSpec spec = fitted.spec();
        Table raw = batch.rawRows();
        int rows = raw.rowCount();
        String pk = spec.getPrimaryKey();
        List<Object> primaryKeys = new ArrayList<>(rows);
        if (pk != null) {
            FieldSpec keyField = spec.field(pk).orElseThrow();
            for (int r = 0; r < rows; r++) {
                primaryKeys.add(keys.nextKey(fitted.name(), keyField));
            }
        }

        List<String> columns = spec.columnNames();
        List<Object[]> out = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            Object[] row = new Object[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                String column = columns.get(c);
                if (column.equals(pk)) {
                    row[c] = primaryKeys.get(r);
                } else if (foreignKeys.containsKey(column)) {
                    row[c] = foreignKeys.get(column).get(r);
                } else {
                    row[c] = raw.get(r, column);
                }
            }
            out.add(row);
        }
        run.sampled.put(fitted.name(),
            new SampledTable(new Table(fitted.name(), columns, out), batch.modelRows(), primaryKeys));
        logger.info("Sampled {} rows for table {}", rows, fitted.name());
    }

    private static String exhausted(FittedTable fitted, int rows) {
        return "Table " + fitted.name() + ": " + rows + " rows still violate constraints after " +
            "the retry budget; kept best-effort rows";
    }

    private static List<String> dataColumns(FittedTable fitted) {
        List<String> columns = new ArrayList<>(fitted.spec().columnNames());
        columns.removeAll(fitted.spec().keyColumns());
        return columns;
    }

    private static Table emptyRaw(FittedTable fitted) {
        return Table.empty(fitted.name(), dataColumns(fitted));
    }
}
