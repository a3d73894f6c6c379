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

package io.nosqlbench.relsynth;

import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.modeler.FittedDatabase;
import io.nosqlbench.relsynth.modeler.Modeler;
import io.nosqlbench.relsynth.sampler.KeyAllocator;
import io.nosqlbench.relsynth.sampler.SampleResult;
import io.nosqlbench.relsynth.sampler.Sampler;
import io.nosqlbench.relsynth.table.Table;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/// Learns a relational database and generates synthetic versions of it.
///
/// ## Usage
///
/// ```java
/// try (RelationalSynthesizer synthesizer = new RelationalSynthesizer(SynthesizerConfig.defaults().setSeed(7L))) {
///     synthesizer.fit(metadata, tables);
///     SampleResult result = synthesizer.sampleAll(null);
///     Table users = result.table("users");
/// }
/// ```
///
/// The run's random generator is created by [#fit(Metadata, Map)]: with a
/// configured seed, a fit followed by the same sequence of sampling calls
/// yields the same tables regardless of the thread count. Primary keys
/// continue across sampling calls unless a call asks for a reset.
///
/// Not safe for concurrent use; the synthesizer parallelizes internally
/// when configured with more than one thread.
public final class RelationalSynthesizer implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(RelationalSynthesizer.class);

    private final SynthesizerConfig config;
    private final WorkerPool workers;
    private final KeyAllocator keys = new KeyAllocator();
    private FittedDatabase database;
    private Sampler sampler;
    private UniformRandomProvider rng;

    public RelationalSynthesizer() {
        this(SynthesizerConfig.defaults());
    }

    /// @throws ConfigurationException if the configuration is invalid
    public RelationalSynthesizer(SynthesizerConfig config) {
        this.config = config.validate();
        this.workers = new WorkerPool(config.getThreads());
    }

    public SynthesizerConfig getConfig() {
        return config;
    }

    /// Fits the database, replacing any previous fit.
    ///
    /// @param metadata the table declarations
    /// @param tables raw rows per table name
    /// @return the fitted database, with its fit-time warnings
    /// @throws ConfigurationException if metadata or data are inconsistent
    public FittedDatabase fit(Metadata metadata, Map<String, Table> tables) {
        FittedDatabase fitted = new Modeler(config, workers).fit(metadata, tables);
        this.database = fitted;
        this.sampler = new Sampler(fitted, keys, workers);
        this.rng = config.getSeed() == null
            ? RandomSource.XO_SHI_RO_256_PP.create()
            : RandomSource.XO_SHI_RO_256_PP.create(config.getSeed());
        keys.reset();
        logger.info("Fitted {} tables", fitted.tables().size());
        return fitted;
    }

    public boolean isFitted() {
        return database != null;
    }

    /// @throws NotFittedException before a successful fit
    public FittedDatabase getFittedDatabase() {
        requireFitted();
        return database;
    }

    /// Samples a root table and its descendants with the fitted row count.
    public SampleResult sample(String table) {
        return sample(table, null);
    }

    /// Samples a root table and its descendants.
    ///
    /// @param numRows rows of the root table, or null for its fitted row count
    public SampleResult sample(String table, Integer numRows) {
        return sample(table, numRows, true, false);
    }

    /// Samples a root table.
    ///
    /// @param table a root table
    /// @param numRows rows of the root table, or null for its fitted row count
    /// @param sampleChildren whether descendant tables are sampled too
    /// @param resetPrimaryKeys whether key sequences restart at 1 first
    /// @return the sampled tables with their warnings
    /// @throws IllegalArgumentException for an unknown or non-root table or a negative row count
    /// @throws NotFittedException before a successful fit
    public SampleResult sample(String table, Integer numRows, boolean sampleChildren, boolean resetPrimaryKeys) {
        requireFitted();
        resetKeys(resetPrimaryKeys);
        return report(sampler.sample(table, numRows, sampleChildren, rng));
    }

    /// Samples every table.
    ///
    /// @param numRows rows of every root table, or null for their fitted row counts
    public SampleResult sampleAll(Integer numRows) {
        return sampleAll(numRows, false);
    }

    public SampleResult sampleAll(Integer numRows, boolean resetPrimaryKeys) {
        requireFitted();
        resetKeys(resetPrimaryKeys);
        return report(sampler.sampleAll(numRows, rng));
    }

    /// Samples a root table and its descendants with some root columns held fixed.
    public SampleResult sampleConditional(String table, int numRows, Map<String, Object> conditions) {
        return sampleConditional(table, numRows, conditions, true);
    }

    /// Samples a root table with some of its columns held fixed.
    ///
    /// @param conditions raw values of model columns that no constraint rewrites
    /// @throws IllegalArgumentException for an unknown or non-root table, a negative row
    ///     count, or a condition on an unknown, key or constraint-rewritten column
    public SampleResult sampleConditional(String table, int numRows, Map<String, Object> conditions,
                                          boolean sampleChildren) {
        requireFitted();
        return report(sampler.sampleConditional(table, numRows, conditions, sampleChildren, rng));
    }

    private void resetKeys(boolean reset) {
        if (reset) {
            keys.reset();
        }
    }

    private SampleResult report(SampleResult result) {
        if (result.hasWarnings()) {
            logger.warn("Sampling completed with {} warnings", result.allWarnings().size());
        }
        return result;
    }

    private void requireFitted() {
        if (database == null) {
            throw new NotFittedException("The synthesizer has not been fitted");
        }
    }

    @Override
    public void close() {
        workers.close();
    }
}
