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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tuning knobs of a {@link RelationalSynthesizer}.
 *
 * <h2>JSON Format</h2>
 *
 * <pre>{@code
 * {
 *   "seed": 42,
 *   "retry_budget": 100,
 *   "min_rows_to_fit": 2,
 *   "marginals": "best_fit",
 *   "threads": 4
 * }
 * }</pre>
 *
 * <p>Every field is optional. A missing seed means a fresh random seed per
 * synthesizer.
 */
public class SynthesizerConfig {

    /** Marginal distribution choice for the per-table copulas. */
    public enum Marginals {
        /** Normal marginals on every column */
        @SerializedName("normal")
        NORMAL,
        /** Normal or uniform per column, whichever fits the full table better */
        @SerializedName("best_fit")
        BEST_FIT
    }

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("seed")
    private Long seed;

    @SerializedName("retry_budget")
    private int retryBudget = 100;

    @SerializedName("min_rows_to_fit")
    private int minRowsToFit = 2;

    @SerializedName("marginals")
    private Marginals marginals = Marginals.NORMAL;

    @SerializedName("threads")
    private int threads = 1;

    public SynthesizerConfig() {
    }

    /**
     * Returns a configuration with all defaults.
     */
    public static SynthesizerConfig defaults() {
        return new SynthesizerConfig();
    }

    public Long getSeed() {
        return seed;
    }

    public SynthesizerConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    public int getRetryBudget() {
        return retryBudget;
    }

    public SynthesizerConfig setRetryBudget(int retryBudget) {
        this.retryBudget = retryBudget;
        return this;
    }

    public int getMinRowsToFit() {
        return minRowsToFit;
    }

    public SynthesizerConfig setMinRowsToFit(int minRowsToFit) {
        this.minRowsToFit = minRowsToFit;
        return this;
    }

    public Marginals getMarginals() {
        return marginals;
    }

    public SynthesizerConfig setMarginals(Marginals marginals) {
        this.marginals = marginals;
        return this;
    }

    public int getThreads() {
        return threads;
    }

    public SynthesizerConfig setThreads(int threads) {
        this.threads = threads;
        return this;
    }

    /**
     * Checks the values for consistency.
     *
     * @return this configuration
     * @throws ConfigurationException if a value is out of range
     */
    public SynthesizerConfig validate() {
        if (retryBudget < 0) {
            throw new ConfigurationException("retry_budget must be >= 0, got: " + retryBudget);
        }
        if (minRowsToFit < 1) {
            throw new ConfigurationException("min_rows_to_fit must be >= 1, got: " + minRowsToFit);
        }
        if (threads < 1) {
            throw new ConfigurationException("threads must be >= 1, got: " + threads);
        }
        if (marginals == null) {
            throw new ConfigurationException("marginals must be one of normal, best_fit");
        }
        return this;
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON string
     * @return the validated configuration
     * @throws ConfigurationException if the JSON is malformed or a value is invalid
     */
    public static SynthesizerConfig fromJson(String json) {
        try {
            SynthesizerConfig config = GSON.fromJson(json, SynthesizerConfig.class);
            return (config == null ? new SynthesizerConfig() : config).validate();
        } catch (JsonParseException e) {
            throw new ConfigurationException("Invalid synthesizer config: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static SynthesizerConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            SynthesizerConfig config = GSON.fromJson(reader, SynthesizerConfig.class);
            return (config == null ? new SynthesizerConfig() : config).validate();
        } catch (JsonParseException e) {
            throw new ConfigurationException("Invalid synthesizer config " + path + ": " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
