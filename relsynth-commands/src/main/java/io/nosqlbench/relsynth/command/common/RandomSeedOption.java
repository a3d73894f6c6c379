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

package io.nosqlbench.relsynth.command.common;

import io.nosqlbench.relsynth.SynthesizerConfig;
import picocli.CommandLine;

/// Seed of a synthesis run. Without `--seed` the configuration's seed is kept,
/// and a run without any seed is not reproducible.
public class RandomSeedOption {

    /**
     * A seed specification.
     *
     * @param value the seed value, or null when none was given
     */
    public record Seed(Long value) {

        public Seed() {
            this(null);
        }

        /// @return the seed, or the current time when none was given
        public long effective() {
            return value != null ? value : System.currentTimeMillis();
        }

        public boolean isExplicit() {
            return value != null;
        }

        @Override
        public String toString() {
            return value != null ? String.valueOf(value) : "unseeded";
        }
    }

    /**
     * Picocli type converter for {@link Seed} values.
     */
    public static class SeedConverter implements CommandLine.ITypeConverter<Seed> {

        @Override
        public Seed convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                return new Seed();
            }
            try {
                return new Seed(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid seed value: " + value + ". Must be a valid long integer.");
            }
        }
    }

    @CommandLine.Option(
        names = {"-s", "--seed"},
        description = "Random seed for fitting and sampling (default: the config seed, else unseeded)",
        converter = SeedConverter.class
    )
    private Seed seed;

    public Seed getSeedRecord() {
        return seed != null ? seed : new Seed();
    }

    public boolean isSeedSpecified() {
        return seed != null && seed.isExplicit();
    }

    /// Overrides the configuration's seed when `--seed` was given.
    ///
    /// @return the same configuration
    public SynthesizerConfig applyTo(SynthesizerConfig config) {
        if (isSeedSpecified()) {
            config.setSeed(seed.value());
        }
        return config;
    }

    /// The seed for data that must exist before the configuration applies, like the demo tables.
    public long seedFor(SynthesizerConfig config) {
        if (isSeedSpecified()) {
            return seed.value();
        }
        return config.getSeed() != null ? config.getSeed() : getSeedRecord().effective();
    }

    @Override
    public String toString() {
        return getSeedRecord().toString();
    }
}
