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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SynthesizerConfigTest {

    @Test
    void defaults() {
        SynthesizerConfig config = SynthesizerConfig.defaults();
        assertThat(config.getSeed()).isNull();
        assertThat(config.getRetryBudget()).isEqualTo(100);
        assertThat(config.getMinRowsToFit()).isEqualTo(2);
        assertThat(config.getMarginals()).isEqualTo(SynthesizerConfig.Marginals.NORMAL);
        assertThat(config.getThreads()).isEqualTo(1);
    }

    @Test
    void parsesSnakeCaseJson() {
        SynthesizerConfig config = SynthesizerConfig.fromJson(
            "{\"seed\": 42, \"retry_budget\": 5, \"min_rows_to_fit\": 3, \"marginals\": \"best_fit\", \"threads\": 4}");
        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getRetryBudget()).isEqualTo(5);
        assertThat(config.getMinRowsToFit()).isEqualTo(3);
        assertThat(config.getMarginals()).isEqualTo(SynthesizerConfig.Marginals.BEST_FIT);
        assertThat(config.getThreads()).isEqualTo(4);
    }

    @Test
    void missingKeysKeepDefaults() {
        SynthesizerConfig config = SynthesizerConfig.fromJson("{\"seed\": 7}");
        assertThat(config.getRetryBudget()).isEqualTo(100);
        assertThat(config.getThreads()).isEqualTo(1);
    }

    @Test
    void roundTripsThroughJson() {
        SynthesizerConfig config = SynthesizerConfig.defaults().setSeed(9L).setThreads(3);
        SynthesizerConfig copy = SynthesizerConfig.fromJson(config.toJson());
        assertThat(copy.getSeed()).isEqualTo(9L);
        assertThat(copy.getThreads()).isEqualTo(3);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"retry_budget\": 0}");
        assertThat(SynthesizerConfig.load(file).getRetryBudget()).isZero();
    }

    @Test
    void invalidValuesAreConfigurationErrors() {
        assertThatThrownBy(() -> SynthesizerConfig.fromJson("{\"threads\": 0}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("threads");
        assertThatThrownBy(() -> SynthesizerConfig.fromJson("{\"retry_budget\": -1}"))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SynthesizerConfig.fromJson("{\"marginals\": \"cauchy\"}"))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SynthesizerConfig.fromJson("{\"threads\": \"many\"}"))
            .isInstanceOf(ConfigurationException.class);
    }
}
