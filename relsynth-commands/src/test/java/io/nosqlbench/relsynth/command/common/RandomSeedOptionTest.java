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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RandomSeedOptionTest {

    @CommandLine.Command(name = "host")
    static class Host {
        @CommandLine.Mixin
        RandomSeedOption seedOption = new RandomSeedOption();
    }

    private static RandomSeedOption parse(String... args) {
        Host host = new Host();
        new CommandLine(host).parseArgs(args);
        return host.seedOption;
    }

    @Test
    void explicitSeedOverridesTheConfig() {
        RandomSeedOption option = parse("--seed", "42");
        SynthesizerConfig config = option.applyTo(SynthesizerConfig.defaults().setSeed(7L));

        assertThat(option.isSeedSpecified()).isTrue();
        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(option.seedFor(config)).isEqualTo(42L);
    }

    @Test
    void absentSeedKeepsTheConfig() {
        RandomSeedOption option = parse();
        SynthesizerConfig config = option.applyTo(SynthesizerConfig.defaults().setSeed(7L));

        assertThat(option.isSeedSpecified()).isFalse();
        assertThat(config.getSeed()).isEqualTo(7L);
        assertThat(option.seedFor(config)).isEqualTo(7L);
        assertThat(option.toString()).isEqualTo("unseeded");
    }

    @Test
    void rejectsNonNumericSeeds() {
        assertThatThrownBy(() -> parse("-s", "x1"))
            .isInstanceOf(CommandLine.ParameterException.class)
            .hasMessageContaining("Invalid seed value");
    }
}
