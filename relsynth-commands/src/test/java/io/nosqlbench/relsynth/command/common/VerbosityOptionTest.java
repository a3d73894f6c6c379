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

import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class VerbosityOptionTest {

    @CommandLine.Command(name = "host")
    static class Host {
        @CommandLine.Mixin
        VerbosityOption verbosity = new VerbosityOption();
    }

    private static VerbosityOption parse(String... args) {
        Host host = new Host();
        new CommandLine(host).parseArgs(args);
        return host.verbosity;
    }

    @Test
    void levels() {
        assertThat(parse().level()).isNull();
        assertThat(parse("-v").level()).isEqualTo(Level.DEBUG);
        assertThat(parse("--quiet").level()).isEqualTo(Level.ERROR);
        assertThat(parse("-q").showNormalOutput()).isFalse();
    }

    @Test
    void verboseAndQuietConflict() {
        VerbosityOption both = parse("-v", "-q");
        assertThatThrownBy(both::validate).isInstanceOf(IllegalStateException.class);
    }
}
