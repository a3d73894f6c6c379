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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import picocli.CommandLine;

/// `--verbose` and `--quiet` switches, applied to the log4j2 configuration.
public class VerbosityOption {

    static final String ENGINE_LOGGER = "io.nosqlbench.relsynth";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log per-table and per-group detail"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Checks if normal (non-quiet) output should be shown.
     *
     * @return true if normal output should be shown
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /// The level implied by the switches, or null to keep the configured one.
    public Level level() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.ERROR;
        }
        return null;
    }

    /// Sets the root and engine loggers to [#level()], if any.
    public void applyLogLevel() {
        Level level = level();
        if (level == null) {
            return;
        }
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration config = context.getConfiguration();
        config.getRootLogger().setLevel(level);
        config.getLoggerConfig(ENGINE_LOGGER).setLevel(level);
        context.updateLoggers();
    }
}
