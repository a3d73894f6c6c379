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

package io.nosqlbench.relsynth.command;

import io.nosqlbench.relsynth.ConfigurationException;
import io.nosqlbench.relsynth.RelationalSynthesizer;
import io.nosqlbench.relsynth.SynthesizerConfig;
import io.nosqlbench.relsynth.command.common.RandomSeedOption;
import io.nosqlbench.relsynth.command.common.VerbosityOption;
import io.nosqlbench.relsynth.demo.DemoDatabase;
import io.nosqlbench.relsynth.metadata.Metadata;
import io.nosqlbench.relsynth.metadata.MetadataLoader;
import io.nosqlbench.relsynth.modeler.FittedDatabase;
import io.nosqlbench.relsynth.sampler.SampleResult;
import io.nosqlbench.relsynth.table.Table;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Fits a relational synthesizer to a set of CSV tables and writes synthetic
/// CSV tables of the same shape.
///
/// Input is a metadata JSON file and a directory with one `<table>.csv` per
/// table, or the built-in demo database with `--demo`. Output is one
/// `<table>.csv` per sampled table in the output directory. With `--table`
/// only that root table and its descendants are sampled.
///
/// Exit codes: 0 on success, 1 when fitting or sampling recorded warnings,
/// 2 on errors.
@CommandLine.Command(name = "relsynth",
    mixinStandardHelpOptions = true,
    description = "Fit a relational model to CSV tables and sample synthetic tables")
public class CMD_relsynth implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_relsynth.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_WARNINGS = 1;
    static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-m", "--metadata"},
        description = "Metadata JSON file describing tables, keys and constraints")
    private Path metadataFile;

    @CommandLine.Option(names = {"-i", "--input-dir"},
        description = "Directory with one <table>.csv per table")
    private Path inputDir;

    @CommandLine.Option(names = {"-o", "--output-dir"}, required = true,
        description = "Directory for the synthetic <table>.csv files")
    private Path outputDir;

    @CommandLine.Option(names = {"-t", "--table"},
        description = "Root table to sample with its descendants (default: all tables)")
    private String table;

    @CommandLine.Option(names = {"-n", "--rows"},
        description = "Rows per sampled root table (default: the fitted row count)")
    private Integer rows;

    @CommandLine.Option(names = {"-c", "--config"},
        description = "Synthesizer configuration JSON file")
    private Path configFile;

    @CommandLine.Option(names = {"--demo"},
        description = "Use the built-in users/sessions/transactions demo database as input")
    private boolean demo = false;

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private void validateOptions() {
        verbosityOption.validate();
        if (demo && (metadataFile != null || inputDir != null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --demo cannot be combined with --metadata or --input-dir");
        }
        if (!demo && (metadataFile == null || inputDir == null)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --metadata and --input-dir are required unless --demo is given");
        }
        if (rows != null && rows < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --rows must not be negative");
        }
    }

    @Override
    public Integer call() {
        try {
            validateOptions();
        } catch (CommandLine.ParameterException | IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
        verbosityOption.applyLogLevel();

        try {
            SynthesizerConfig config = configFile == null
                ? SynthesizerConfig.defaults()
                : SynthesizerConfig.load(configFile);
            randomSeedOption.applyTo(config);

            Metadata metadata;
            Map<String, Table> tables;
            if (demo) {
                DemoDatabase database = DemoDatabase.create(randomSeedOption.seedFor(config));
                metadata = database.getMetadata();
                tables = database.getTables();
            } else {
                metadata = MetadataLoader.load(metadataFile);
                tables = CsvTableIO.readAll(inputDir, metadata);
            }

            try (RelationalSynthesizer synthesizer = new RelationalSynthesizer(config)) {
                FittedDatabase fitted = synthesizer.fit(metadata, tables);
                SampleResult result = table == null
                    ? synthesizer.sampleAll(rows)
                    : synthesizer.sample(table, rows);
                List<Path> written = CsvTableIO.writeAll(result, outputDir);

                List<String> warnings = new ArrayList<>(fitted.allWarnings());
                warnings.addAll(result.allWarnings());
                report(result, written, warnings);
                return warnings.isEmpty() ? EXIT_SUCCESS : EXIT_WARNINGS;
            }
        } catch (ConfigurationException | IllegalArgumentException e) {
            logger.error("Error: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private void report(SampleResult result, List<Path> written, List<String> warnings) {
        for (String warning : warnings) {
            logger.warn(warning);
        }
        if (!verbosityOption.showNormalOutput()) {
            return;
        }
        int i = 0;
        for (Table sampled : result.tables().values()) {
            System.out.println("Wrote " + sampled.rowCount() + " rows of " + sampled.name() + " to " + written.get(i++));
        }
        if (!warnings.isEmpty()) {
            System.out.println("Completed with " + warnings.size() + " warnings");
        }
    }

    public static void main(String[] args) {
        CMD_relsynth cmd = new CMD_relsynth();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }
}
