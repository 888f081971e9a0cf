package io.percell.command.cellgroups.subcommands;

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


import io.percell.cellgroups.BatchGroupingRunner;
import io.percell.cellgroups.BatchSummary;
import io.percell.cellgroups.DirectoryGroupingResult;
import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.scan.CellDirectory;
import io.percell.cellgroups.scan.CellDirectoryScanner;
import io.percell.command.cellgroups.GroupingConfigOption;
import io.percell.command.common.CellsDirectoryOption;
import io.percell.command.common.ParallelExecutionOption;
import io.percell.command.common.RandomSeedOption;
import io.percell.command.common.VerbosityOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Group the cells of every cell directory into intensity bins
///
/// For every `<condition>/<region>` directory under the cells root this writes
/// `<region>_bin_<i>.tif` composites, `<region>_cell_groups.csv` and
/// `<region>_grouping_info.txt` under `<output-dir>/<condition>/<region>/`.
///
/// Exit codes: 0 when at least one directory produced a composite, 1 when
/// none did, 2 for invalid options or configuration.
@CommandLine.Command(name = "group",
    description = "Cluster cells by intensity and write one composite image per bin")
public class CMD_cellgroups_group implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_cellgroups_group.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_NO_DIRECTORY_SUCCEEDED = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    @CommandLine.Mixin
    private CellsDirectoryOption cellsDirectoryOption = new CellsDirectoryOption();

    @CommandLine.Option(names = {"-o", "--output-dir"}, required = true,
        description = "Root directory for composites and provenance files")
    private Path outputDir;

    @CommandLine.Mixin
    private GroupingConfigOption groupingConfigOption = new GroupingConfigOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        GroupingConfig config;
        List<CellDirectory> directories;
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            config = groupingConfigOption.resolve(
                randomSeedOption.isSeedSpecified() ? randomSeedOption.getSeedOr(0L) : null);
            directories = cellsDirectoryOption.discover(new CellDirectoryScanner(config.getCellFilePattern()));
            Files.createDirectories(outputDir);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        logger.debug("Effective configuration: {}", config);

        if (directories.isEmpty()) {
            logger.error("No cell directories found in {}", cellsDirectoryOption.getCellsDir());
            err.println("No cell directories found in " + cellsDirectoryOption.getCellsDir());
            return EXIT_NO_DIRECTORY_SUCCEEDED;
        }

        BatchGroupingRunner runner = new BatchGroupingRunner(config, parallelExecutionOption.getOptimalThreadCount());
        BatchSummary summary = runner.run(directories, outputDir);

        PrintWriter out = spec.commandLine().getOut();
        if (!verbosityOption.isQuiet()) {
            for (DirectoryGroupingResult result : summary.results()) {
                if (result.success()) {
                    out.printf("%s: %d cells, %d bins (%s), %d composites -> %s%n",
                        result.cellDirectory(), result.samplesRead(), result.actualBins(),
                        result.method().label(), result.compositesWritten(), result.outputDirectory());
                } else {
                    out.printf("%s: FAILED (%s)%n", result.cellDirectory(), result.failureReason());
                }
            }
            out.printf("Successfully processed %d out of %d cell directories%n", summary.succeeded(), summary.total());
            out.flush();
        }

        if (!summary.anySucceeded()) {
            logger.error("No cell directories were successfully processed");
            return EXIT_NO_DIRECTORY_SUCCEEDED;
        }
        return EXIT_SUCCESS;
    }
}
