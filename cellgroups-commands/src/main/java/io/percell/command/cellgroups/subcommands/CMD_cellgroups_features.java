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


import io.percell.cellgroups.cluster.BicBinCountSelector;
import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.feature.CellSample;
import io.percell.cellgroups.feature.FeatureExtractor;
import io.percell.cellgroups.feature.FeatureSet;
import io.percell.cellgroups.scan.CellDirectory;
import io.percell.cellgroups.scan.CellDirectoryScanner;
import io.percell.command.cellgroups.GroupingConfigOption;
import io.percell.command.common.CellsDirectoryOption;
import io.percell.command.common.RandomSeedOption;
import io.percell.command.common.VerbosityOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Print per-cell features and a BIC table for every cell directory
///
/// Useful for choosing a bin count before running `group`: the table lists
/// the BIC of Gaussian mixtures with 1 to `--max-clusters` components and
/// marks the lowest.
@CommandLine.Command(name = "features",
    description = "List per-cell features and the BIC of 1..N component mixtures per directory")
public class CMD_cellgroups_features implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_cellgroups_features.class);

    @CommandLine.Mixin
    private CellsDirectoryOption cellsDirectoryOption = new CellsDirectoryOption();

    @CommandLine.Mixin
    private GroupingConfigOption groupingConfigOption = new GroupingConfigOption();

    @CommandLine.Mixin
    private RandomSeedOption randomSeedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        GroupingConfig config;
        List<CellDirectory> directories;
        try {
            verbosityOption.validate();
            verbosityOption.applyLogLevel();
            config = groupingConfigOption.resolve(
                randomSeedOption.isSeedSpecified() ? randomSeedOption.getSeedOr(0L) : null);
            directories = cellsDirectoryOption.discover(new CellDirectoryScanner(config.getCellFilePattern()));
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return CMD_cellgroups_group.EXIT_CONFIG_ERROR;
        }
        if (directories.isEmpty()) {
            err.println("No cell directories found in " + cellsDirectoryOption.getCellsDir());
            return CMD_cellgroups_group.EXIT_NO_DIRECTORY_SUCCEEDED;
        }

        CellDirectoryScanner scanner = new CellDirectoryScanner(config.getCellFilePattern());
        FeatureExtractor extractor = new FeatureExtractor(config.getMetric());
        BicBinCountSelector selector = new BicBinCountSelector(config);
        int listed = 0;
        for (CellDirectory directory : directories) {
            FeatureSet features;
            try {
                features = extractor.extract(scanner.listCellFiles(directory.directory()));
            } catch (IOException e) {
                logger.error("Could not list {}: {}", directory.directory(), e.getMessage());
                continue;
            }
            out.printf("# %s (%d cells, %d unreadable)%n", directory.relativeName(), features.size(),
                features.unreadableCount());
            if (features.isEmpty()) {
                continue;
            }
            listed++;
            out.printf("cell\t%s%n", config.getMetric().label());
            for (CellSample sample : features.samples()) {
                out.printf(Locale.ROOT, "%s\t%.4f%n", sample.fileName(), sample.feature());
            }
            BicBinCountSelector.Selection selection = selector.select(features.features());
            if (!selection.swept()) {
                out.println("BIC: skipped, features are all zero or identical");
                continue;
            }
            out.println("components\tbic");
            double[] bics = selection.bicByComponents();
            for (int k = 1; k <= bics.length; k++) {
                out.printf(Locale.ROOT, "%d\t%.3f%s%n", k, bics[k - 1], k == selection.bins() ? "\t*" : "");
            }
        }
        out.flush();
        return listed > 0 ? CMD_cellgroups_group.EXIT_SUCCESS : CMD_cellgroups_group.EXIT_NO_DIRECTORY_SUCCEEDED;
    }
}
