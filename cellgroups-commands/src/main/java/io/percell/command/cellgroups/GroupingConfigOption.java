package io.percell.command.cellgroups;

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


import io.percell.cellgroups.cluster.ClusterMethod;
import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.feature.CellMetric;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/// Grouping settings on the command line. Values given here override those
/// loaded from `--config`, which override the built-in defaults.
public class GroupingConfigOption {

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON file with grouping settings"
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-b", "--bins"},
        description = "Number of intensity bins (default: " + GroupingConfig.DEFAULT_BINS + ")"
    )
    private Integer bins;

    @CommandLine.Option(
        names = {"-m", "--method"},
        description = "Clustering method: gmm or kmeans (default: gmm)"
    )
    private String method;

    @CommandLine.Option(
        names = {"--metric"},
        description = "Per-cell feature: auc, max, mean or sg (default: auc)"
    )
    private String metric;

    @CommandLine.Option(
        names = {"-f", "--force-clusters"},
        description = "Redistribute cells evenly when clustering yields fewer groups than bins"
    )
    private Boolean forceClusters;

    @CommandLine.Option(
        names = {"--auto-bins"},
        description = "Choose the number of bins by BIC"
    )
    private Boolean autoBins;

    @CommandLine.Option(
        names = {"--max-clusters"},
        description = "Largest bin count considered by --auto-bins and the BIC table (default: 10)"
    )
    private Integer maxClusters;

    @CommandLine.Option(
        names = {"--no-log-transform"},
        description = "Cluster on raw features instead of log1p of them"
    )
    private boolean noLogTransform;

    /**
     * Builds the effective configuration.
     *
     * @param seed seed to apply, or null to keep the configured one
     * @return the validated configuration
     * @throws IOException if the config file cannot be read or parsed
     * @throws IllegalArgumentException if a setting is invalid
     */
    public GroupingConfig resolve(Long seed) throws IOException {
        GroupingConfig config = configFile != null ? GroupingConfig.loadFromFile(configFile) : new GroupingConfig();
        if (bins != null) {
            config.setBins(bins);
        }
        if (method != null) {
            config.setMethod(ClusterMethod.fromName(method));
        }
        if (metric != null) {
            config.setMetric(CellMetric.fromName(metric));
        }
        if (forceClusters != null) {
            config.setForceRedistribute(forceClusters);
        }
        if (autoBins != null) {
            config.setAutoBins(autoBins);
        }
        if (maxClusters != null) {
            config.setMaxClusters(maxClusters);
        }
        if (noLogTransform) {
            config.setLogTransform(false);
        }
        if (seed != null) {
            config.setSeed(seed);
        }
        return config.validate();
    }
}
