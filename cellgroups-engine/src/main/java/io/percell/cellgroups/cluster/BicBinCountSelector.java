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

package io.percell.cellgroups.cluster;

import io.percell.cellgroups.config.GroupingConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/// Picks a bin count by fitting Gaussian mixtures with 1 to `max_clusters`
/// components and keeping the one with the lowest BIC.
public class BicBinCountSelector {

    private static final Logger logger = LogManager.getLogger(BicBinCountSelector.class);

    private final GroupingConfig config;

    public BicBinCountSelector(GroupingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /// Sweeps component counts over the features.
    ///
    /// Degenerate features skip the sweep and keep the configured bin count.
    ///
    /// @param features untransformed features, at least one
    /// @return the chosen count and the BIC of every candidate
    public Selection select(double[] features) {
        if (features.length == 0) {
            throw new IllegalArgumentException("cannot select a bin count for an empty feature set");
        }
        if (ClusterAssigner.isDegenerate(features, config.getEqualityEpsilon())) {
            logger.info("Features are degenerate, keeping configured bin count {}", config.getBins());
            return new Selection(config.getBins(), new double[0]);
        }
        double[] values = ClusterAssigner.prepare(features, config.isLogTransform());
        int maxK = Math.min(config.getMaxClusters(), values.length);
        double[] bics = new double[maxK];
        int bestK = 1;
        for (int k = 1; k <= maxK; k++) {
            GaussianMixtureClusterer gmm = new GaussianMixtureClusterer(k, config.getInitializations(),
                config.getMaxIterations(), config.getCovarianceRegularization(),
                config.getConvergenceTolerance(), config.getSeed());
            bics[k - 1] = gmm.fit(values).bic();
            logger.debug("k={} BIC={}", k, String.format(Locale.ROOT, "%.3f", bics[k - 1]));
            if (bics[k - 1] < bics[bestK - 1]) {
                bestK = k;
            }
        }
        logger.info("Selected {} bins by BIC over 1..{}", bestK, maxK);
        return new Selection(bestK, bics);
    }

    /// Outcome of a BIC sweep.
    ///
    /// @param bins the chosen bin count
    /// @param bicByComponents BIC for 1, 2, ... components; empty when the sweep was skipped
    public record Selection(int bins, double[] bicByComponents) {

        public boolean swept() {
            return bicByComponents.length > 0;
        }

        @Override
        public String toString() {
            return "Selection[bins=" + bins + ", bic=" + Arrays.toString(bicByComponents) + "]";
        }
    }
}
