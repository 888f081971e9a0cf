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

package io.percell.cellgroups.feature;

import io.percell.cellgroups.image.CellImage;
import io.percell.cellgroups.image.CellImageReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Loads cell images and reduces each one to a scalar feature.
///
/// Files are visited in lexicographic file name order. A file that cannot be
/// decoded is logged and counted, and extraction continues with the rest.
public class FeatureExtractor {

    private static final Logger logger = LogManager.getLogger(FeatureExtractor.class);

    private final CellMetric metric;

    public FeatureExtractor(CellMetric metric) {
        this.metric = Objects.requireNonNull(metric, "metric");
    }

    public CellMetric metric() {
        return metric;
    }

    /// Extracts features from the given files.
    ///
    /// @param files cell image files in any order
    /// @return the readable samples and the extraction counters
    public FeatureSet extract(List<Path> files) {
        List<Path> ordered = new ArrayList<>(files);
        ordered.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<CellSample> samples = new ArrayList<>(ordered.size());
        int unreadable = 0;
        for (Path file : ordered) {
            try {
                CellImage image = CellImageReader.read(file);
                double feature = metric.compute(image);
                samples.add(new CellSample(CellSample.idFor(file), file, feature, image));
                logger.trace("{} {}={}", file.getFileName(), metric, feature);
            } catch (IOException | RuntimeException e) {
                unreadable++;
                logger.warn("Skipping unreadable cell image {}: {}", file, e.getMessage());
            }
        }

        FeatureSet featureSet = FeatureSet.of(samples, unreadable);
        logger.debug("Extracted {} features ({} zero, {} non-zero, {} unreadable)",
            featureSet.size(), featureSet.zeroCount(), featureSet.nonZeroCount(), unreadable);
        return featureSet;
    }
}
