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

package io.percell.cellgroups;

import io.percell.cellgroups.cluster.BicBinCountSelector;
import io.percell.cellgroups.cluster.ClusterAssigner;
import io.percell.cellgroups.cluster.ClusterResult;
import io.percell.cellgroups.composite.CompositeBuilder;
import io.percell.cellgroups.composite.CompositeImage;
import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.feature.CellSample;
import io.percell.cellgroups.feature.FeatureExtractor;
import io.percell.cellgroups.feature.FeatureSet;
import io.percell.cellgroups.group.CellGroup;
import io.percell.cellgroups.group.GroupRemapper;
import io.percell.cellgroups.image.CellImageReader;
import io.percell.cellgroups.image.CompositeImageWriter;
import io.percell.cellgroups.image.ImageResolution;
import io.percell.cellgroups.provenance.GroupingSummary;
import io.percell.cellgroups.provenance.ProvenanceWriter;
import io.percell.cellgroups.scan.CellDirectoryScanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Groups the cells of one directory into intensity bins and writes the
/// composites and provenance files for it.
///
/// For a directory `<root>/<condition>/<region>` the outputs land in
/// `<output_root>/<condition>/<region>/`:
///
/// - `<region>_bin_<i>.tif` for every non-empty group
/// - `<region>_cell_groups.csv`
/// - `<region>_grouping_info.txt`
///
/// Bin files of a previous run that this run does not produce are removed.
/// Problems inside a directory never escape as exceptions; they end up in
/// the returned [DirectoryGroupingResult].
public class CellGroupingEngine {

    private static final Logger logger = LogManager.getLogger(CellGroupingEngine.class);

    private final GroupingConfig config;
    private final CellDirectoryScanner scanner;
    private final FeatureExtractor extractor;
    private final ClusterAssigner assigner;

    public CellGroupingEngine(GroupingConfig config) {
        this.config = config.copy().validate();
        this.scanner = new CellDirectoryScanner(this.config.getCellFilePattern());
        this.extractor = new FeatureExtractor(this.config.getMetric());
        this.assigner = new ClusterAssigner(this.config);
    }

    /// Output directory for a cell directory: `<output_root>/<parent name>/<name>`.
    public static Path outputDirectoryFor(Path cellDirectory, Path outputRoot) {
        Path parent = cellDirectory.toAbsolutePath().normalize().getParent();
        Path base = parent != null && parent.getFileName() != null
            ? outputRoot.resolve(parent.getFileName().toString())
            : outputRoot;
        return base.resolve(cellDirectory.getFileName().toString());
    }

    /// Runs the whole grouping pipeline over one directory.
    ///
    /// @param cellDirectory directory holding the cell images
    /// @param outputRoot root of the output tree
    /// @return the outcome; success iff at least one composite was written
    public DirectoryGroupingResult processDirectory(Path cellDirectory, Path outputRoot) {
        Path outputDirectory = outputDirectoryFor(cellDirectory, outputRoot);
        try {
            return group(cellDirectory, outputDirectory);
        } catch (IOException | RuntimeException e) {
            logger.error("Grouping failed for {}: {}", cellDirectory, e.getMessage(), e);
            return DirectoryGroupingResult.failure(cellDirectory, outputDirectory, 0, 0, e.toString());
        }
    }

    private DirectoryGroupingResult group(Path cellDirectory, Path outputDirectory) throws IOException {
        List<Path> files = scanner.listCellFiles(cellDirectory);
        if (files.isEmpty()) {
            logger.warn("No cell images found in {}", cellDirectory);
            return DirectoryGroupingResult.failure(cellDirectory, outputDirectory, 0, 0, "no cell images");
        }
        logger.info("Processing {} cells from {}", files.size(), cellDirectory);

        FeatureSet features = extractor.extract(files);
        if (features.isEmpty()) {
            logger.warn("No valid images to process in {}", cellDirectory);
            return DirectoryGroupingResult.failure(cellDirectory, outputDirectory, 0,
                features.unreadableCount(), "no readable cell images");
        }
        logger.info("Found {} images with zero intensity and {} with non-zero intensity",
            features.zeroCount(), features.nonZeroCount());
        if (features.allZero()) {
            logger.error("All images in {} have zero intensity, check image format or file corruption", cellDirectory);
        }

        int requestedBins = config.getBins();
        if (config.isAutoBins()) {
            requestedBins = new BicBinCountSelector(config).select(features.features()).bins();
        }

        List<CellSample> samples = features.samples();
        ClusterResult result = assigner.assign(samples, requestedBins);
        logger.info("Clustered {} cells with {} into {} bins (converged={})",
            samples.size(), result.method(), result.actualBins(), result.converged());
        List<CellGroup> groups = GroupRemapper.apply(result, samples);
        for (CellGroup group : groups) {
            logger.info("  Group {}: {} cells, mean {}={}", group.id(), group.size(), config.getMetric(),
                group.meanFeature());
        }

        Files.createDirectories(outputDirectory);
        String name = cellDirectory.getFileName().toString();
        ImageResolution resolution = referenceResolution(samples).orElse(null);

        Set<Integer> written = new TreeSet<>();
        for (CellGroup group : groups) {
            Optional<CompositeImage> composite = CompositeBuilder.build(group);
            if (composite.isEmpty()) {
                continue;
            }
            Path file = outputDirectory.resolve(binFileName(name, group.id()));
            CompositeImage image = composite.get();
            try {
                boolean withMetadata = CompositeImageWriter.write(file, image.width(), image.height(),
                    image.samples(), resolution);
                written.add(group.id());
                logger.info("Saved composite for group {} with {} cells{}: {}", group.id(), image.memberCount(),
                    withMetadata ? " and resolution metadata" : "", file);
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to write composite {}: {}", file, e.getMessage());
            }
        }
        removeStaleBins(outputDirectory, name, written);

        GroupingSummary summary = new GroupingSummary(cellDirectory, features, result, groups,
            config.getMetric(), config.isForceRedistribute());
        Path summaryFile = outputDirectory.resolve(name + "_grouping_info.txt");
        try {
            ProvenanceWriter.writeSummary(summaryFile, summary);
        } catch (IOException e) {
            logger.error("Failed to write grouping summary {}: {}", summaryFile, e.getMessage());
        }
        Path csvFile = outputDirectory.resolve(name + "_cell_groups.csv");
        try {
            ProvenanceWriter.writeCsv(csvFile, samples, groups, config.getMetric());
            logger.info("Saved cell group mapping to {}", csvFile);
        } catch (IOException e) {
            logger.error("Failed to write cell group mapping {}: {}", csvFile, e.getMessage());
        }

        boolean success = !written.isEmpty();
        return new DirectoryGroupingResult(cellDirectory, outputDirectory, success, samples.size(),
            features.unreadableCount(), result.actualBins(), result.method(), written.size(),
            success ? null : "no composites written");
    }

    /// File name of the composite for a 1-based group id.
    public static String binFileName(String directoryName, int groupId) {
        return directoryName + "_bin_" + groupId + ".tif";
    }

    private static Optional<ImageResolution> referenceResolution(List<CellSample> samples) {
        for (CellSample sample : samples) {
            if (sample.source() == null) {
                continue;
            }
            try {
                Optional<ImageResolution> resolution = CellImageReader.readResolution(sample.source());
                if (resolution.isPresent()) {
                    logger.debug("Using resolution metadata from {}: {}", sample.fileName(), resolution.get());
                    return resolution;
                }
            } catch (IOException e) {
                logger.debug("No resolution metadata in {}: {}", sample.fileName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    /// Deletes `<name>_bin_<n>.tif` files that this run did not write.
    private static void removeStaleBins(Path outputDirectory, String name, Set<Integer> written) throws IOException {
        Pattern binFile = Pattern.compile(Pattern.quote(name) + "_bin_(\\d{1,9})\\.tif");
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDirectory)) {
            for (Path entry : stream) {
                Matcher m = binFile.matcher(entry.getFileName().toString());
                if (m.matches() && !written.contains(Integer.parseInt(m.group(1)))) {
                    try {
                        Files.deleteIfExists(entry);
                        logger.info("Removed stale composite {}", entry);
                    } catch (IOException e) {
                        logger.warn("Could not remove stale composite {}: {}", entry, e.getMessage());
                    }
                }
            }
        }
    }
}
