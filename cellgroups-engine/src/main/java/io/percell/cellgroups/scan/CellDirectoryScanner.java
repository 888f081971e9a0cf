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

package io.percell.cellgroups.scan;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Discovers cell image directories laid out as
/// `<cells_root>/<condition>/<region>/CELL*.tif`.
///
/// Hidden directories (leading `.`) are skipped at both levels and a region
/// counts only when it holds at least one file matching the cell file glob.
/// Results are sorted by path so batch runs are reproducible.
public class CellDirectoryScanner {

    private static final Logger logger = LogManager.getLogger(CellDirectoryScanner.class);

    private final PathMatcher matcher;

    public CellDirectoryScanner(String cellFilePattern) {
        Objects.requireNonNull(cellFilePattern, "cellFilePattern");
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + cellFilePattern);
    }

    /// Lists region directories holding cell images under `root`.
    ///
    /// @throws IOException if `root` is not a readable directory
    public List<CellDirectory> findCellDirectories(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Cells directory does not exist or is not a directory: " + root);
        }
        List<CellDirectory> found = new ArrayList<>();
        for (Path condition : subdirectories(root)) {
            for (Path region : subdirectories(condition)) {
                if (!listCellFiles(region).isEmpty()) {
                    found.add(new CellDirectory(root, condition.getFileName().toString(), region));
                }
            }
        }
        logger.debug("Found {} cell directories under {}", found.size(), root);
        return found;
    }

    /// Keeps only directories whose root-relative path contains one of the
    /// channel names. An empty channel list keeps everything.
    public List<CellDirectory> filterByChannels(List<CellDirectory> directories, Collection<String> channels) {
        if (channels == null || channels.isEmpty()) {
            return directories;
        }
        List<CellDirectory> kept = new ArrayList<>();
        for (CellDirectory dir : directories) {
            String relative = dir.relativeName();
            boolean matches = channels.stream().anyMatch(relative::contains);
            if (matches) {
                kept.add(dir);
            } else {
                logger.info("Skipping {}: no matching channels", relative);
            }
        }
        return kept;
    }

    /// Lists the cell image files directly inside a directory, sorted by name.
    public List<Path> listCellFiles(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && matcher.matches(entry.getFileName())) {
                    files.add(entry);
                }
            }
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    private static List<Path> subdirectories(Path parent) throws IOException {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent)) {
            for (Path entry : stream) {
                if (Files.isDirectory(entry) && !entry.getFileName().toString().startsWith(".")) {
                    dirs.add(entry);
                }
            }
        }
        dirs.sort(Comparator.naturalOrder());
        return dirs;
    }
}
