package io.percell.command.common;

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


import io.percell.cellgroups.scan.CellDirectory;
import io.percell.cellgroups.scan.CellDirectoryScanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// The cells root to scan and the optional channel filter.
public class CellsDirectoryOption {

    private static final Logger logger = LogManager.getLogger(CellsDirectoryOption.class);

    @CommandLine.Option(
        names = {"-c", "--cells-dir"},
        required = true,
        description = "Root directory laid out as <condition>/<region>/CELL*.tif"
    )
    private Path cellsDir;

    @CommandLine.Option(
        names = {"--channels"},
        arity = "1..*",
        split = ",",
        description = "Only process directories whose path below the root contains one of these channel names"
    )
    private List<String> channels = new ArrayList<>();

    public Path getCellsDir() {
        return cellsDir;
    }

    public List<String> getChannels() {
        return channels;
    }

    /**
     * Finds the cell directories to process.
     * When the root holds cell images itself it is processed as a single directory.
     *
     * @param scanner scanner configured with the cell file pattern
     * @return matching directories, possibly empty
     * @throws IOException if the root cannot be read
     */
    public List<CellDirectory> discover(CellDirectoryScanner scanner) throws IOException {
        List<CellDirectory> found = scanner.findCellDirectories(cellsDir);
        if (found.isEmpty() && !scanner.listCellFiles(cellsDir).isEmpty()) {
            Path absolute = cellsDir.toAbsolutePath().normalize();
            Path parent = absolute.getParent() != null ? absolute.getParent() : absolute;
            String condition = parent.getFileName() != null ? parent.getFileName().toString() : "";
            logger.debug("{} holds cell images directly, processing it as one directory", cellsDir);
            found = List.of(new CellDirectory(parent, condition, absolute));
        }
        return scanner.filterByChannels(found, channels);
    }
}
